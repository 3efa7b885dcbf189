package com.questrail.h264meta.observability;

import java.time.Instant;

/**
 * Record describing one SEI injection into an access unit.
 *
 * @param frameIndex      value of the injector's frame counter for this access unit
 * @param keyframe        whether the host flagged the access unit as a keyframe
 * @param insertionOffset byte offset at which the SEI NAL unit was inserted
 * @param seiLength       length in bytes of the inserted NAL unit, start code included
 */
public record SeiInjectionEvent(
    Instant timestamp,
    long frameIndex,
    boolean keyframe,
    int insertionOffset,
    int seiLength
) {
}
