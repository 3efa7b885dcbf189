package com.questrail.h264meta.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SeiObservabilitySink that emits logs via SLF4J.
 *
 * <p>Per-frame events log at debug. Drops log at warn, except UUID mismatches,
 * which are expected whenever other producers share the stream.</p>
 */
public final class Slf4jSeiObservabilitySink implements SeiObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSeiObservabilitySink.class);

    @Override
    public void onInjected(SeiInjectionEvent event) {
        log.debug("SEI injected: frame={} keyframe={} offset={} length={}",
            event.frameIndex(),
            event.keyframe(),
            event.insertionOffset(),
            event.seiLength());
    }

    @Override
    public void onExtracted(SeiExtractionEvent event) {
        log.debug("SEI metadata extracted: uuid={} record={}", event.uuid(), event.record());
    }

    @Override
    public void onPayloadDropped(SeiDropEvent event) {
        if (event.reason() == SeiDropEvent.Reason.UUID_MISMATCH) {
            log.debug("SEI payload skipped: {} {}", event.reason(), event.detail());
            return;
        }
        log.warn("SEI payload dropped: {} {}", event.reason(), event.detail(), event.cause());
    }
}
