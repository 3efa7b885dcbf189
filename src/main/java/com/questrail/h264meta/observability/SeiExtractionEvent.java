package com.questrail.h264meta.observability;

import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.config.SeiUuid;

import java.time.Instant;

/**
 * Record describing one metadata record recovered from an SEI message.
 */
public record SeiExtractionEvent(
    Instant timestamp,
    SeiUuid uuid,
    MetadataRecord record
) {
}
