package com.questrail.h264meta.observability;

import java.time.Instant;

/**
 * Record describing an SEI payload that extraction skipped.
 *
 * @param cause the underlying failure, or {@code null} when there is none
 */
public record SeiDropEvent(
    Instant timestamp,
    Reason reason,
    String detail,
    Throwable cause
) {
    public enum Reason {
        /** Type or size coding ran past the end of the NAL unit; the rest of the unit was abandoned. */
        MALFORMED_SEI_PAYLOAD,
        /** A user_data_unregistered message carried a different UUID. */
        UUID_MISMATCH,
        /** UTF-8 or JSON decoding of a matching payload failed. */
        DECODE_FAILURE
    }
}
