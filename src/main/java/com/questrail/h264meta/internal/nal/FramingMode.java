package com.questrail.h264meta.internal.nal;

/**
 * How NAL units are delimited inside a buffer handed over by the host.
 */
public enum FramingMode
{
    /** {@code 00 00 01} / {@code 00 00 00 01} start codes (ITU-T H.264 Annex B). */
    ANNEX_B,

    /** Each NAL unit preceded by a 4-byte big-endian length (AVCC style, as produced by some depayloaders). */
    LENGTH_PREFIXED,

    /**
     * Decide per buffer. A buffer that opens with {@code 00 00 00 01} is
     * Annex-B. A buffer that opens with {@code 00 00 01} is length-prefixed
     * only if reading it that way consumes every byte exactly, and Annex-B
     * otherwise. Any other buffer has its first four bytes read as a
     * big-endian length and is length-prefixed when that value lies strictly
     * between 0 and the buffer length.
     */
    AUTO
}
