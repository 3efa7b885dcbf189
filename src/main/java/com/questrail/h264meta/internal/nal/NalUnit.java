package com.questrail.h264meta.internal.nal;

/**
 * NalUnit
 * -----------------------------------------------------------------------------
 * Transient view of one NAL unit inside a caller-owned byte buffer.
 *
 * <p>A {@code NalUnit} holds offsets only; it never copies or owns the buffer
 * it was scanned from. Offsets are absolute indices into that buffer:</p>
 * <ul>
 *   <li>{@code startOffset} - first byte of the start code (or length prefix)</li>
 *   <li>{@code payloadOffset} - the NAL header byte</li>
 *   <li>{@code endOffset} - exclusive end of the NAL unit</li>
 * </ul>
 *
 * <p>{@code startCodeLength} is 3 or 4 for Annex-B start codes and 4 for a
 * big-endian length prefix.</p>
 */
public record NalUnit(
        int startOffset,
        int payloadOffset,
        int endOffset,
        int startCodeLength,
        int nalType
) {
    public NalUnit {
        if (startOffset < 0 || startOffset >= payloadOffset || payloadOffset > endOffset) {
            throw new IllegalArgumentException(
                    "Invalid NAL offsets: start=" + startOffset
                            + " payload=" + payloadOffset
                            + " end=" + endOffset);
        }
        if (startCodeLength != 3 && startCodeLength != 4) {
            throw new IllegalArgumentException("startCodeLength must be 3 or 4: " + startCodeLength);
        }
        if (nalType < 0 || nalType > 31) {
            throw new IllegalArgumentException("nalType must be 0-31: " + nalType);
        }
    }

    /**
     * Offset of the first byte after the one-byte NAL header.
     */
    public int rbspOffset() {
        return Math.min(payloadOffset + 1, endOffset);
    }

    /**
     * Total length in bytes including the start code or length prefix.
     */
    public int length() {
        return endOffset - startOffset;
    }

    public boolean isVcl() {
        return NalUnitType.isVcl(nalType);
    }

    @Override
    public String toString() {
        return "NalUnit[" +
                "type=" + nalType + " (" + NalUnitType.name(nalType) + ")" +
                ", start=" + startOffset +
                ", payload=" + payloadOffset +
                ", end=" + endOffset +
                ", startCode=" + startCodeLength +
                ']';
    }
}
