package com.questrail.h264meta.codec.impl;

import java.io.ByteArrayOutputStream;

/**
 * SeiPayloadCoding
 * -----------------------------------------------------------------------------
 * The SEI "ff extension" coding used for both {@code payloadType} and
 * {@code payloadSize} (ITU-T H.264 §7.3.2.3.1).
 *
 * <p>A value is written as one {@code 0xFF} byte per whole 255 it contains,
 * followed by a final byte holding the remainder (0-254). Reading sums 255 for
 * each {@code 0xFF} and adds the final byte.</p>
 *
 * <pre>
 *   254 -> FE
 *   255 -> FF 00
 *   256 -> FF 01
 *   510 -> FF FF 00
 * </pre>
 */
final class SeiPayloadCoding
{
    static final int EXTENSION_BYTE = 0xFF;

    /** {@code rbsp_stop_one_bit} followed by seven alignment zero bits. */
    static final int RBSP_STOP_BYTE = 0x80;

    private SeiPayloadCoding() {}

    static void write(ByteArrayOutputStream out, int value)
    {
        if (value < 0) {
            throw new IllegalArgumentException("SEI coded value must be non-negative: " + value);
        }
        int remaining = value;
        while (remaining >= EXTENSION_BYTE) {
            out.write(EXTENSION_BYTE);
            remaining -= EXTENSION_BYTE;
        }
        out.write(remaining);
    }

    /**
     * Number of bytes {@link #write} emits for {@code value}.
     */
    static int codedLength(int value)
    {
        return value / EXTENSION_BYTE + 1;
    }

    /**
     * Incremental reader over an RBSP byte range.
     */
    static final class Reader
    {
        private final byte[] rbsp;
        private int position;

        Reader(byte[] rbsp)
        {
            this.rbsp = rbsp;
        }

        int position()
        {
            return position;
        }

        int remaining()
        {
            return rbsp.length - position;
        }

        /**
         * True when nothing but {@code rbsp_trailing_bits} (a {@code 0x80}
         * followed by zero bytes) or zero padding is left.
         */
        boolean atTrailingBits()
        {
            if (position >= rbsp.length) {
                return true;
            }
            int first = rbsp[position] & 0xFF;
            if (first != RBSP_STOP_BYTE && first != 0x00) {
                return false;
            }
            for (int i = position + 1; i < rbsp.length; i++) {
                if (rbsp[i] != 0) {
                    return false;
                }
            }
            return true;
        }

        /**
         * Reads one ff-extension coded value.
         *
         * @throws SeiPayloadException if the coding is cut off by the end of the RBSP
         */
        int readCodedValue(String field) throws SeiPayloadException
        {
            long value = 0;
            while (position < rbsp.length && (rbsp[position] & 0xFF) == EXTENSION_BYTE) {
                value += EXTENSION_BYTE;
                position++;
            }
            if (position >= rbsp.length) {
                throw new SeiPayloadException(field + " coding runs past end of RBSP");
            }
            value += rbsp[position++] & 0xFF;
            if (value > Integer.MAX_VALUE) {
                throw new SeiPayloadException(field + " out of range: " + value);
            }
            return (int) value;
        }

        byte[] readBytes(int count, String field) throws SeiPayloadException
        {
            if (count > remaining()) {
                throw new SeiPayloadException(
                        field + " of " + count + " bytes exceeds remaining " + remaining());
            }
            byte[] out = new byte[count];
            System.arraycopy(rbsp, position, out, 0, count);
            position += count;
            return out;
        }
    }
}
