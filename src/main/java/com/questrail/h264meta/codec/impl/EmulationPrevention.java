package com.questrail.h264meta.codec.impl;

import java.util.Arrays;
import java.util.Objects;

/**
 * EmulationPrevention
 * -----------------------------------------------------------------------------
 * Inserts and removes H.264 emulation prevention bytes (ITU-T H.264 §7.4.1).
 *
 * <p>Inside a NAL unit the byte patterns {@code 00 00 00}, {@code 00 00 01},
 * {@code 00 00 02} and {@code 00 00 03} must not appear, or a decoder would
 * see a start code. The encoder breaks them up by writing {@code 0x03} after
 * every run of two zero bytes that is followed by a byte in {@code 0x00-0x03}.
 * The decoder drops a {@code 0x03} that follows two zero bytes.</p>
 *
 * <p>Both directions are single-pass and stateless between calls.
 * {@code decode(encode(x))} equals {@code x} for every input.</p>
 */
final class EmulationPrevention
{
    static final int EMULATION_PREVENTION_BYTE = 0x03;

    private EmulationPrevention() {}

    /**
     * RBSP to EBSP: adds emulation prevention bytes.
     */
    static byte[] encode(byte[] rbsp)
    {
        Objects.requireNonNull(rbsp, "rbsp");

        // Worst case: one escape per two input bytes.
        byte[] out = new byte[rbsp.length + rbsp.length / 2 + 1];
        int w = 0;
        int zeros = 0;

        for (byte value : rbsp) {
            int b = value & 0xFF;
            if (zeros >= 2 && b <= EMULATION_PREVENTION_BYTE) {
                out[w++] = (byte) EMULATION_PREVENTION_BYTE;
                zeros = 0;
            }
            out[w++] = value;
            zeros = (b == 0) ? zeros + 1 : 0;
        }

        return Arrays.copyOf(out, w);
    }

    /**
     * EBSP to RBSP: removes emulation prevention bytes.
     */
    static byte[] decode(byte[] ebsp)
    {
        Objects.requireNonNull(ebsp, "ebsp");
        return decode(ebsp, 0, ebsp.length);
    }

    /**
     * Decodes {@code ebsp[from, to)} without copying the range first.
     */
    static byte[] decode(byte[] ebsp, int from, int to)
    {
        Objects.checkFromToIndex(from, to, ebsp.length);

        // Output cannot be larger than input; allocate and shrink.
        byte[] out = new byte[to - from];
        int w = 0;
        int zeros = 0;

        for (int r = from; r < to; r++) {
            int b = ebsp[r] & 0xFF;
            if (zeros >= 2 && b == EMULATION_PREVENTION_BYTE) {
                // Escape byte: drop it. The byte that follows is data even if it is 0-3.
                zeros = 0;
                continue;
            }
            out[w++] = (byte) b;
            zeros = (b == 0) ? zeros + 1 : 0;
        }

        return (w == out.length) ? out : Arrays.copyOf(out, w);
    }
}
