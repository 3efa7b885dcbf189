package com.questrail.h264meta.internal.nal;

import java.util.List;
import java.util.Objects;

/**
 * NalUnitScanner
 * -----------------------------------------------------------------------------
 * Locates NAL units in a byte buffer.
 *
 * <p>Two framings are understood:</p>
 * <ul>
 *   <li>Annex-B byte stream: units delimited by {@code 00 00 01} or
 *       {@code 00 00 00 01}. A zero byte immediately before a 3-byte start code
 *       is taken as part of a 4-byte start code.</li>
 *   <li>Length-prefixed: each unit preceded by a 4-byte big-endian length.</li>
 * </ul>
 *
 * <p>The scanner never throws on malformed input. Leading bytes before the
 * first start code are skipped; a start code or length prefix that runs past
 * the end of the buffer ends the scan.</p>
 *
 * <p>Scanning is lazy: {@link #scan(byte[], FramingMode)} returns a
 * {@link NalUnitCursor} that finds units on demand. A cursor cannot be rewound;
 * call {@code scan} again to restart.</p>
 */
public final class NalUnitScanner
{
    private NalUnitScanner() {}

    /**
     * Scans with {@link FramingMode#AUTO}.
     */
    public static NalUnitCursor scan(byte[] data)
    {
        return scan(data, FramingMode.AUTO);
    }

    public static NalUnitCursor scan(byte[] data, FramingMode mode)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(mode, "mode");
        return new NalUnitCursor(data, resolve(data, mode));
    }

    /**
     * Eagerly scans the whole buffer. Convenience for callers that need random
     * access to the units of one access unit.
     */
    public static List<NalUnit> scanAll(byte[] data, FramingMode mode)
    {
        return scan(data, mode).toList();
    }

    /**
     * Resolves {@link FramingMode#AUTO} to a concrete framing for {@code data}.
     * Concrete modes are returned unchanged.
     */
    public static FramingMode resolve(byte[] data, FramingMode mode)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(mode, "mode");

        if (mode != FramingMode.AUTO) {
            return mode;
        }
        if (startsWithFourByteStartCode(data)) {
            return FramingMode.ANNEX_B;
        }
        if (startsWithThreeByteStartCode(data)) {
            // 00 00 01 xx is also the length field of a 256..511 byte unit.
            return consumedExactlyAsLengthPrefixed(data)
                    ? FramingMode.LENGTH_PREFIXED
                    : FramingMode.ANNEX_B;
        }
        if (data.length > 4) {
            long first = readUint32(data, 0);
            if (first > 0 && first < data.length) {
                return FramingMode.LENGTH_PREFIXED;
            }
        }
        return FramingMode.ANNEX_B;
    }

    /**
     * Returns the index of the first {@code 00 00 01} triple at or after
     * {@code fromInclusive}, or -1 if there is none.
     */
    static int findStartCode(byte[] data, int fromInclusive)
    {
        for (int i = Math.max(0, fromInclusive); i + 2 < data.length; i++) {
            if ((data[i + 2] & 0xFF) > 1) {
                // Neither of the next two positions can begin a start code ending here.
                i += 2;
                continue;
            }
            if (data[i] == 0 && data[i + 1] == 0 && data[i + 2] == 1) {
                return i;
            }
        }
        return -1;
    }

    static long readUint32(byte[] data, int offset)
    {
        return ((long) (data[offset] & 0xFF) << 24)
                | ((data[offset + 1] & 0xFF) << 16)
                | ((data[offset + 2] & 0xFF) << 8)
                | (data[offset + 3] & 0xFF);
    }

    private static boolean startsWithThreeByteStartCode(byte[] data)
    {
        return data.length >= 3 && data[0] == 0 && data[1] == 0 && data[2] == 1;
    }

    private static boolean startsWithFourByteStartCode(byte[] data)
    {
        return data.length >= 4 && data[0] == 0 && data[1] == 0 && data[2] == 0 && data[3] == 1;
    }

    /**
     * True if the buffer reads as a sequence of non-empty length-prefixed units
     * that ends exactly at the end of the buffer.
     */
    static boolean consumedExactlyAsLengthPrefixed(byte[] data)
    {
        int position = 0;
        while (position + 4 <= data.length) {
            long length = readUint32(data, position);
            if (length <= 0 || position + 4 + length > data.length) {
                return false;
            }
            position += 4 + (int) length;
        }
        return position == data.length && position > 0;
    }
}
