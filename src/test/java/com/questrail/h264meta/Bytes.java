package com.questrail.h264meta;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Byte helpers for building access units in tests.
 */
public final class Bytes
{
    private Bytes() {}

    /**
     * Parses hex text; spaces are ignored.
     */
    public static byte[] hex(String text)
    {
        return HexFormat.of().parseHex(text.replace(" ", ""));
    }

    public static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    /**
     * Typical IDR access unit: AUD, SPS, PPS, IDR slice.
     */
    public static byte[] idrAccessUnit()
    {
        return hex("00000001 09 F0"
                + "00000001 67 42 C0 1E DA"
                + "00000001 68 CE 3C 80"
                + "00000001 65 88 84 21 A0");
    }

    /**
     * Non-IDR slice unit (header 0x41) of exactly {@code length} bytes.
     */
    public static byte[] sliceOfLength(int length)
    {
        byte[] unit = new byte[length];
        Arrays.fill(unit, (byte) 0x88);
        unit[0] = 0x41;
        return unit;
    }

    /**
     * Frames each unit with a 4-byte big-endian length.
     */
    public static byte[] lengthPrefixed(byte[]... units)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] unit : units) {
            out.writeBytes(ByteBuffer.allocate(4).putInt(unit.length).array());
            out.writeBytes(unit);
        }
        return out.toByteArray();
    }
}
