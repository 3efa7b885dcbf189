package com.questrail.h264meta.config;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * SeiUuid
 * -----------------------------------------------------------------------------
 * The 16-byte {@code uuid_iso_iec_11578} that opens every
 * {@code user_data_unregistered} SEI payload.
 *
 * <p>Injector and extractor must be configured with identical bytes; a
 * mismatch is not an error, extraction simply finds nothing. Values can be
 * created from raw bytes, from the RFC 4122 text form, or from a short ASCII
 * tag padded with zero bytes (for example {@code "METADATA"}).</p>
 *
 * <p>Byte arrays are copied on the way in and on the way out.</p>
 */
public final class SeiUuid
{
    public static final int LENGTH = 16;

    private static final Pattern TEXT_FORM = Pattern.compile(
            "\\p{XDigit}{8}-\\p{XDigit}{4}-\\p{XDigit}{4}-\\p{XDigit}{4}-\\p{XDigit}{12}");

    private final byte[] bytes;

    private SeiUuid(byte[] bytes)
    {
        this.bytes = bytes;
    }

    /**
     * @throws IllegalArgumentException if {@code bytes} is not exactly 16 bytes long
     */
    public static SeiUuid of(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    "SEI UUID must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new SeiUuid(bytes.clone());
    }

    public static SeiUuid of(UUID uuid)
    {
        Objects.requireNonNull(uuid, "uuid");
        byte[] out = new byte[LENGTH];
        long msb = uuid.getMostSignificantBits();
        long lsb = uuid.getLeastSignificantBits();
        for (int i = 0; i < 8; i++) {
            out[i] = (byte) (msb >>> (56 - 8 * i));
            out[8 + i] = (byte) (lsb >>> (56 - 8 * i));
        }
        return new SeiUuid(out);
    }

    /**
     * Parses the RFC 4122 text form, e.g. {@code 12345678-1234-1234-1234-1234567890ab}.
     * Hex digits must be grouped 8-4-4-4-12; either case is accepted.
     *
     * @throws IllegalArgumentException if the text is not a UUID
     */
    public static SeiUuid parse(String text)
    {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (!TEXT_FORM.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Not a UUID: " + text);
        }
        return new SeiUuid(HexFormat.of().parseHex(trimmed.replace("-", "")));
    }

    /**
     * ASCII tag, zero-padded on the right to 16 bytes.
     *
     * @throws IllegalArgumentException if the tag is empty, not ASCII, or longer than 16 bytes
     */
    public static SeiUuid fromTag(String tag)
    {
        Objects.requireNonNull(tag, "tag");
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("SEI UUID tag must not be empty");
        }
        if (!StandardCharsets.US_ASCII.newEncoder().canEncode(tag)) {
            throw new IllegalArgumentException("SEI UUID tag must be ASCII: " + tag);
        }
        byte[] ascii = tag.getBytes(StandardCharsets.US_ASCII);
        if (ascii.length > LENGTH) {
            throw new IllegalArgumentException(
                    "SEI UUID tag longer than " + LENGTH + " bytes: " + tag);
        }
        return new SeiUuid(Arrays.copyOf(ascii, LENGTH));
    }

    /**
     * Returns a copy of the 16 UUID bytes.
     */
    public byte[] toByteArray()
    {
        return bytes.clone();
    }

    /**
     * Compares against {@code data[offset, offset + 16)} without copying.
     */
    public boolean matches(byte[] data, int offset)
    {
        if (offset < 0 || data.length - offset < LENGTH) {
            return false;
        }
        return Arrays.equals(bytes, 0, LENGTH, data, offset, offset + LENGTH);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof SeiUuid that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(bytes);
    }

    /**
     * RFC 4122 grouped hex, e.g. {@code 4d455441-4441-5441-0000-000000000000}.
     */
    @Override
    public String toString()
    {
        String hex = HexFormat.of().formatHex(bytes);
        return hex.substring(0, 8) + '-'
                + hex.substring(8, 12) + '-'
                + hex.substring(12, 16) + '-'
                + hex.substring(16, 20) + '-'
                + hex.substring(20);
    }
}
