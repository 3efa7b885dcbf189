package com.questrail.h264meta.internal.sei;

import com.questrail.h264meta.config.SeiUuid;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * SeiMessage
 * -----------------------------------------------------------------------------
 * One {@code sei_message()} after emulation prevention has been removed.
 *
 * <p>The payload holds exactly {@code payloadSize} bytes. For
 * {@code user_data_unregistered} (payloadType 5) the first 16 bytes are the
 * UUID and the remainder is the application body.</p>
 *
 * <p>Byte arrays are copied on the way in and on the way out.</p>
 */
public final class SeiMessage
{
    /** payloadType of {@code user_data_unregistered}. */
    public static final int USER_DATA_UNREGISTERED = 5;

    private final int payloadType;
    private final byte[] payload;

    public SeiMessage(int payloadType, byte[] payload)
    {
        if (payloadType < 0) {
            throw new IllegalArgumentException("payloadType must be non-negative: " + payloadType);
        }
        this.payloadType = payloadType;
        this.payload = Objects.requireNonNull(payload, "payload").clone();
    }

    /**
     * Builds a {@code user_data_unregistered} message: UUID followed by {@code body}.
     */
    public static SeiMessage userDataUnregistered(SeiUuid uuid, byte[] body)
    {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(body, "body");

        byte[] payload = new byte[SeiUuid.LENGTH + body.length];
        System.arraycopy(uuid.toByteArray(), 0, payload, 0, SeiUuid.LENGTH);
        System.arraycopy(body, 0, payload, SeiUuid.LENGTH, body.length);
        return new SeiMessage(USER_DATA_UNREGISTERED, payload);
    }

    public int payloadType()
    {
        return payloadType;
    }

    public int payloadSize()
    {
        return payload.length;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    /**
     * True for payloadType 5 with room for the 16-byte UUID.
     */
    public boolean isUserDataUnregistered()
    {
        return payloadType == USER_DATA_UNREGISTERED && payload.length >= SeiUuid.LENGTH;
    }

    /**
     * The UUID of a {@code user_data_unregistered} message.
     */
    public Optional<SeiUuid> uuid()
    {
        if (!isUserDataUnregistered()) {
            return Optional.empty();
        }
        return Optional.of(SeiUuid.of(Arrays.copyOf(payload, SeiUuid.LENGTH)));
    }

    public boolean hasUuid(SeiUuid uuid)
    {
        return isUserDataUnregistered() && uuid.matches(payload, 0);
    }

    /**
     * The bytes after the UUID, or an empty array for other payload types.
     */
    public byte[] userData()
    {
        if (!isUserDataUnregistered()) {
            return new byte[0];
        }
        return Arrays.copyOfRange(payload, SeiUuid.LENGTH, payload.length);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof SeiMessage that)) return false;
        return payloadType == that.payloadType && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode()
    {
        return 31 * payloadType + Arrays.hashCode(payload);
    }

    @Override
    public String toString()
    {
        return "SeiMessage[" +
                "payloadType=" + payloadType +
                ", payloadSize=" + payload.length +
                ']';
    }
}
