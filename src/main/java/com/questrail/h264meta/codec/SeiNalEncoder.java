package com.questrail.h264meta.codec;

import com.questrail.h264meta.config.SeiUuid;
import com.questrail.h264meta.internal.nal.FramingMode;
import com.questrail.h264meta.internal.sei.SeiMessage;

/**
 * SeiNalEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for a single SEI NAL unit.
 *
 * <p>This interface defines the outbound wire-mechanics boundary between a
 * structured {@link SeiMessage} and the bytes spliced into an access unit.
 * The encoder applies only the mechanical rules of:</p>
 * <ul>
 *   <li>ff-extension coding of payloadType and payloadSize</li>
 *   <li>RBSP trailing bits</li>
 *   <li>Emulation prevention</li>
 *   <li>Start code (or length prefix) and NAL header</li>
 * </ul>
 *
 * <p>Deciding <em>what</em> to send (metadata, UUID, frame index) happens
 * above this layer.</p>
 */
public interface SeiNalEncoder
{
    /**
     * Builds the Annex-B NAL unit for a {@code user_data_unregistered} message
     * holding {@code uuid} followed by {@code body}.
     */
    default byte[] build(SeiUuid uuid, byte[] body)
    {
        return encode(SeiMessage.userDataUnregistered(uuid, body));
    }

    /**
     * Encodes {@code message} as an Annex-B NAL unit opening with
     * {@code 00 00 00 01 06}.
     */
    default byte[] encode(SeiMessage message)
    {
        return encode(message, FramingMode.ANNEX_B);
    }

    /**
     * Encodes {@code message} for the given framing. {@link FramingMode#LENGTH_PREFIXED}
     * replaces the start code with a 4-byte big-endian length.
     *
     * @throws IllegalArgumentException for {@link FramingMode#AUTO}
     */
    byte[] encode(SeiMessage message, FramingMode framing);
}
