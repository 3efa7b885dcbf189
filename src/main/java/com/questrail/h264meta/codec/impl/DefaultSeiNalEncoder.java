package com.questrail.h264meta.codec.impl;

import com.questrail.h264meta.codec.SeiNalEncoder;
import com.questrail.h264meta.internal.nal.FramingMode;
import com.questrail.h264meta.internal.nal.NalUnitType;
import com.questrail.h264meta.internal.sei.SeiMessage;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * DefaultSeiNalEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SeiNalEncoder}.
 *
 * <p>Produces one SEI NAL unit holding exactly one message:</p>
 * <pre>
 *   00 00 00 01 | 06 | EP( type | size | payload | 80 )
 * </pre>
 *
 * <p>Pure and deterministic; safe to share between threads.</p>
 */
public final class DefaultSeiNalEncoder implements SeiNalEncoder
{
    /** forbidden_zero_bit 0, nal_ref_idc 0, nal_unit_type 6. */
    static final int SEI_NAL_HEADER = NalUnitType.SEI;

    @Override
    public byte[] encode(SeiMessage message, FramingMode framing)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(framing, "framing");
        if (framing == FramingMode.AUTO) {
            throw new IllegalArgumentException("SEI encoding needs a concrete framing mode");
        }

        // ---------------------------------------------------------------------
        // 1) Canonical RBSP:
        //    [ payloadType ][ payloadSize ][ payload... ][ 0x80 ]
        // ---------------------------------------------------------------------

        final byte[] payload = message.payload();
        final ByteArrayOutputStream rbsp = new ByteArrayOutputStream(
                SeiPayloadCoding.codedLength(message.payloadType())
                        + SeiPayloadCoding.codedLength(payload.length)
                        + payload.length
                        + 1);

        SeiPayloadCoding.write(rbsp, message.payloadType());
        SeiPayloadCoding.write(rbsp, payload.length);
        rbsp.writeBytes(payload);
        rbsp.write(SeiPayloadCoding.RBSP_STOP_BYTE);

        // ---------------------------------------------------------------------
        // 2) Emulation prevention (the NAL header byte is never escaped)
        // ---------------------------------------------------------------------

        final byte[] ebsp = EmulationPrevention.encode(rbsp.toByteArray());

        // ---------------------------------------------------------------------
        // 3) Start code or length prefix, then NAL header
        // ---------------------------------------------------------------------

        final byte[] nal = new byte[4 + 1 + ebsp.length];
        if (framing == FramingMode.ANNEX_B) {
            nal[3] = 0x01;
        }
        else {
            final int length = 1 + ebsp.length;
            nal[0] = (byte) (length >>> 24);
            nal[1] = (byte) (length >>> 16);
            nal[2] = (byte) (length >>> 8);
            nal[3] = (byte) length;
        }
        nal[4] = (byte) SEI_NAL_HEADER;
        System.arraycopy(ebsp, 0, nal, 5, ebsp.length);
        return nal;
    }
}
