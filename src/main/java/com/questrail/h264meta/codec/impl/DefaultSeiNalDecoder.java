package com.questrail.h264meta.codec.impl;

import com.questrail.h264meta.codec.SeiNalDecoder;
import com.questrail.h264meta.internal.nal.FramingMode;
import com.questrail.h264meta.internal.nal.NalUnit;
import com.questrail.h264meta.internal.nal.NalUnitCursor;
import com.questrail.h264meta.internal.nal.NalUnitScanner;
import com.questrail.h264meta.internal.nal.NalUnitType;
import com.questrail.h264meta.internal.sei.SeiMessage;
import com.questrail.h264meta.observability.NullObservabilitySink;
import com.questrail.h264meta.observability.SeiDropEvent;
import com.questrail.h264meta.observability.SeiObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DefaultSeiNalDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SeiNalDecoder}.
 *
 * <p>For each SEI NAL unit found by the scanner, in order:</p>
 * <ol>
 *   <li>Remove emulation prevention from the bytes after the NAL header</li>
 *   <li>Read ff-extension coded payloadType and payloadSize</li>
 *   <li>Slice payloadSize bytes as the message payload</li>
 *   <li>Repeat until only RBSP trailing bits remain</li>
 * </ol>
 *
 * <p>A type/size/payload that runs past the end of the unit abandons that
 * unit. Messages already read from it are kept.</p>
 */
public final class DefaultSeiNalDecoder implements SeiNalDecoder
{
    private final SeiObservabilitySink observabilitySink;

    public DefaultSeiNalDecoder()
    {
        this(NullObservabilitySink.INSTANCE);
    }

    public DefaultSeiNalDecoder(SeiObservabilitySink observabilitySink)
    {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    @Override
    public List<SeiMessage> decode(byte[] data, FramingMode framing)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(framing, "framing");

        final List<SeiMessage> messages = new ArrayList<>();
        final NalUnitCursor cursor = NalUnitScanner.scan(data, framing);

        while (cursor.hasNext()) {
            final NalUnit unit = cursor.next();
            if (unit.nalType() != NalUnitType.SEI) {
                continue;
            }

            final byte[] rbsp = EmulationPrevention.decode(data, unit.rbspOffset(), unit.endOffset());
            try {
                readMessages(rbsp, messages);
            }
            catch (SeiPayloadException e) {
                // Wire-level failure: drop the rest of this NAL unit only.
                observabilitySink.onPayloadDropped(new SeiDropEvent(
                        Instant.now(),
                        SeiDropEvent.Reason.MALFORMED_SEI_PAYLOAD,
                        "SEI NAL at offset " + unit.startOffset() + ": " + e.getMessage(),
                        e));
            }
        }
        return messages;
    }

    static void readMessages(byte[] rbsp, List<SeiMessage> out) throws SeiPayloadException
    {
        final SeiPayloadCoding.Reader reader = new SeiPayloadCoding.Reader(rbsp);

        while (!reader.atTrailingBits()) {
            final int payloadType = reader.readCodedValue("payloadType");
            final int payloadSize = reader.readCodedValue("payloadSize");
            final byte[] payload = reader.readBytes(payloadSize, "payload");
            out.add(new SeiMessage(payloadType, payload));
        }
    }
}
