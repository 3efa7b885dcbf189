package com.questrail.h264meta;

import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.codec.SeiNalDecoder;
import com.questrail.h264meta.codec.impl.DefaultSeiNalDecoder;
import com.questrail.h264meta.config.SeiMetadataConfig;
import com.questrail.h264meta.config.SeiUuid;
import com.questrail.h264meta.internal.decode.MetadataDecodeException;
import com.questrail.h264meta.internal.decode.MetadataRecordDecoder;
import com.questrail.h264meta.internal.json.MetadataJson;
import com.questrail.h264meta.internal.nal.FramingMode;
import com.questrail.h264meta.internal.sei.SeiMessage;
import com.questrail.h264meta.observability.NullObservabilitySink;
import com.questrail.h264meta.observability.SeiDropEvent;
import com.questrail.h264meta.observability.SeiExtractionEvent;
import com.questrail.h264meta.observability.SeiObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SeiMetadataExtractor
 * =============================================================================
 * Recovers every {@link MetadataRecord} carried in the SEI NAL units of one
 * buffer.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   byte[]  ->  SeiMessage*  ->  (UUID filter)  ->  MetadataRecord*
 *        (SEI NAL decoder)            (record decoder)
 * </pre>
 *
 * <p>Nothing here throws on stream content. Messages of other payload types
 * are ignored. User data with a different UUID and bodies that fail UTF-8 or
 * JSON decoding are skipped and reported to the {@link SeiObservabilitySink}.
 * Records are returned in stream order; duplicates are kept.</p>
 *
 * <p>Stateless and safe to share between threads as long as the sink is.</p>
 */
public final class SeiMetadataExtractor
{
    private final SeiNalDecoder nalDecoder;
    private final MetadataRecordDecoder recordDecoder;
    private final SeiObservabilitySink observabilitySink;

    public SeiMetadataExtractor()
    {
        this(NullObservabilitySink.INSTANCE);
    }

    public SeiMetadataExtractor(SeiObservabilitySink observabilitySink)
    {
        this(new DefaultSeiNalDecoder(observabilitySink), new MetadataJson(), observabilitySink);
    }

    SeiMetadataExtractor(SeiNalDecoder nalDecoder, MetadataJson json, SeiObservabilitySink observabilitySink)
    {
        this.nalDecoder = Objects.requireNonNull(nalDecoder, "nalDecoder");
        this.recordDecoder = new MetadataRecordDecoder(Objects.requireNonNull(json, "json"));
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Extracts with {@link FramingMode#AUTO}.
     */
    public List<MetadataRecord> extractAll(byte[] data, SeiUuid wantUuid)
    {
        return extractAll(data, wantUuid, FramingMode.AUTO);
    }

    /**
     * Extracts using the UUID and framing of {@code config}.
     */
    public List<MetadataRecord> extractAll(byte[] data, SeiMetadataConfig config)
    {
        Objects.requireNonNull(config, "config");
        return extractAll(data, config.uuid(), config.framing());
    }

    public List<MetadataRecord> extractAll(byte[] data, SeiUuid wantUuid, FramingMode framing)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(wantUuid, "wantUuid");
        Objects.requireNonNull(framing, "framing");

        final List<MetadataRecord> records = new ArrayList<>();

        for (SeiMessage message : nalDecoder.decode(data, framing)) {
            if (!message.isUserDataUnregistered()) {
                continue;
            }
            if (!message.hasUuid(wantUuid)) {
                observabilitySink.onPayloadDropped(new SeiDropEvent(
                        Instant.now(),
                        SeiDropEvent.Reason.UUID_MISMATCH,
                        "uuid=" + message.uuid().map(SeiUuid::toString).orElse("?"),
                        null));
                continue;
            }

            final MetadataRecord record;
            try {
                record = recordDecoder.decode(message);
            }
            catch (MetadataDecodeException e) {
                observabilitySink.onPayloadDropped(new SeiDropEvent(
                        Instant.now(),
                        SeiDropEvent.Reason.DECODE_FAILURE,
                        e.getMessage(),
                        e));
                continue;
            }

            records.add(record);
            observabilitySink.onExtracted(new SeiExtractionEvent(Instant.now(), wantUuid, record));
        }
        return records;
    }
}
