package com.questrail.h264meta;

import com.questrail.h264meta.api.EncodedFrame;
import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.api.MetadataValue;
import com.questrail.h264meta.codec.SeiNalEncoder;
import com.questrail.h264meta.codec.impl.DefaultSeiNalEncoder;
import com.questrail.h264meta.config.SeiMetadataConfig;
import com.questrail.h264meta.internal.encode.MetadataRecordEncoder;
import com.questrail.h264meta.internal.insert.InsertionPointPolicy;
import com.questrail.h264meta.internal.json.MetadataJson;
import com.questrail.h264meta.internal.nal.FramingMode;
import com.questrail.h264meta.internal.nal.NalUnitScanner;
import com.questrail.h264meta.observability.NullObservabilitySink;
import com.questrail.h264meta.observability.SeiInjectionEvent;
import com.questrail.h264meta.observability.SeiObservabilitySink;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SeiMetadataInjector
 * =============================================================================
 * Host-facing adapter that splices metadata SEI NAL units into encoded access
 * units and reads them back out.
 *
 * <h2>Cadence</h2>
 * Every call to {@code inject} advances a frame counter by one; the first
 * frame is frame 1. A frame receives an SEI when it is a keyframe, or when
 * {@code injectEveryNFrames = n > 0} and {@code counter % n == 0}. Frames that
 * do not qualify are returned as the very same instance, untouched.
 *
 * <h2>Payload</h2>
 * The metadata is written with one extra key, {@value #FRAME_KEY}, set to the
 * counter value. It replaces any {@value #FRAME_KEY} entry supplied by the
 * caller.
 *
 * <h2>Placement</h2>
 * The SEI NAL unit goes after AUD, SPS, PPS and existing SEI units and before
 * the first coded slice (see {@link InsertionPointPolicy}). It uses the
 * framing of the buffer it is inserted into.
 *
 * <h2>Threading</h2>
 * The counter is an {@link AtomicLong}: the increment and the cadence decision
 * read the same value, so concurrent callers each see a distinct frame index.
 */
public final class SeiMetadataInjector
{
    /** Reserved metadata key carrying the frame counter. */
    public static final String FRAME_KEY = "frame";

    private final SeiMetadataConfig config;
    private final SeiObservabilitySink observabilitySink;
    private final SeiNalEncoder nalEncoder;
    private final MetadataRecordEncoder recordEncoder;
    private final SeiMetadataExtractor extractor;

    private final AtomicLong frameCounter = new AtomicLong();

    public SeiMetadataInjector(SeiMetadataConfig config)
    {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public SeiMetadataInjector(SeiMetadataConfig config, SeiObservabilitySink observabilitySink)
    {
        this(config, observabilitySink, new DefaultSeiNalEncoder());
    }

    public SeiMetadataInjector(SeiMetadataConfig config,
                               SeiObservabilitySink observabilitySink,
                               SeiNalEncoder nalEncoder)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.nalEncoder = Objects.requireNonNull(nalEncoder, "nalEncoder");

        MetadataJson json = new MetadataJson();
        this.recordEncoder = new MetadataRecordEncoder(config.uuid(), json);
        this.extractor = new SeiMetadataExtractor(observabilitySink);
    }

    public SeiMetadataConfig config()
    {
        return config;
    }

    /**
     * Number of frames passed to {@code inject} so far.
     */
    public long framesSeen()
    {
        return frameCounter.get();
    }

    /**
     * Processes one access unit.
     *
     * @return {@code data} itself when the frame does not qualify, otherwise a
     *         new array holding the access unit with the SEI spliced in
     */
    public byte[] inject(byte[] data, boolean keyframe, MetadataRecord metadata)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(metadata, "metadata");

        final long frame = frameCounter.incrementAndGet();
        if (!shouldInject(frame, keyframe)) {
            return data;
        }

        final FramingMode framing = NalUnitScanner.resolve(data, config.framing());
        final MetadataRecord stamped = metadata.with(FRAME_KEY, MetadataValue.of(frame));
        final byte[] sei = nalEncoder.encode(recordEncoder.encode(stamped), framing);

        final int offset = InsertionPointPolicy.findInsertionPoint(NalUnitScanner.scanAll(data, framing));

        final byte[] out = new byte[data.length + sei.length];
        System.arraycopy(data, 0, out, 0, offset);
        System.arraycopy(sei, 0, out, offset, sei.length);
        System.arraycopy(data, offset, out, offset + sei.length, data.length - offset);

        observabilitySink.onInjected(new SeiInjectionEvent(
                Instant.now(), frame, keyframe, offset, sei.length));
        return out;
    }

    /**
     * Frame-level variant of {@link #inject(byte[], boolean, MetadataRecord)}.
     * Pass-through frames are returned as the same instance; a rewritten frame
     * keeps every attribute except its data.
     */
    public EncodedFrame inject(EncodedFrame frame, MetadataRecord metadata)
    {
        Objects.requireNonNull(frame, "frame");
        final byte[] data = frame.data();
        final byte[] out = inject(data, frame.keyframe(), metadata);
        return (out == data) ? frame : frame.withData(out);
    }

    /**
     * Reads back every record carrying this injector's UUID.
     */
    public List<MetadataRecord> extract(byte[] data)
    {
        return extractor.extractAll(data, config);
    }

    private boolean shouldInject(long frame, boolean keyframe)
    {
        final int n = config.injectEveryNFrames();
        return keyframe || (n > 0 && frame % n == 0);
    }
}
