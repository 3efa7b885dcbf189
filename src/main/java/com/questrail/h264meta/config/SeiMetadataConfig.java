package com.questrail.h264meta.config;

import com.questrail.h264meta.internal.nal.FramingMode;

import java.util.Objects;

/**
 * Configuration shared by the SEI metadata injector and extractor.
 *
 * @param uuid               16-byte identifier written into, and required from, every payload
 * @param injectEveryNFrames 0 for keyframes only; n &gt; 0 also injects on every n-th frame
 * @param framing            how access units are framed; {@link FramingMode#AUTO} decides per buffer
 */
public record SeiMetadataConfig(
    SeiUuid uuid,
    int injectEveryNFrames,
    FramingMode framing
) {
    public static final SeiUuid DEFAULT_UUID = SeiUuid.fromTag("METADATA");

    public SeiMetadataConfig {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(framing, "framing");
        if (injectEveryNFrames < 0) {
            throw new IllegalArgumentException(
                "injectEveryNFrames must be >= 0: " + injectEveryNFrames);
        }
    }

    public static SeiMetadataConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SeiUuid uuid = DEFAULT_UUID;
        private int injectEveryNFrames = 0;
        private FramingMode framing = FramingMode.AUTO;

        public Builder withUuid(SeiUuid uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder withInjectEveryNFrames(int injectEveryNFrames) {
            this.injectEveryNFrames = injectEveryNFrames;
            return this;
        }

        public Builder withFraming(FramingMode framing) {
            this.framing = framing;
            return this;
        }

        public SeiMetadataConfig build() {
            return new SeiMetadataConfig(uuid, injectEveryNFrames, framing);
        }
    }
}
