package com.questrail.h264meta.config;

import com.questrail.h264meta.internal.nal.FramingMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SeiMetadataConfigTest
{
    @Test
    void defaultsAreKeyframeOnlyAutoFramingMetadataTag() {
        SeiMetadataConfig config = SeiMetadataConfig.defaults();

        assertEquals(SeiUuid.fromTag("METADATA"), config.uuid());
        assertEquals(0, config.injectEveryNFrames());
        assertEquals(FramingMode.AUTO, config.framing());
    }

    @Test
    void builderOverridesFields() {
        SeiUuid uuid = SeiUuid.parse("12345678-1234-1234-1234-1234567890ab");

        SeiMetadataConfig config = SeiMetadataConfig.builder()
                .withUuid(uuid)
                .withInjectEveryNFrames(30)
                .withFraming(FramingMode.LENGTH_PREFIXED)
                .build();

        assertEquals(uuid, config.uuid());
        assertEquals(30, config.injectEveryNFrames());
        assertEquals(FramingMode.LENGTH_PREFIXED, config.framing());
    }

    @Test
    void negativeCadenceIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> SeiMetadataConfig.builder().withInjectEveryNFrames(-1).build());
    }

    @Test
    void nullFieldsAreRejected() {
        assertThrows(NullPointerException.class,
                () -> SeiMetadataConfig.builder().withUuid(null).build());
        assertThrows(NullPointerException.class,
                () -> SeiMetadataConfig.builder().withFraming(null).build());
    }
}
