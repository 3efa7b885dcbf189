package com.questrail.h264meta;

import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.codec.impl.DefaultSeiNalEncoder;
import com.questrail.h264meta.config.SeiUuid;
import com.questrail.h264meta.internal.encode.MetadataRecordEncoder;
import com.questrail.h264meta.internal.json.MetadataJson;
import com.questrail.h264meta.internal.nal.FramingMode;
import com.questrail.h264meta.internal.sei.SeiMessage;
import com.questrail.h264meta.observability.RecordingObservabilitySink;
import com.questrail.h264meta.observability.SeiDropEvent;
import com.questrail.h264meta.observability.SeiExtractionEvent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static com.questrail.h264meta.Bytes.concat;
import static com.questrail.h264meta.Bytes.hex;
import static org.junit.jupiter.api.Assertions.*;

final class SeiMetadataExtractorTest
{
    private static final SeiUuid UUID_A = SeiUuid.parse("aaaaaaaa-0000-0000-0000-000000000001");
    private static final SeiUuid UUID_B = SeiUuid.parse("bbbbbbbb-0000-0000-0000-000000000002");

    private final DefaultSeiNalEncoder nalEncoder = new DefaultSeiNalEncoder();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final SeiMetadataExtractor extractor = new SeiMetadataExtractor(sink);

    private byte[] seiNal(SeiUuid uuid, MetadataRecord record) {
        return nalEncoder.encode(new MetadataRecordEncoder(uuid, new MetadataJson()).encode(record));
    }

    private byte[] rawSeiNal(SeiUuid uuid, String body) {
        return nalEncoder.encode(SeiMessage.userDataUnregistered(uuid, body.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void builtNalExtractsBackToSameRecord() {
        MetadataRecord record = MetadataRecord.builder().put("user", "a").put("frame", 1L).build();

        assertEquals(List.of(record), extractor.extractAll(seiNal(UUID_A, record), UUID_A));
        assertTrue(sink.hasEventOfType(SeiExtractionEvent.class));
    }

    @Test
    void otherUuidIsSkippedAndReported() {
        byte[] data = seiNal(UUID_A, MetadataRecord.builder().put("x", 1L).build());

        assertTrue(extractor.extractAll(data, UUID_B).isEmpty());
        assertEquals(1, extractor.extractAll(data, UUID_A).size());
        assertTrue(sink.hasDrop(SeiDropEvent.Reason.UUID_MISMATCH));
    }

    @Test
    void twoSeiUnitsOnlyMatchingUuidIsReturned() {
        MetadataRecord forA = MetadataRecord.builder().put("for", "a").build();
        MetadataRecord forB = MetadataRecord.builder().put("for", "b").build();
        byte[] data = concat(seiNal(UUID_A, forA), seiNal(UUID_B, forB), hex("00 00 00 01 65 88 84"));

        assertEquals(List.of(forA), extractor.extractAll(data, UUID_A));
        assertEquals(List.of(forB), extractor.extractAll(data, UUID_B));
    }

    @Test
    void recordsComeBackInStreamOrderWithDuplicates() {
        MetadataRecord one = MetadataRecord.builder().put("n", 1L).build();
        MetadataRecord two = MetadataRecord.builder().put("n", 2L).build();
        byte[] data = concat(
                seiNal(UUID_A, one),
                seiNal(UUID_B, two),
                seiNal(UUID_A, two),
                seiNal(UUID_A, two),
                hex("00 00 00 01 65 88 84"));

        assertEquals(List.of(one, two, two), extractor.extractAll(data, UUID_A));
    }

    @Test
    void undecodableBodyIsDroppedAndOthersContinue() {
        MetadataRecord good = MetadataRecord.builder().put("ok", true).build();
        byte[] data = concat(
                rawSeiNal(UUID_A, "not json"),
                rawSeiNal(UUID_A, "[1,2]"),
                seiNal(UUID_A, good));

        assertEquals(List.of(good), extractor.extractAll(data, UUID_A));
        assertEquals(2, sink.getDrops().stream()
                .filter(d -> d.reason() == SeiDropEvent.Reason.DECODE_FAILURE)
                .count());
    }

    @Test
    void otherPayloadTypesAreIgnoredSilently() {
        byte[] data = hex("00 00 00 01 06 01 01 42 80");

        assertTrue(extractor.extractAll(data, UUID_A).isEmpty());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void extractsFromLengthPrefixedBuffer() {
        MetadataRecord record = MetadataRecord.builder().put("user", "b").build();
        byte[] sei = nalEncoder.encode(
                new MetadataRecordEncoder(UUID_A, new MetadataJson()).encode(record),
                FramingMode.LENGTH_PREFIXED);
        byte[] data = concat(hex("00000002 09 F0"), sei, hex("00000003 65 88 84"));

        assertEquals(List.of(record), extractor.extractAll(data, UUID_A));
        assertEquals(List.of(record), extractor.extractAll(data, UUID_A, FramingMode.LENGTH_PREFIXED));
    }

    @Test
    void autoFindsLengthPrefixedSeiWhoseLengthLooksLikeStartCode() {
        MetadataRecord record = MetadataRecord.builder().put("pad", "x".repeat(270)).build();
        byte[] sei = nalEncoder.encode(
                new MetadataRecordEncoder(UUID_A, new MetadataJson()).encode(record),
                FramingMode.LENGTH_PREFIXED);
        byte[] data = concat(sei, hex("00000003 41 88 84"));

        assertArrayEquals(hex("00 00 01"), Arrays.copyOf(data, 3));
        assertEquals(List.of(record), extractor.extractAll(data, UUID_A, FramingMode.LENGTH_PREFIXED));
        assertEquals(List.of(record), extractor.extractAll(data, UUID_A));
    }

    @Test
    void bufferWithoutSeiYieldsNothing() {
        assertTrue(extractor.extractAll(Bytes.idrAccessUnit(), UUID_A).isEmpty());
        assertTrue(extractor.extractAll(new byte[0], UUID_A).isEmpty());
    }
}
