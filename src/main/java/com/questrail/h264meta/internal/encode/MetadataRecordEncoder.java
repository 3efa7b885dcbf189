package com.questrail.h264meta.internal.encode;

import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.config.SeiUuid;
import com.questrail.h264meta.internal.json.MetadataJson;
import com.questrail.h264meta.internal.sei.SeiMessage;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * MetadataRecordEncoder
 * ============================================================================
 * Converts a semantic {@link MetadataRecord} into a wire-adjacent
 * {@link SeiMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class forms the <strong>explicit outbound boundary</strong> between:
 *
 * <ul>
 *   <li><b>Application semantics</b> (metadata records)</li>
 *   <li><b>SEI mechanics</b> (payloadType, UUID prefix, body bytes)</li>
 * </ul>
 *
 * The outbound pipeline is therefore:
 *
 * <pre>
 *   MetadataRecord  ->  SeiMessage  ->  byte[]
 *         (this)         (SEI NAL encoder)
 * </pre>
 *
 * <h2>What this encoder does NOT do</h2>
 * <ul>
 *   <li>Size coding, trailing bits or emulation prevention (handled by SeiNalEncoder)</li>
 *   <li>Choosing where the NAL unit goes in the access unit</li>
 * </ul>
 */
public final class MetadataRecordEncoder
{
    private final SeiUuid uuid;
    private final MetadataJson json;

    public MetadataRecordEncoder(SeiUuid uuid, MetadataJson json)
    {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * Builds a {@code user_data_unregistered} message whose body is the compact
     * UTF-8 JSON text of {@code record}.
     */
    public SeiMessage encode(MetadataRecord record)
    {
        Objects.requireNonNull(record, "record");
        byte[] body = json.encode(record).getBytes(StandardCharsets.UTF_8);
        return SeiMessage.userDataUnregistered(uuid, body);
    }
}
