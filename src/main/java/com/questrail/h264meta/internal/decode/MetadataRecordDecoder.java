package com.questrail.h264meta.internal.decode;

import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.internal.json.MetadataJson;
import com.questrail.h264meta.internal.json.MetadataJsonException;
import com.questrail.h264meta.internal.sei.SeiMessage;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * MetadataRecordDecoder
 * ============================================================================
 * Converts a {@code user_data_unregistered} {@link SeiMessage} into a semantic
 * {@link MetadataRecord}.
 *
 * <h2>What this decoder assumes</h2>
 * Messages passed to this decoder have already been:
 *
 * <ul>
 *   <li>Freed of emulation prevention bytes</li>
 *   <li>Sliced to exactly payloadSize bytes</li>
 *   <li>Matched against the expected UUID</li>
 * </ul>
 *
 * <h2>Body handling</h2>
 * The 16 UUID bytes are removed, then any trailing {@code 0x00} or
 * {@code 0x80} bytes (padding some encoders leave behind). The rest must be
 * strict UTF-8 holding one JSON object.
 */
public final class MetadataRecordDecoder
{
    private final MetadataJson json;

    public MetadataRecordDecoder(MetadataJson json)
    {
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * @throws MetadataDecodeException if the message is not user data, is not
     *         UTF-8, or does not hold a JSON object
     */
    public MetadataRecord decode(SeiMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!message.isUserDataUnregistered()) {
            throw new MetadataDecodeException(
                    "Not a user_data_unregistered message: payloadType=" + message.payloadType());
        }

        byte[] body = message.userData();
        int end = stripPadding(body);

        String text;
        try {
            text = strictUtf8().decode(ByteBuffer.wrap(body, 0, end)).toString();
        } catch (CharacterCodingException e) {
            throw new MetadataDecodeException("SEI body is not valid UTF-8", e);
        }

        try {
            return json.decode(text);
        } catch (MetadataJsonException e) {
            throw new MetadataDecodeException("SEI body is not a JSON object: " + e.getMessage(), e);
        }
    }

    /**
     * Exclusive end of {@code body} once trailing 0x00/0x80 bytes are dropped.
     */
    static int stripPadding(byte[] body)
    {
        int end = body.length;
        while (end > 0 && (body[end - 1] == 0 || (body[end - 1] & 0xFF) == 0x80)) {
            end--;
        }
        return end;
    }

    private static CharsetDecoder strictUtf8()
    {
        // CharsetDecoder is stateful; one per call.
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
