package com.questrail.h264meta.internal.decode;

/**
 * Indicates that a {@code user_data_unregistered} body carrying the expected
 * UUID could not be translated into a {@code MetadataRecord}.
 *
 * This typically reflects:
 * <ul>
 *   <li>A body that is not valid UTF-8</li>
 *   <li>Malformed JSON, or a JSON root that is not an object</li>
 * </ul>
 */
public final class MetadataDecodeException extends RuntimeException
{
    public MetadataDecodeException(String message) {
        super(message);
    }

    public MetadataDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
