package com.questrail.h264meta.internal.json;

/**
 * Indicates that metadata could not be converted to or from JSON text.
 *
 * This typically reflects:
 * <ul>
 *   <li>Malformed JSON in a received SEI body</li>
 *   <li>A top-level JSON value that is not an object</li>
 *   <li>Trailing content after the top-level object</li>
 * </ul>
 */
public final class MetadataJsonException extends RuntimeException
{
    public MetadataJsonException(String message) {
        super(message);
    }

    public MetadataJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
