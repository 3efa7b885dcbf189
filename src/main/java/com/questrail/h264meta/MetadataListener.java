package com.questrail.h264meta;

import com.questrail.h264meta.api.MetadataRecord;

/**
 * Receives metadata records the first time they are seen on a stream.
 */
@FunctionalInterface
public interface MetadataListener
{
    void onMetadata(MetadataRecord record);
}
