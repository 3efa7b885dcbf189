package com.questrail.h264meta;

/**
 * Counters reported by {@link MetadataCollector}.
 *
 * @param buffers       buffers passed to {@code accept}
 * @param seiRecords    metadata records found, duplicates included
 * @param uniqueRecords records that were new when they arrived
 */
public record CollectorStats(
    long buffers,
    long seiRecords,
    long uniqueRecords
) {
}
