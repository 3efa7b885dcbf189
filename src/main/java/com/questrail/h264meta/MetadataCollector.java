package com.questrail.h264meta;

import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.config.SeiMetadataConfig;
import com.questrail.h264meta.internal.json.MetadataJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MetadataCollector
 * -----------------------------------------------------------------------------
 * Receiver-side accumulator: extracts records from successive buffers and keeps
 * only those it has not seen before.
 *
 * <p>Two records are the same when their JSON, with keys sorted at every
 * level, is identical. Since the injector stamps each record with its frame
 * number, repeats normally come from the same SEI arriving twice.</p>
 *
 * <p>Only the most recently seen {@code dedupeCapacity} records are remembered
 * (least recently seen first out). A repeat of a record that has been evicted
 * is reported as new again.</p>
 *
 * <p>All methods are synchronized; a pipeline thread may feed buffers while
 * another thread reads {@link #stats()} or calls {@link #save(Path)}.</p>
 */
public final class MetadataCollector
{
    private static final Logger log = LoggerFactory.getLogger(MetadataCollector.class);

    private final SeiMetadataExtractor extractor;
    private final SeiMetadataConfig config;
    private final MetadataJson json = new MetadataJson();

    public static final int DEFAULT_DEDUPE_CAPACITY = 1024;

    private final Map<String, Boolean> seen;
    private long buffers;
    private long seiRecords;
    private long uniqueRecords;
    private MetadataRecord latest;

    public MetadataCollector(SeiMetadataConfig config)
    {
        this(config, new SeiMetadataExtractor());
    }

    public MetadataCollector(SeiMetadataConfig config, SeiMetadataExtractor extractor)
    {
        this(config, extractor, DEFAULT_DEDUPE_CAPACITY);
    }

    /**
     * @param dedupeCapacity number of distinct records remembered for duplicate
     *                       detection; must be positive
     */
    public MetadataCollector(SeiMetadataConfig config, SeiMetadataExtractor extractor, int dedupeCapacity)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        if (dedupeCapacity <= 0) {
            throw new IllegalArgumentException("dedupeCapacity must be > 0: " + dedupeCapacity);
        }
        this.seen = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > dedupeCapacity;
            }
        };
    }

    /**
     * Extracts from one buffer and returns the records not seen before, in
     * stream order.
     */
    public synchronized List<MetadataRecord> accept(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        buffers++;

        List<MetadataRecord> fresh = new ArrayList<>();
        for (MetadataRecord record : extractor.extractAll(data, config)) {
            seiRecords++;
            // put() on an access-ordered map also refreshes a known key.
            if (seen.put(json.canonical(record), Boolean.TRUE) == null) {
                uniqueRecords++;
                latest = record;
                fresh.add(record);
                log.debug("New metadata (uuid={}): {}", config.uuid(), record);
            }
        }
        return fresh;
    }

    public synchronized CollectorStats stats()
    {
        return new CollectorStats(buffers, seiRecords, uniqueRecords);
    }

    synchronized int retainedKeys()
    {
        return seen.size();
    }

    /**
     * The most recent record that was new when it arrived.
     */
    public synchronized Optional<MetadataRecord> latest()
    {
        return Optional.ofNullable(latest);
    }

    /**
     * Writes the latest record as indented JSON.
     *
     * @return false, writing nothing, if no record has been collected yet
     * @throws IOException if the file cannot be written
     */
    public synchronized boolean save(Path path) throws IOException
    {
        Objects.requireNonNull(path, "path");
        if (latest == null) {
            log.info("No metadata collected; nothing written to {}", path);
            return false;
        }
        Files.writeString(path, json.encodePretty(latest), StandardCharsets.UTF_8);
        log.info("Saved latest metadata to {}", path);
        return true;
    }
}
