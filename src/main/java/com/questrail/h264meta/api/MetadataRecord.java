package com.questrail.h264meta.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MetadataRecord
 * -----------------------------------------------------------------------------
 * Application metadata carried in one SEI message: an ordered mapping of
 * string keys to {@link MetadataValue}s, serialized as a JSON object.
 *
 * <p>Records are immutable. {@link #with(String, MetadataValue)} returns a
 * modified copy; {@link #builder()} assembles a new record.</p>
 */
public final class MetadataRecord
{
    private static final MetadataRecord EMPTY = new MetadataRecord(Map.of());

    private final Map<String, MetadataValue> fields;

    private MetadataRecord(Map<String, MetadataValue> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static MetadataRecord empty() {
        return EMPTY;
    }

    /**
     * Creates a record holding a copy of {@code fields}, in the map's iteration order.
     */
    public static MetadataRecord of(Map<String, MetadataValue> fields) {
        return builder().putAll(fields).build();
    }

    public static MetadataRecord fromObject(MetadataValue.ObjectValue object) {
        Objects.requireNonNull(object, "object");
        return new MetadataRecord(object.fields());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MetadataValue> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    /**
     * Returns the value of {@code key} if it is a JSON string.
     */
    public Optional<String> getString(String key) {
        MetadataValue value = fields.get(key);
        if (value instanceof MetadataValue.StringValue s) {
            return Optional.of(s.value());
        }
        return Optional.empty();
    }

    /**
     * Returns the value of {@code key} if it is a JSON number that fits a long exactly.
     */
    public Optional<Long> getLong(String key) {
        MetadataValue value = fields.get(key);
        if (value instanceof MetadataValue.NumberValue n) {
            try {
                return Optional.of(n.longValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public Set<String> keys() {
        return fields.keySet();
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Unmodifiable view of the fields, in insertion order.
     */
    public Map<String, MetadataValue> asMap() {
        return fields;
    }

    public MetadataValue.ObjectValue asObjectValue() {
        return new MetadataValue.ObjectValue(fields);
    }

    /**
     * Returns a copy with {@code key} set to {@code value}. An existing key keeps
     * its position; a new key is appended.
     */
    public MetadataRecord with(String key, MetadataValue value) {
        Map<String, MetadataValue> copy = new LinkedHashMap<>(fields);
        copy.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return new MetadataRecord(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataRecord that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "MetadataRecord" + fields;
    }

    public static final class Builder {
        private final Map<String, MetadataValue> fields = new LinkedHashMap<>();

        public Builder put(String key, MetadataValue value) {
            fields.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, MetadataValue.of(value));
        }

        public Builder put(String key, long value) {
            return put(key, MetadataValue.of(value));
        }

        public Builder put(String key, double value) {
            return put(key, MetadataValue.of(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, MetadataValue.of(value));
        }

        public Builder putAll(Map<String, MetadataValue> values) {
            Objects.requireNonNull(values, "values");
            values.forEach(this::put);
            return this;
        }

        public MetadataRecord build() {
            return new MetadataRecord(fields);
        }
    }
}
