package com.questrail.h264meta.api;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MetadataValue
 * -----------------------------------------------------------------------------
 * A JSON value carried inside a {@link MetadataRecord}.
 *
 * <p>The variants mirror JSON exactly: string, number, boolean, null, object
 * and array. Objects keep insertion order. Numbers are held as
 * {@link BigDecimal} so that every value read from the wire is written back
 * unchanged ({@code 1}, {@code 1.0} and {@code 1e3} stay distinct).</p>
 */
public sealed interface MetadataValue
        permits MetadataValue.StringValue,
                MetadataValue.NumberValue,
                MetadataValue.BooleanValue,
                MetadataValue.NullValue,
                MetadataValue.ObjectValue,
                MetadataValue.ArrayValue
{
    static MetadataValue of(String value)
    {
        return new StringValue(value);
    }

    static MetadataValue of(long value)
    {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    /**
     * @throws IllegalArgumentException for NaN or infinite values, which JSON cannot carry
     */
    static MetadataValue of(double value)
    {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("JSON numbers must be finite: " + value);
        }
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static MetadataValue of(boolean value)
    {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static MetadataValue nullValue()
    {
        return NullValue.INSTANCE;
    }

    record StringValue(String value) implements MetadataValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record NumberValue(BigDecimal value) implements MetadataValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        /**
         * True if the value has no fractional part as written (scale 0 or less).
         */
        public boolean isIntegral() {
            return value.scale() <= 0;
        }

        /**
         * @throws ArithmeticException if the value has a fractional part or does not fit a long
         */
        public long longValueExact() {
            return value.longValueExact();
        }

        public double doubleValue() {
            return value.doubleValue();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record BooleanValue(boolean value) implements MetadataValue {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record NullValue() implements MetadataValue {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public String toString() {
            return "null";
        }
    }

    record ObjectValue(Map<String, MetadataValue> fields) implements MetadataValue {
        public ObjectValue {
            Objects.requireNonNull(fields, "fields");
            Map<String, MetadataValue> copy = new LinkedHashMap<>();
            fields.forEach((k, v) -> copy.put(
                    Objects.requireNonNull(k, "key"),
                    Objects.requireNonNull(v, "value")));
            fields = Collections.unmodifiableMap(copy);
        }

        @Override
        public String toString() {
            return fields.toString();
        }
    }

    record ArrayValue(List<MetadataValue> elements) implements MetadataValue {
        public ArrayValue {
            elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }
}
