package com.questrail.h264meta.internal.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.questrail.h264meta.api.MetadataRecord;
import com.questrail.h264meta.api.MetadataValue;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * MetadataJson
 * -----------------------------------------------------------------------------
 * Converts {@link MetadataRecord}s to and from JSON text with the Jackson
 * streaming API.
 *
 * <p>{@link #encode} writes compact JSON (no whitespace) in insertion order;
 * this is the exact text carried in the SEI body. {@link #decode} accepts any
 * JSON whose root is an object and nothing follows it.</p>
 *
 * <p>Numbers are read and written as {@link java.math.BigDecimal}, so a value
 * survives a decode/encode cycle with its written form intact.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class MetadataJson
{
    private final JsonFactory factory = new JsonFactory();

    /**
     * Compact JSON object text for {@code record}.
     */
    public String encode(MetadataRecord record)
    {
        Objects.requireNonNull(record, "record");
        return write(record.asMap(), false);
    }

    /**
     * JSON with object keys sorted at every level. Two records carrying the same
     * data in a different key order produce the same canonical text.
     */
    public String canonical(MetadataRecord record)
    {
        Objects.requireNonNull(record, "record");
        return write(sorted(record.asMap()), false);
    }

    /**
     * Indented JSON for files meant to be read by people.
     */
    public String encodePretty(MetadataRecord record)
    {
        Objects.requireNonNull(record, "record");
        return write(record.asMap(), true);
    }

    /**
     * Parses JSON object text into a record.
     *
     * @throws MetadataJsonException if the text is not a single JSON object
     */
    public MetadataRecord decode(String json)
    {
        Objects.requireNonNull(json, "json");
        try (JsonParser parser = factory.createParser(json)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new MetadataJsonException("Empty JSON document");
            }
            if (token != JsonToken.START_OBJECT) {
                throw new MetadataJsonException("JSON root must be an object, found " + token);
            }
            Map<String, MetadataValue> fields = readObject(parser);
            JsonToken trailing = parser.nextToken();
            if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
                throw new MetadataJsonException("JSON document contains trailing content");
            }
            return MetadataRecord.of(fields);
        } catch (IOException ex) {
            throw new MetadataJsonException("Invalid JSON payload", ex);
        }
    }

    // -------------------------------------------------------------------------
    // Writing
    // -------------------------------------------------------------------------

    private String write(Map<String, MetadataValue> fields, boolean pretty)
    {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (pretty) {
                generator.useDefaultPrettyPrinter();
            }
            writeObject(generator, fields);
        } catch (IOException ex) {
            throw new MetadataJsonException("Cannot write metadata as JSON", ex);
        }
        return out.toString();
    }

    private void writeObject(JsonGenerator generator, Map<String, MetadataValue> fields) throws IOException
    {
        generator.writeStartObject();
        for (Map.Entry<String, MetadataValue> entry : fields.entrySet()) {
            generator.writeFieldName(entry.getKey());
            writeValue(generator, entry.getValue());
        }
        generator.writeEndObject();
    }

    private void writeValue(JsonGenerator generator, MetadataValue value) throws IOException
    {
        if (value instanceof MetadataValue.StringValue s) {
            generator.writeString(s.value());
        } else if (value instanceof MetadataValue.NumberValue n) {
            generator.writeNumber(n.value());
        } else if (value instanceof MetadataValue.BooleanValue b) {
            generator.writeBoolean(b.value());
        } else if (value instanceof MetadataValue.NullValue) {
            generator.writeNull();
        } else if (value instanceof MetadataValue.ObjectValue o) {
            writeObject(generator, o.fields());
        } else if (value instanceof MetadataValue.ArrayValue a) {
            generator.writeStartArray();
            for (MetadataValue element : a.elements()) {
                writeValue(generator, element);
            }
            generator.writeEndArray();
        } else {
            throw new MetadataJsonException("Unsupported metadata value: " + value);
        }
    }

    private static Map<String, MetadataValue> sorted(Map<String, MetadataValue> fields)
    {
        Map<String, MetadataValue> out = new TreeMap<>();
        fields.forEach((k, v) -> out.put(k, sorted(v)));
        return out;
    }

    private static MetadataValue sorted(MetadataValue value)
    {
        if (value instanceof MetadataValue.ObjectValue o) {
            return new MetadataValue.ObjectValue(sorted(o.fields()));
        }
        if (value instanceof MetadataValue.ArrayValue a) {
            List<MetadataValue> elements = new ArrayList<>(a.elements().size());
            a.elements().forEach(e -> elements.add(sorted(e)));
            return new MetadataValue.ArrayValue(elements);
        }
        return value;
    }

    // -------------------------------------------------------------------------
    // Reading
    // -------------------------------------------------------------------------

    private MetadataValue readValue(JsonParser parser, JsonToken token) throws IOException
    {
        if (token == null) {
            throw new MetadataJsonException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> new MetadataValue.ObjectValue(readObject(parser));
            case START_ARRAY -> new MetadataValue.ArrayValue(readArray(parser));
            case VALUE_STRING -> new MetadataValue.StringValue(parser.getText());
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> new MetadataValue.NumberValue(parser.getDecimalValue());
            case VALUE_TRUE -> MetadataValue.of(true);
            case VALUE_FALSE -> MetadataValue.of(false);
            case VALUE_NULL -> MetadataValue.nullValue();
            default -> throw new MetadataJsonException("Unsupported JSON token: " + token);
        };
    }

    private Map<String, MetadataValue> readObject(JsonParser parser) throws IOException
    {
        Map<String, MetadataValue> map = new LinkedHashMap<>();
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_OBJECT) {
                break;
            }
            if (token != JsonToken.FIELD_NAME) {
                throw new MetadataJsonException("Expected field name but found " + token);
            }
            String fieldName = parser.currentName();
            map.put(fieldName, readValue(parser, parser.nextToken()));
        }
        return map;
    }

    private List<MetadataValue> readArray(JsonParser parser) throws IOException
    {
        List<MetadataValue> list = new ArrayList<>();
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            list.add(readValue(parser, token));
        }
        return list;
    }
}
