package com.foreman.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.foreman.core.state.StatePersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson codec for the JSON text columns of the project state tables.
 * <p>
 * Reads are lenient: null, blank, malformed or wrong-shaped JSON yields an empty
 * list or map and a WARN log, so one corrupt column never makes a project unreadable.
 * Writes fail loudly with {@link StatePersistenceException}.
 */
public class JsonColumns {

    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private static final TypeReference<Object> ANY = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumns() {
        this(defaultObjectMapper());
    }

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper used for the state columns and for the CLI's JSON output: ISO-8601 dates, no timestamps.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StatePersistenceException("Failed to serialize JSON column value", e);
        }
    }

    /**
     * Parses a JSON array of strings. Non-string elements are rendered with {@code toString()}.
     */
    public List<String> readList(String json, String column) {
        Object parsed = parse(json, column);
        if (parsed == null) {
            return new ArrayList<>();
        }
        if (!(parsed instanceof List<?>)) {
            log.warn("Column '{}' holds {} instead of a JSON array; treating as empty",
                    column, parsed.getClass().getSimpleName());
            return new ArrayList<>();
        }
        return coerceList(parsed);
    }

    public Map<String, Object> readMap(String json, String column) {
        Object parsed = parse(json, column);
        if (parsed == null) {
            return new LinkedHashMap<>();
        }
        if (!(parsed instanceof Map<?, ?>)) {
            log.warn("Column '{}' holds {} instead of a JSON object; treating as empty",
                    column, parsed.getClass().getSimpleName());
            return new LinkedHashMap<>();
        }
        return coerceMap(parsed);
    }

    /**
     * Like {@link #readMap(String, String)} but keeps SQL NULL distinct from an empty object.
     */
    public Map<String, Object> readNullableMap(String json, String column) {
        if (json == null) {
            return null;
        }
        return readMap(json, column);
    }

    /**
     * Converts an already-parsed JSON value into a mutable list of strings; anything else becomes empty.
     */
    public static List<String> coerceList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    /**
     * Converts an already-parsed JSON value into a mutable string-keyed map; anything else becomes empty.
     */
    public static Map<String, Object> coerceMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
        }
        return result;
    }

    private Object parse(String json, String column) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ANY);
        } catch (JsonProcessingException e) {
            log.warn("Column '{}' holds malformed JSON; treating as empty: {}", column, e.getOriginalMessage());
            return null;
        }
    }
}
