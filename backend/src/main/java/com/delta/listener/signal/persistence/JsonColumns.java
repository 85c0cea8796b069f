package com.delta.listener.signal.persistence;

import com.delta.listener.signal.model.RunError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Array and map columns are stored as JSON text so the same schema runs on PostgreSQL and H2.
 */
@Component
public class JsonColumns {
    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<List<RunError>> ERROR_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeList(List<String> values) {
        return write(values == null ? List.of() : values);
    }

    public List<String> readList(String json) {
        List<String> parsed = read(json, STRING_LIST);
        return parsed == null ? List.of() : List.copyOf(parsed);
    }

    public String writeMap(Map<String, Object> values) {
        return write(values == null ? Map.of() : values);
    }

    public Map<String, Object> readMap(String json) {
        Map<String, Object> parsed = read(json, OBJECT_MAP);
        return parsed == null ? Map.of() : parsed;
    }

    public String writeErrors(List<RunError> errors) {
        return write(errors == null ? List.of() : errors);
    }

    public List<RunError> readErrors(String json) {
        List<RunError> parsed = read(json, ERROR_LIST);
        return parsed == null ? List.of() : List.copyOf(parsed);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize JSON column", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column value: {}", e.getOriginalMessage());
            return null;
        }
    }
}
