package com.openstable.sync.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openstable.common.util.Constants;
import com.openstable.sync.exception.EntityDecodingException;
import com.openstable.sync.model.SyncEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between loosely typed rows (column name to value) and typed entities.
 * Rows use snake_case column names; entities are immutable Jackson-deserializable value classes.
 *
 * @param <T> entity type
 */
public class EntityCodec<T extends SyncEntity> {

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public EntityCodec(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    public static <T extends SyncEntity> EntityCodec<T> of(Class<T> type) {
        return new EntityCodec<>(defaultObjectMapper(), type);
    }

    /**
     * Mapper used for rows: snake_case columns, ISO-8601 dates, unknown columns ignored.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public T decode(Map<String, Object> row) {
        if (row == null || row.isEmpty()) {
            throw new EntityDecodingException("Cannot decode empty row into " + type.getSimpleName());
        }
        T entity;
        try {
            entity = objectMapper.convertValue(row, type);
        } catch (IllegalArgumentException e) {
            throw new EntityDecodingException("Malformed " + type.getSimpleName() + " row: " + e.getMessage(), e);
        }
        if (entity == null || entity.getId() == null) {
            throw new EntityDecodingException(type.getSimpleName() + " row has no "
                    + Constants.DEFAULT_KEY_FIELD + " column");
        }
        return entity;
    }

    public Map<String, Object> encode(T entity) {
        return objectMapper.convertValue(entity, ROW_TYPE);
    }

    /**
     * Shallow merge: columns present in {@code changes} replace the entity's values.
     */
    public T patch(T base, Map<String, Object> changes) {
        Map<String, Object> row = encode(base);
        row.putAll(changes);
        return decode(row);
    }

    public T withId(T entity, String id) {
        Map<String, Object> row = encode(entity);
        row.put(Constants.DEFAULT_KEY_FIELD, id);
        return decode(row);
    }

    /**
     * Reads a key from a row without decoding the rest of it.
     */
    public static String keyOf(Map<String, Object> row) {
        Object key = row == null ? null : row.get(Constants.DEFAULT_KEY_FIELD);
        if (key == null) {
            throw new EntityDecodingException("Row has no " + Constants.DEFAULT_KEY_FIELD + " column");
        }
        return String.valueOf(key);
    }

    public Class<T> getType() {
        return type;
    }
}
