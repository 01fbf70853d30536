package com.ambient.core.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * Marshals typed resources to and from the generic maps the custom-object API speaks.
 * <p>
 * This is the only place where resource fields are handled by string key; everything
 * above the store works with the typed records in {@code com.ambient.core.model}.
 */
public final class ResourceCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ResourceCodec() {
        this(new ObjectMapper());
    }

    public ResourceCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, true)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public Map<String, Object> encode(Object resource) {
        return objectMapper.convertValue(resource, MAP_TYPE);
    }

    public <T> T decode(Object raw, Class<T> type) {
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new ResourceDecodingException("Cannot decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
