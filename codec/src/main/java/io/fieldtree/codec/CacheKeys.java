package io.fieldtree.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.fieldtree.core.model.Field;

import java.util.Map;

/**
 * Normalized-cache keys of fields: {@code hero} or {@code droid({"id":"2001"})}.
 * Arguments are resolved first and written with sorted object keys, so two calls
 * with equal values produce equal keys whatever the argument order.
 */
public final class CacheKeys {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeys() {
    }

    public static String forField(Field field, Variables variables) {
        if (field.arguments().isEmpty()) return field.schemaFieldName();
        Map<String, Object> args = variables.resolveArguments(field.arguments());
        try {
            return field.schemaFieldName() + "(" + MAPPER.writeValueAsString(args) + ")";
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cannot serialize arguments of " + field.responseKey(), e);
        }
    }
}
