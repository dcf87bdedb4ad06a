package io.fieldtree.codec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.function.Function;

/**
 * Converts the JSON form of one named scalar (or enum) to its Java value and back.
 * <p>
 * Both directions throw {@link IllegalArgumentException} when the value does not fit;
 * the codec reports that as {@code SCALAR_COERCION_ERROR} at the field's path.
 * Never called with a JSON null.
 */
public interface ScalarCoercion {

    Object decode(JsonNode node);

    JsonNode encode(Object value);

    static ScalarCoercion of(Function<JsonNode, Object> decode, Function<Object, JsonNode> encode) {
        Objects.requireNonNull(decode, "decode");
        Objects.requireNonNull(encode, "encode");
        return new ScalarCoercion() {
            @Override public Object decode(JsonNode node) { return decode.apply(node); }
            @Override public JsonNode encode(Object value) { return encode.apply(value); }
        };
    }
}
