package io.fieldtree.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.model.Field;
import io.fieldtree.core.schema.TypeGraph;
import io.fieldtree.core.schema.TypeRef;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.FieldSlot;
import io.fieldtree.core.tree.ObjectShape;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Mirror of {@link ResponseDecoder}: writes a value tree as JSON, iterating slots in
 * canonical order so the output never depends on how the input maps were filled.
 * <p>
 * Deferred fields are written when present and silently skipped when absent (not yet
 * delivered). Any other selected field missing from the value is written as null if
 * nullable, else it is a MISSING_REQUIRED_FIELD.
 */
public final class ResponseEncoder {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ScalarRegistry scalars;

    public ResponseEncoder(ScalarRegistry scalars) {
        this.scalars = Objects.requireNonNull(scalars, "scalars");
    }

    public ObjectNode encode(CanonicalTree tree, Map<String, Object> value, Variables variables) {
        variables.requireAll(tree.referencedVariables());
        return encodeObject(tree.shape(), value, variables, ResponsePath.root());
    }

    public ObjectNode encodeObject(ObjectShape shape, Map<String, Object> value, Variables variables,
                                   ResponsePath path) {
        ObjectShape variant = variant(shape, value, path);
        ObjectNode out = NODES.objectNode();
        for (FieldSlot slot : variant.slots()) {
            Field f = slot.field();
            String key = slot.responseKey();
            ResponsePath fieldPath = path.append(key);
            if (!ResponseDecoder.isIncluded(f, variables, fieldPath)) continue;

            if (!value.containsKey(key)) {
                if (ResponseDecoder.isDeferred(f, variables, fieldPath)) continue;
                if (!f.type().nullable()) {
                    throw new CodecException(ErrorKind.MISSING_REQUIRED_FIELD, fieldPath,
                            "required field '" + key + "' of type " + f.type() + " is missing");
                }
                out.putNull(key);
                continue;
            }
            out.set(key, write(slot, f.type(), value.get(key), variables, fieldPath));
        }
        return out;
    }

    // ---------- helpers ----------

    private JsonNode write(FieldSlot slot, TypeRef type, Object value, Variables variables, ResponsePath path) {
        if (value == null) {
            if (type.nullable()) return NODES.nullNode();
            throw new CodecException(ErrorKind.NON_NULL_VIOLATION, path, "null for non-null type " + type);
        }
        if (type.isList()) {
            if (!(value instanceof Collection<?> items)) {
                throw new CodecException(ErrorKind.TYPE_MISMATCH, path,
                        "expected a list for " + type + ", got " + value.getClass().getSimpleName());
            }
            ArrayNode arr = NODES.arrayNode(items.size());
            int i = 0;
            for (Object item : items) {
                arr.add(write(slot, type.elementType(), item, variables, path.append(i++)));
            }
            return arr;
        }
        if (slot.isLeaf()) {
            try {
                return scalars.coercion(type.name(), slot.field().kind()).encode(value);
            } catch (IllegalArgumentException e) {
                throw new CodecException(ErrorKind.SCALAR_COERCION_ERROR, path,
                        type.name() + ": " + e.getMessage(), e);
            }
        }
        return encodeObject(slot.child(), asObject(value, path), variables, path);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value, ResponsePath path) {
        if (!(value instanceof Map<?, ?>)) {
            throw new CodecException(ErrorKind.TYPE_MISMATCH, path,
                    "expected an object, got " + value.getClass().getSimpleName());
        }
        return (Map<String, Object>) value;
    }

    private static ObjectShape variant(ObjectShape shape, Map<String, Object> value, ResponsePath path) {
        if (!shape.isPolymorphic()) return shape;
        Object typename = value.get(TypeGraph.TYPENAME);
        if (!(typename instanceof String t)) {
            throw new CodecException(ErrorKind.MISSING_REQUIRED_FIELD, path.append(TypeGraph.TYPENAME),
                    "polymorphic " + shape.typeName() + " value carries no __typename");
        }
        ObjectShape v = shape.resolve(t);
        if (v == null) {
            throw new CodecException(ErrorKind.UNHANDLED_TYPE_CONDITION, path,
                    "no fragment of " + shape.typeName() + " handles type " + t + " and the tree has no catch-all");
        }
        return v;
    }
}
