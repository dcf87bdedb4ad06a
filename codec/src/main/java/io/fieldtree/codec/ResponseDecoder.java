package io.fieldtree.codec;

import com.fasterxml.jackson.databind.JsonNode;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.model.Field;
import io.fieldtree.core.schema.TypeGraph;
import io.fieldtree.core.schema.TypeRef;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.FieldSlot;
import io.fieldtree.core.tree.ObjectShape;

import java.util.*;
import java.util.function.Predicate;

/**
 * Decodes a JSON payload into plain Java values following a {@link CanonicalTree}.
 * <p>
 * Per object:
 *  1) polymorphic shapes pick their variant from {@code __typename} (or the caller's hint);
 *  2) input keys are matched to slots through the shape's index; unknown keys are ignored;
 *  3) each value is dispatched on the slot's type: list, object or leaf;
 *  4) selected slots absent from the input are null when nullable, else MISSING_REQUIRED_FIELD.
 * Deferred fields (unless their defer {@code if} is false) and fields excluded by
 * {@code @include}/{@code @skip} are not read.
 * <p>
 * Output objects are {@link LinkedHashMap}s in canonical key order; lists are {@link ArrayList}s.
 * Stateless apart from the scalar registry; one instance may serve many threads.
 */
public final class ResponseDecoder {

    private final ScalarRegistry scalars;

    public ResponseDecoder(ScalarRegistry scalars) {
        this.scalars = Objects.requireNonNull(scalars, "scalars");
    }

    public Map<String, Object> decode(CanonicalTree tree, JsonNode data, Variables variables) {
        return decode(tree, data, variables, DecodeListener.NONE);
    }

    /**
     * Decode the base payload of an operation (or fragment) tree.
     *
     * @throws CodecException on the first failure, with its full path; nothing partial is returned
     */
    public Map<String, Object> decode(CanonicalTree tree, JsonNode data, Variables variables, DecodeListener listener) {
        variables.requireAll(tree.referencedVariables());
        return decodeObject(tree.shape(), data, null, variables, ResponsePath.root(), listener);
    }

    /**
     * Decode one object, skipping deferred fields.
     *
     * @param typenameHint concrete type known from the enclosing context, or null
     */
    public Map<String, Object> decodeObject(
            ObjectShape shape,
            JsonNode node,
            String typenameHint,
            Variables variables,
            ResponsePath path,
            DecodeListener listener
    ) {
        requireObject(node, path);
        String typename = typename(node, typenameHint);
        ObjectShape variant = variant(shape, typename, path);
        Map<String, Object> out = readFields(variant, node, typename,
                f -> !isDeferred(f, variables, path.append(f.responseKey())), variables, path, listener);
        listener.onObject(path, variant, out);
        return out;
    }

    /**
     * Decode only the slots of an already resolved flat shape accepted by {@code selected}.
     * Used to read the payload of a deferred delivery. The listener is not told about the
     * object itself, only about objects nested under the selected fields.
     */
    public Map<String, Object> decodeSelected(
            ObjectShape variant,
            JsonNode node,
            Predicate<Field> selected,
            Variables variables,
            ResponsePath path,
            DecodeListener listener
    ) {
        if (variant.isPolymorphic()) throw new IllegalArgumentException("expected a resolved variant: " + variant);
        requireObject(node, path);
        return readFields(variant, node, typename(node, null), selected, variables, path, listener);
    }

    /**
     * Decode the value of one field. Used for field-level deferrals, whose payload is the
     * field value itself.
     */
    public Object decodeValue(FieldSlot slot, JsonNode node, Variables variables, ResponsePath path,
                              DecodeListener listener) {
        return value(slot, slot.field().type(), node, variables, path, listener);
    }

    /** Whether a field takes part in the response under the given variables. */
    public static boolean isIncluded(Field field, Variables variables, ResponsePath path) {
        if (field.condition().isAlways()) return true;
        try {
            return field.condition().evaluate(variables::get);
        } catch (IllegalArgumentException e) {
            throw new CodecException(ErrorKind.TYPE_MISMATCH, path, e.getMessage(), e);
        }
    }

    /** Whether a field is delivered later under the given variables; a false defer {@code if} is not. */
    public static boolean isDeferred(Field field, Variables variables, ResponsePath path) {
        if (!field.isDeferred()) return false;
        try {
            return field.deferral().isActive(variables::get);
        } catch (IllegalArgumentException e) {
            throw new CodecException(ErrorKind.TYPE_MISMATCH, path, e.getMessage(), e);
        }
    }

    // ---------- helpers ----------

    private Map<String, Object> readFields(
            ObjectShape variant,
            JsonNode node,
            String typename,
            Predicate<Field> selected,
            Variables variables,
            ResponsePath path,
            DecodeListener listener
    ) {
        int n = variant.size();
        Object[] values = new Object[n];
        boolean[] present = new boolean[n];

        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            int i = variant.indexOf(e.getKey());
            if (i < 0) continue;
            FieldSlot slot = variant.slot(i);
            ResponsePath fieldPath = path.append(slot.responseKey());
            if (!selected.test(slot.field()) || !isIncluded(slot.field(), variables, fieldPath)) continue;

            values[i] = value(slot, slot.field().type(), e.getValue(), variables, fieldPath, listener);
            present[i] = true;
        }

        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            FieldSlot slot = variant.slot(i);
            String key = slot.responseKey();
            if (present[i]) {
                out.put(key, values[i]);
                continue;
            }
            Field f = slot.field();
            ResponsePath fieldPath = path.append(key);
            if (!selected.test(f) || !isIncluded(f, variables, fieldPath)) continue;

            if (TypeGraph.TYPENAME.equals(f.schemaFieldName()) && typename != null) {
                out.put(key, typename);
            } else if (f.type().nullable()) {
                out.put(key, null);
            } else {
                throw new CodecException(ErrorKind.MISSING_REQUIRED_FIELD, fieldPath,
                        "required field '" + key + "' of type " + f.type() + " is missing");
            }
        }
        return out;
    }

    private Object value(FieldSlot slot, TypeRef type, JsonNode node, Variables variables, ResponsePath path,
                         DecodeListener listener) {
        if (node == null || node.isNull()) {
            if (type.nullable()) return null;
            throw new CodecException(ErrorKind.NON_NULL_VIOLATION, path, "null for non-null type " + type);
        }
        if (type.isList()) {
            if (!node.isArray()) {
                throw new CodecException(ErrorKind.TYPE_MISMATCH, path,
                        "expected a list for " + type + ", got " + node.getNodeType());
            }
            List<Object> out = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                out.add(value(slot, type.elementType(), node.get(i), variables, path.append(i), listener));
            }
            return out;
        }
        if (slot.isLeaf()) {
            try {
                return scalars.coercion(type.name(), slot.field().kind()).decode(node);
            } catch (IllegalArgumentException e) {
                throw new CodecException(ErrorKind.SCALAR_COERCION_ERROR, path,
                        type.name() + ": " + e.getMessage(), e);
            }
        }
        return decodeObject(slot.child(), node, null, variables, path, listener);
    }

    private static String typename(JsonNode node, String hint) {
        JsonNode t = node.get(TypeGraph.TYPENAME);
        if (t != null && t.isTextual()) return t.textValue();
        return hint;
    }

    private static ObjectShape variant(ObjectShape shape, String typename, ResponsePath path) {
        if (!shape.isPolymorphic()) return shape;
        if (typename == null) {
            throw new CodecException(ErrorKind.MISSING_REQUIRED_FIELD, path.append(TypeGraph.TYPENAME),
                    "polymorphic " + shape.typeName() + " needs a discriminator");
        }
        ObjectShape v = shape.resolve(typename);
        if (v == null) {
            throw new CodecException(ErrorKind.UNHANDLED_TYPE_CONDITION, path,
                    "no fragment of " + shape.typeName() + " handles type " + typename
                            + " and the tree has no catch-all");
        }
        return v;
    }

    private static void requireObject(JsonNode node, ResponsePath path) {
        if (node == null || !node.isObject()) {
            throw new CodecException(ErrorKind.TYPE_MISMATCH, path,
                    "expected an object, got " + (node == null ? "nothing" : node.getNodeType()));
        }
    }
}
