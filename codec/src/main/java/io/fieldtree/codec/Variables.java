package io.fieldtree.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.document.ArgumentValue;
import io.fieldtree.core.document.VariableDefinition;
import io.fieldtree.core.tree.CanonicalTree;

import java.util.*;

/**
 * Resolved variable values of one operation call.
 * <p>
 * Values are plain Java objects (String, Number, Boolean, List, Map, or null).
 * Resolution happens once, before any decode or encode; a reference that cannot be
 * satisfied is reported as {@code MISSING_VARIABLE} up front.
 */
public final class Variables {

    private static final Variables EMPTY = new Variables(Map.of());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Object> values;

    private Variables(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Variables empty() { return EMPTY; }

    /** Values taken as-is, for trees that declare no variables (fragment trees). */
    public static Variables of(Map<String, ?> values) {
        return new Variables(new LinkedHashMap<>(values));
    }

    /**
     * Apply declared defaults to the supplied values.
     *
     * @throws CodecException MISSING_VARIABLE when a declared variable has neither a value nor a default
     */
    public static Variables resolve(List<VariableDefinition> definitions, Map<String, ?> supplied) {
        Map<String, Object> out = new LinkedHashMap<>(supplied);
        for (VariableDefinition def : definitions) {
            if (supplied.containsKey(def.name())) continue;
            if (!def.hasDefault()) {
                throw new CodecException(ErrorKind.MISSING_VARIABLE, ResponsePath.root(),
                        "variable $" + def.name() + " of type " + def.type() + " has no value and no default");
            }
            out.put(def.name(), EMPTY.value(def.defaultValue()));
        }
        return new Variables(out);
    }

    /** Resolve against the tree's declarations and check every variable the tree reads is bound. */
    public static Variables forTree(CanonicalTree tree, Map<String, ?> supplied) {
        Variables vars = resolve(tree.variables(), supplied);
        vars.requireAll(tree.referencedVariables());
        return vars;
    }

    /** Supplied values from a JSON object (or null/missing for none). */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Map.of();
        if (!node.isObject()) {
            throw new CodecException(ErrorKind.TYPE_MISMATCH, ResponsePath.root(),
                    "variables must be a JSON object, got " + node.getNodeType());
        }
        return MAPPER.convertValue(node, LinkedHashMap.class);
    }

    public boolean has(String name) { return values.containsKey(name); }

    public Object get(String name) { return values.get(name); }

    public Map<String, Object> asMap() { return values; }

    /** @throws CodecException MISSING_VARIABLE for the first name without a value */
    public void requireAll(Collection<String> names) {
        for (String name : names) {
            if (!values.containsKey(name)) {
                throw new CodecException(ErrorKind.MISSING_VARIABLE, ResponsePath.root(),
                        "variable $" + name + " is referenced but not supplied");
            }
        }
    }

    /** Value of an argument, with every nested variable reference substituted. */
    public Object value(ArgumentValue argument) {
        if (argument instanceof ArgumentValue.Literal l) {
            return l.value();
        }
        if (argument instanceof ArgumentValue.VariableRef ref) {
            if (!values.containsKey(ref.name())) {
                throw new CodecException(ErrorKind.MISSING_VARIABLE, ResponsePath.root(),
                        "variable $" + ref.name() + " is referenced but not supplied");
            }
            return values.get(ref.name());
        }
        if (argument instanceof ArgumentValue.ListValue list) {
            List<Object> out = new ArrayList<>(list.values().size());
            for (ArgumentValue item : list.values()) out.add(value(item));
            return out;
        }
        ArgumentValue.ObjectValue obj = (ArgumentValue.ObjectValue) argument;
        Map<String, Object> out = new LinkedHashMap<>();
        for (var e : obj.fields().entrySet()) out.put(e.getKey(), value(e.getValue()));
        return out;
    }

    /** Resolved arguments in declaration order. */
    public Map<String, Object> resolveArguments(Map<String, ArgumentValue> arguments) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (var e : arguments.entrySet()) out.put(e.getKey(), value(e.getValue()));
        return out;
    }

    @Override
    public String toString() {
        return "Variables" + values;
    }
}
