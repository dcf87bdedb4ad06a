package io.fieldtree.core.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Argument or default value as written in the document.
 * <p>
 * Variable references may appear at any depth inside list and object values,
 * so resolution walks the whole value.
 */
public sealed interface ArgumentValue
        permits ArgumentValue.Literal, ArgumentValue.VariableRef, ArgumentValue.ListValue, ArgumentValue.ObjectValue {

    /** Scalar or enum literal: String, Number, Boolean, or null. */
    record Literal(Object value) implements ArgumentValue {}

    record VariableRef(String name) implements ArgumentValue {
        public VariableRef {
            Objects.requireNonNull(name, "name");
        }
    }

    record ListValue(List<ArgumentValue> values) implements ArgumentValue {
        public ListValue {
            values = List.copyOf(values);
        }
    }

    record ObjectValue(Map<String, ArgumentValue> fields) implements ArgumentValue {
        public ObjectValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    static ArgumentValue literal(Object value) { return new Literal(value); }

    static ArgumentValue variable(String name) { return new VariableRef(name); }

    /** Adds the names of all variables referenced anywhere inside {@code value} to {@code out}. */
    static void collectVariables(ArgumentValue value, Set<String> out) {
        if (value instanceof VariableRef v) {
            out.add(v.name());
        } else if (value instanceof ListValue l) {
            for (ArgumentValue item : l.values()) collectVariables(item, out);
        } else if (value instanceof ObjectValue o) {
            for (ArgumentValue item : o.fields().values()) collectVariables(item, out);
        }
    }
}
