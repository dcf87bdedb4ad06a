package io.fieldtree.core.document;

import io.fieldtree.core.schema.TypeRef;

import java.util.Objects;

/**
 * {@code $name: Type = default}.
 *
 * @param defaultValue null when the variable declares no default
 */
public record VariableDefinition(String name, TypeRef type, ArgumentValue defaultValue) {

    public VariableDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public boolean hasDefault() { return defaultValue != null; }
}
