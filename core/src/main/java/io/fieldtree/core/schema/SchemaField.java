package io.fieldtree.core.schema;

import java.util.Objects;

/**
 * Field definition of a composite schema type.
 *
 * @param deprecationReason null when the field is not deprecated
 */
public record SchemaField(String name, TypeRef type, String deprecationReason) {

    public SchemaField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public SchemaField(String name, TypeRef type) {
        this(name, type, null);
    }

    public boolean isDeprecated() { return deprecationReason != null; }
}
