package io.fieldtree.core.tree;

import io.fieldtree.core.model.Field;

import java.util.Objects;

/**
 * Position of a field inside an {@link ObjectShape}.
 *
 * @param index position in canonical order
 * @param child shape of the field's object values; null for scalar and enum leaves
 */
public record FieldSlot(int index, Field field, ObjectShape child) {

    public FieldSlot {
        Objects.requireNonNull(field, "field");
        if (field.isLeaf() != (child == null)) {
            throw new IllegalArgumentException("leaf fields have no child shape, composite fields need one");
        }
    }

    public String responseKey() { return field.responseKey(); }

    public boolean isLeaf() { return child == null; }
}
