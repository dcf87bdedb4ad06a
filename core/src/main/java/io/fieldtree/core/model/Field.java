package io.fieldtree.core.model;

import io.fieldtree.core.document.ArgumentValue;
import io.fieldtree.core.schema.NamedTypeKind;
import io.fieldtree.core.schema.TypeRef;

import java.util.*;

/**
 * A selected field at one position of a selection tree, with its schema type resolved.
 * <p>
 * Immutable. Merging never edits a field in place; it builds a new one through the
 * {@code with*} copies.
 *
 * @param responseKey     alias or field name; unique among siblings once merged
 * @param schemaFieldName name of the field in the schema
 * @param type            schema type, with per-level nullability
 * @param kind            kind of the named type at the bottom of {@code type}
 * @param arguments       arguments as written (literals or variable references)
 * @param subSelection    child fields in canonical order; empty for leaves
 * @param fragments       fragments attached to this field's selection, with their accessors
 * @param originPaths     every source position that contributed this field
 * @param deferral        null when the field is delivered in the base payload
 * @param condition       {@code @include}/{@code @skip} annotations
 */
public record Field(
        String responseKey,
        String schemaFieldName,
        TypeRef type,
        NamedTypeKind kind,
        Map<String, ArgumentValue> arguments,
        List<Field> subSelection,
        FragmentAttachments fragments,
        Set<Origin> originPaths,
        Deferral deferral,
        InclusionCondition condition
) {
    public Field {
        Objects.requireNonNull(responseKey, "responseKey");
        Objects.requireNonNull(schemaFieldName, "schemaFieldName");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments == null ? Map.of() : arguments));
        subSelection = List.copyOf(subSelection == null ? List.of() : subSelection);
        fragments = fragments == null ? FragmentAttachments.EMPTY : fragments;
        originPaths = Collections.unmodifiableSet(new LinkedHashSet<>(originPaths == null ? Set.of() : originPaths));
        condition = condition == null ? InclusionCondition.ALWAYS : condition;
    }

    /** Synthetic field standing for the root selection of an operation or fragment definition. */
    public static Field root(String name, String typeName, NamedTypeKind kind, List<Field> subSelection,
                             FragmentAttachments fragments, Origin origin) {
        return new Field(name, name, TypeRef.named(typeName, false), kind, Map.of(), subSelection,
                fragments, Set.of(origin), null, InclusionCondition.ALWAYS);
    }

    public boolean isLeaf() { return kind.isLeaf(); }

    public boolean isDeferred() { return deferral != null; }

    public Field withSubSelection(List<Field> fields) {
        return new Field(responseKey, schemaFieldName, type, kind, arguments, fields, fragments,
                originPaths, deferral, condition);
    }

    public Field withFragments(FragmentAttachments newFragments) {
        return new Field(responseKey, schemaFieldName, type, kind, arguments, subSelection, newFragments,
                originPaths, deferral, condition);
    }

    public Field withOriginPaths(Set<Origin> origins) {
        return new Field(responseKey, schemaFieldName, type, kind, arguments, subSelection, fragments,
                origins, deferral, condition);
    }

    public Field withDeferral(Deferral newDeferral) {
        return new Field(responseKey, schemaFieldName, type, kind, arguments, subSelection, fragments,
                originPaths, newDeferral, condition);
    }

    public Field withCondition(InclusionCondition newCondition) {
        return new Field(responseKey, schemaFieldName, type, kind, arguments, subSelection, fragments,
                originPaths, deferral, newCondition);
    }

    @Override
    public String toString() {
        return responseKey + ": " + type;
    }
}
