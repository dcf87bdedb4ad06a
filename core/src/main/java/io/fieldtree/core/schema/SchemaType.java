package io.fieldtree.core.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named type of the schema graph.
 *
 * @param fields        composite types only; empty for scalars and enums
 * @param possibleTypes concrete object types an abstract type resolves to;
 *                      for an object type this is the type itself
 * @param enumValues    enums only
 */
public record SchemaType(
        String name,
        NamedTypeKind kind,
        Map<String, SchemaField> fields,
        Set<String> possibleTypes,
        List<String> enumValues
) {
    public SchemaType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        fields = Map.copyOf(fields == null ? Map.of() : fields);
        possibleTypes = kind == NamedTypeKind.OBJECT
                ? Set.of(name)
                : Set.copyOf(possibleTypes == null ? Set.of() : possibleTypes);
        enumValues = List.copyOf(enumValues == null ? List.of() : enumValues);
    }

    public SchemaField field(String fieldName) {
        return fields.get(fieldName);
    }
}
