package io.fieldtree.core.schema;

import io.fieldtree.core.document.OperationType;

import java.util.*;

/**
 * Validated schema type graph handed over by the schema loader.
 * <p>
 * Answers the questions the selection model and the shape compiler ask:
 *  - which type does field {@code f} of type {@code T} have,
 *  - which concrete object types can stand in for {@code T},
 *  - does a type condition always hold for values of a given type.
 * <p>
 * Immutable once built; shared freely across threads.
 */
public final class TypeGraph {

    public static final String TYPENAME = "__typename";

    private static final SchemaField TYPENAME_FIELD =
            new SchemaField(TYPENAME, TypeRef.named("String", false));

    private static final List<String> BUILT_IN_SCALARS = List.of("String", "Int", "Float", "Boolean", "ID");

    private final Map<String, SchemaType> types;
    private final Map<OperationType, String> rootTypes;

    private TypeGraph(Map<String, SchemaType> types, Map<OperationType, String> rootTypes) {
        this.types = Map.copyOf(types);
        this.rootTypes = Map.copyOf(rootTypes);
    }

    public static Builder builder() { return new Builder(); }

    public Optional<SchemaType> type(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public boolean hasType(String name) { return types.containsKey(name); }

    public Collection<SchemaType> types() { return types.values(); }

    /** Root type name for an operation type, e.g. {@code Query}. */
    public Optional<String> rootType(OperationType operationType) {
        return Optional.ofNullable(rootTypes.get(operationType));
    }

    public NamedTypeKind kind(String typeName) {
        SchemaType t = types.get(typeName);
        if (t == null) throw new IllegalArgumentException("unknown type " + typeName);
        return t.kind();
    }

    /**
     * Field definition on a composite type, including the implicit {@code __typename}.
     * Empty when the type is unknown, not composite, or lacks the field.
     */
    public Optional<SchemaField> field(String typeName, String fieldName) {
        SchemaType t = types.get(typeName);
        if (t == null || t.kind().isLeaf() || t.kind() == NamedTypeKind.INPUT_OBJECT) {
            return Optional.empty();
        }
        if (TYPENAME.equals(fieldName)) return Optional.of(TYPENAME_FIELD);
        return Optional.ofNullable(t.field(fieldName));
    }

    /** Concrete object types a value of {@code typeName} can have at runtime. */
    public Set<String> possibleTypes(String typeName) {
        SchemaType t = types.get(typeName);
        if (t == null) return Set.of();
        return t.possibleTypes();
    }

    /**
     * True when every runtime value of {@code typeName} satisfies {@code condition}:
     * the possible types of {@code typeName} are a subset of those of {@code condition}.
     */
    public boolean covers(String condition, String typeName) {
        if (condition.equals(typeName)) return true;
        Set<String> cond = possibleTypes(condition);
        Set<String> target = possibleTypes(typeName);
        return !target.isEmpty() && cond.containsAll(target);
    }

    /** Builder; built-in scalars are registered up front. */
    public static final class Builder {
        private final Map<String, SchemaType> types = new LinkedHashMap<>();
        private final Map<OperationType, String> rootTypes = new EnumMap<>(OperationType.class);

        private Builder() {
            for (String s : BUILT_IN_SCALARS) {
                types.put(s, new SchemaType(s, NamedTypeKind.SCALAR, null, null, null));
            }
        }

        public Builder type(SchemaType type) {
            types.put(type.name(), type);
            return this;
        }

        public Builder scalar(String name) {
            return type(new SchemaType(name, NamedTypeKind.SCALAR, null, null, null));
        }

        public Builder enumType(String name, String... values) {
            return type(new SchemaType(name, NamedTypeKind.ENUM, null, null, List.of(values)));
        }

        /**
         * Object type. Fields are given as alternating name / SDL type pairs:
         * {@code object("Droid", "id", "ID!", "name", "String!")}.
         */
        public Builder object(String name, String... fieldPairs) {
            return type(new SchemaType(name, NamedTypeKind.OBJECT, fields(fieldPairs), null, null));
        }

        public Builder interfaceType(String name, Set<String> possibleTypes, String... fieldPairs) {
            return type(new SchemaType(name, NamedTypeKind.INTERFACE, fields(fieldPairs), possibleTypes, null));
        }

        public Builder union(String name, String... members) {
            return type(new SchemaType(name, NamedTypeKind.UNION, null, Set.of(members), null));
        }

        /** Mark an already declared field as deprecated. */
        public Builder deprecate(String typeName, String fieldName, String reason) {
            SchemaType t = types.get(typeName);
            if (t == null || t.field(fieldName) == null) {
                throw new IllegalArgumentException("unknown field " + typeName + "." + fieldName);
            }
            var fields = new LinkedHashMap<>(t.fields());
            fields.put(fieldName, new SchemaField(fieldName, t.field(fieldName).type(), reason));
            return type(new SchemaType(t.name(), t.kind(), fields, t.possibleTypes(), t.enumValues()));
        }

        public Builder root(OperationType operationType, String typeName) {
            rootTypes.put(operationType, typeName);
            return this;
        }

        public TypeGraph build() {
            if (!rootTypes.containsKey(OperationType.QUERY) && types.containsKey("Query")) {
                rootTypes.put(OperationType.QUERY, "Query");
            }
            return new TypeGraph(types, rootTypes);
        }

        private static Map<String, SchemaField> fields(String... pairs) {
            if (pairs.length % 2 != 0) throw new IllegalArgumentException("field pairs must be name/type");
            Map<String, SchemaField> out = new LinkedHashMap<>();
            for (int i = 0; i < pairs.length; i += 2) {
                out.put(pairs[i], new SchemaField(pairs[i], TypeRef.parse(pairs[i + 1])));
            }
            return out;
        }
    }
}
