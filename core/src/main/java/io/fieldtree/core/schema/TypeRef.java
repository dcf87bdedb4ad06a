package io.fieldtree.core.schema;

import java.util.Objects;

/**
 * Reference to a schema type as used by a field: a named type wrapped in
 * any number of list levels, each level with its own nullability.
 * <p>
 * Exactly one of {@code name} / {@code ofType} is set:
 *  - named:  {@code name} != null, {@code ofType} == null
 *  - list:   {@code name} == null, {@code ofType} is the element type
 * <p>
 * Rendered and parsed in SDL notation, e.g. {@code [Droid!]!}.
 */
public record TypeRef(String name, TypeRef ofType, boolean nullable) {

    public TypeRef {
        if ((name == null) == (ofType == null)) {
            throw new IllegalArgumentException("exactly one of name/ofType must be set");
        }
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static TypeRef named(String name, boolean nullable) {
        return new TypeRef(Objects.requireNonNull(name, "name"), null, nullable);
    }

    public static TypeRef list(TypeRef element, boolean nullable) {
        return new TypeRef(null, Objects.requireNonNull(element, "element"), nullable);
    }

    /**
     * Parse SDL notation: {@code Int}, {@code String!}, {@code [Character]}, {@code [[ID!]!]}.
     */
    public static TypeRef parse(String sdl) {
        Objects.requireNonNull(sdl, "sdl");
        String s = sdl.strip();
        if (s.isEmpty()) throw new IllegalArgumentException("empty type reference");

        boolean nullable = true;
        if (s.endsWith("!")) {
            nullable = false;
            s = s.substring(0, s.length() - 1).strip();
        }
        if (s.startsWith("[")) {
            if (!s.endsWith("]")) throw new IllegalArgumentException("unbalanced list type: " + sdl);
            return list(parse(s.substring(1, s.length() - 1)), nullable);
        }
        if (s.contains("[") || s.contains("]") || s.contains("!")) {
            throw new IllegalArgumentException("malformed type reference: " + sdl);
        }
        return named(s, nullable);
    }

    public boolean isList() { return ofType != null; }

    /** Innermost named type. */
    public String namedType() {
        return ofType == null ? name : ofType.namedType();
    }

    /** Number of list wrappers around the named type. */
    public int listDepth() {
        return ofType == null ? 0 : 1 + ofType.listDepth();
    }

    /** Element type of a list reference. */
    public TypeRef elementType() {
        if (ofType == null) throw new IllegalStateException(this + " is not a list type");
        return ofType;
    }

    @Override
    public String toString() {
        String base = ofType == null ? name : "[" + ofType + "]";
        return nullable ? base : base + "!";
    }
}
