package io.fieldtree.core.schema;

/** Kind of a named schema type. */
public enum NamedTypeKind {
    SCALAR,
    ENUM,
    OBJECT,
    INTERFACE,
    UNION,
    INPUT_OBJECT;

    /** Scalars and enums end a selection: they never carry a sub-selection. */
    public boolean isLeaf() {
        return this == SCALAR || this == ENUM;
    }

    /** Interfaces and unions resolve to one of several concrete object types at runtime. */
    public boolean isAbstract() {
        return this == INTERFACE || this == UNION;
    }
}
