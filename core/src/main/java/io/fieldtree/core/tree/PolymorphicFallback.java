package io.fieldtree.core.tree;

/**
 * What decoding does with a runtime type that no type-conditioned fragment matches.
 * Chosen explicitly for every compiled tree.
 */
public enum PolymorphicFallback {
    /** Decode with the fields every possible type shares (the enclosing selection). */
    CATCH_ALL,
    /** Fail with {@code UNHANDLED_TYPE_CONDITION}. */
    STRICT
}
