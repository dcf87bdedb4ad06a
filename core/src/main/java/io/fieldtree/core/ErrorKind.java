package io.fieldtree.core;

/**
 * Every failure the compiler, codec and incremental merger can report.
 * <p>
 * Grouped by the phase that raises them:
 *  - compile time: the canonical tree is never built (no degraded tree).
 *  - decode/encode time: the enclosing object is abandoned, the path names the culprit.
 *  - patch time: only the offending patch is rejected.
 */
public enum ErrorKind {
    // compile time
    SCHEMA_MISMATCH,
    DUPLICATE_DEFER_LABEL,
    FIELD_MERGE_CONFLICT,
    FRAGMENT_MERGE_CONFLICT,
    WARNINGS_AS_ERRORS,

    // decode / encode time
    SCALAR_COERCION_ERROR,
    NON_NULL_VIOLATION,
    UNHANDLED_TYPE_CONDITION,
    MISSING_REQUIRED_FIELD,
    MISSING_VARIABLE,
    TYPE_MISMATCH,

    // incremental delivery
    UNRESOLVABLE_PATCH_PATH,
    DUPLICATE_PATCH,
    INCOMPLETE_DELIVERY
}
