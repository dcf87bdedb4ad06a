package io.fieldtree.core;

import java.util.Objects;

/**
 * Base class of every failure raised while building or consuming a canonical tree.
 * <p>
 * Carries the {@link ErrorKind} and the path of the field, fragment or patch
 * that caused it, so callers can react on the kind and report the exact position.
 */
public class FieldTreeException extends RuntimeException {

    private final ErrorKind kind;
    private final ResponsePath path;

    public FieldTreeException(ErrorKind kind, ResponsePath path, String message) {
        this(kind, path, message, null);
    }

    public FieldTreeException(ErrorKind kind, ResponsePath path, String message, Throwable cause) {
        super(kind + " at " + path + ": " + message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = Objects.requireNonNull(path, "path");
    }

    public ErrorKind kind() { return kind; }

    public ResponsePath path() { return path; }
}
