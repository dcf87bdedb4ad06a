package io.fieldtree.core;

/**
 * Raised while building a canonical tree: schema mismatches, merge conflicts,
 * duplicate defer labels. Always fatal for the tree being compiled.
 */
public class CompileException extends FieldTreeException {

    public CompileException(ErrorKind kind, ResponsePath path, String message) {
        super(kind, path, message);
    }
}
