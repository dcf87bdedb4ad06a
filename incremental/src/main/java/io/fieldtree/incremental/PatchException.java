package io.fieldtree.incremental;

import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.FieldTreeException;
import io.fieldtree.core.ResponsePath;

/** A patch that cannot be applied; the result it targeted is left as it was. */
public class PatchException extends FieldTreeException {

    public PatchException(ErrorKind kind, ResponsePath path, String message) {
        super(kind, path, message);
    }
}
