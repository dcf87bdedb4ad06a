package io.fieldtree.codec;

import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.FieldTreeException;
import io.fieldtree.core.ResponsePath;

/** Failure while decoding or encoding a payload against a canonical tree. */
public class CodecException extends FieldTreeException {

    public CodecException(ErrorKind kind, ResponsePath path, String message) {
        super(kind, path, message);
    }

    public CodecException(ErrorKind kind, ResponsePath path, String message, Throwable cause) {
        super(kind, path, message, cause);
    }
}
