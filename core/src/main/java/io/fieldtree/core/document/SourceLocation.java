package io.fieldtree.core.document;

/** Line/column of a selection in its source document (1-based; 0 when unknown). */
public record SourceLocation(int line, int column) {

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
