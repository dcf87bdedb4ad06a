package io.fieldtree.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable position inside a response: a sequence of response keys (String)
 * and list indices (Integer).
 * <p>
 * Used as the address of merge conflicts, decode failures and incremental patches,
 * and as the lookup key of the result arena, so equals/hashCode are value based.
 */
public record ResponsePath(List<Object> segments) {

    private static final ResponsePath ROOT = new ResponsePath(List.of());

    public ResponsePath {
        Objects.requireNonNull(segments, "segments");
        for (Object s : segments) {
            if (!(s instanceof String) && !(s instanceof Integer)) {
                throw new IllegalArgumentException("path segment must be a String or an Integer: " + s);
            }
        }
        segments = List.copyOf(segments);
    }

    public static ResponsePath root() { return ROOT; }

    public static ResponsePath of(Object... segments) {
        return new ResponsePath(List.of(segments));
    }

    public ResponsePath append(String key) {
        return with(key);
    }

    public ResponsePath append(int index) {
        return with(index);
    }

    public boolean isRoot() { return segments.isEmpty(); }

    public int size() { return segments.size(); }

    /** Last segment, or null at the root. */
    public Object last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    /** Path without its last segment. The root is its own parent. */
    public ResponsePath parent() {
        if (segments.isEmpty()) return this;
        return new ResponsePath(segments.subList(0, segments.size() - 1));
    }

    private ResponsePath with(Object segment) {
        var next = new ArrayList<>(segments);
        next.add(segment);
        return new ResponsePath(next);
    }

    /** Renders as {@code computers[0].screen}; the root renders as {@code $}. */
    @Override
    public String toString() {
        if (segments.isEmpty()) return "$";
        StringBuilder sb = new StringBuilder();
        for (Object s : segments) {
            if (s instanceof Integer i) {
                sb.append('[').append(i).append(']');
            } else {
                if (sb.length() > 0) sb.append('.');
                sb.append(s);
            }
        }
        return sb.toString();
    }
}
