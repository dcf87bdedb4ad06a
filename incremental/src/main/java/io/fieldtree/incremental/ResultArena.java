package io.fieldtree.incremental;

import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.tree.ObjectShape;

import java.util.*;

/**
 * Every object of a decoded result, stored once under a stable index together with its
 * absolute path and the flat shape it was decoded with. Patches address objects through
 * the path index instead of walking the result.
 */
final class ResultArena {

    /** @param value the live map inside the result tree */
    record Entry(int index, ResponsePath path, ObjectShape shape, Map<String, Object> value) {}

    private final List<Entry> entries = new ArrayList<>();
    private final Map<ResponsePath, Integer> byPath = new HashMap<>();

    Entry add(ResponsePath path, ObjectShape shape, Map<String, Object> value) {
        if (byPath.containsKey(path)) throw new IllegalStateException("object already registered at " + path);
        Entry e = new Entry(entries.size(), path, shape, value);
        entries.add(e);
        byPath.put(path, e.index());
        return e;
    }

    Optional<Entry> at(ResponsePath path) {
        Integer i = byPath.get(path);
        return i == null ? Optional.empty() : Optional.of(entries.get(i));
    }

    Entry get(int index) {
        return entries.get(index);
    }

    int size() {
        return entries.size();
    }
}
