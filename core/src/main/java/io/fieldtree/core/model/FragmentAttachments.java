package io.fieldtree.core.model;

import java.util.*;

/**
 * Fragments attached to one selection level plus the accessor table
 * (fragment identity -> handle) consumers use to reach a fragment's data.
 */
public record FragmentAttachments(List<Fragment> fragments, Map<String, String> accessors) {

    public static final FragmentAttachments EMPTY = new FragmentAttachments(List.of(), Map.of());

    public FragmentAttachments {
        fragments = List.copyOf(fragments == null ? List.of() : fragments);
        accessors = Collections.unmodifiableMap(new LinkedHashMap<>(accessors == null ? Map.of() : accessors));
    }

    /** Builds the accessor table for {@code fragments}, suffixing colliding handles. */
    public static FragmentAttachments of(List<Fragment> fragments) {
        Map<String, String> accessors = new LinkedHashMap<>();
        for (Fragment f : fragments) {
            assignAccessor(accessors, f.identity(), f.defaultAccessor());
        }
        return new FragmentAttachments(fragments, accessors);
    }

    public boolean isEmpty() { return fragments.isEmpty(); }

    public FragmentAttachments withFragments(List<Fragment> newFragments) {
        return new FragmentAttachments(newFragments, accessors);
    }

    /** Union of two accessor tables; entries of {@code this} win, clashing handles get a suffix. */
    public Map<String, String> unionAccessors(Map<String, String> other) {
        Map<String, String> out = new LinkedHashMap<>(accessors);
        for (var e : other.entrySet()) {
            if (!out.containsKey(e.getKey())) {
                assignAccessor(out, e.getKey(), e.getValue());
            }
        }
        return out;
    }

    /** Fragment reachable through {@code handle}. */
    public Optional<Fragment> byAccessor(String handle) {
        for (var e : accessors.entrySet()) {
            if (e.getValue().equals(handle)) {
                String identity = e.getKey();
                return fragments.stream().filter(f -> f.identity().equals(identity)).findFirst();
            }
        }
        return Optional.empty();
    }

    private static void assignAccessor(Map<String, String> accessors, String identity, String preferred) {
        if (accessors.containsKey(identity)) return;
        Collection<String> used = accessors.values();
        String handle = preferred;
        int n = 1;
        while (used.contains(handle)) {
            handle = preferred + n++;
        }
        accessors.put(identity, handle);
    }
}
