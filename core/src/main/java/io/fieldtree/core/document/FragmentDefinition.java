package io.fieldtree.core.document;

import java.util.List;
import java.util.Objects;

/** {@code fragment Name on Type { ... }}. */
public record FragmentDefinition(
        String name,
        String typeCondition,
        List<Selection> selections,
        SourceLocation location
) {
    public FragmentDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(typeCondition, "typeCondition");
        selections = List.copyOf(selections == null ? List.of() : selections);
        location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public static FragmentDefinition of(String name, String typeCondition, Selection... selections) {
        return new FragmentDefinition(name, typeCondition, List.of(selections), null);
    }
}
