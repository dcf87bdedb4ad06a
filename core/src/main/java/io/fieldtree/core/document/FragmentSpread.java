package io.fieldtree.core.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@code ...Name} reference to a fragment definition. */
public record FragmentSpread(String name, List<Directive> directives, SourceLocation location) implements Selection {

    public FragmentSpread {
        Objects.requireNonNull(name, "name");
        directives = List.copyOf(directives == null ? List.of() : directives);
        location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public static FragmentSpread of(String name) {
        return new FragmentSpread(name, List.of(), null);
    }

    public FragmentSpread withDirective(Directive directive) {
        var dirs = new ArrayList<>(directives);
        dirs.add(directive);
        return new FragmentSpread(name, dirs, location);
    }

    public FragmentSpread at(int line, int column) {
        return new FragmentSpread(name, directives, new SourceLocation(line, column));
    }
}
