package io.fieldtree.core.document;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code ... on Type { ... }}.
 *
 * @param typeCondition null when the inline fragment has no type condition
 */
public record InlineFragment(
        String typeCondition,
        List<Directive> directives,
        List<Selection> selections,
        SourceLocation location
) implements Selection {

    public InlineFragment {
        directives = List.copyOf(directives == null ? List.of() : directives);
        selections = List.copyOf(selections == null ? List.of() : selections);
        location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public static InlineFragment on(String typeCondition, Selection... selections) {
        return new InlineFragment(typeCondition, List.of(), List.of(selections), null);
    }

    public InlineFragment withDirective(Directive directive) {
        var dirs = new ArrayList<>(directives);
        dirs.add(directive);
        return new InlineFragment(typeCondition, dirs, selections, location);
    }

    public InlineFragment at(int line, int column) {
        return new InlineFragment(typeCondition, directives, selections, new SourceLocation(line, column));
    }
}
