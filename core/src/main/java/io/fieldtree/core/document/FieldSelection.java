package io.fieldtree.core.document;

import java.util.*;

/**
 * Field as written in the document, before type resolution.
 *
 * @param alias null when the field is not aliased
 */
public record FieldSelection(
        String alias,
        String name,
        Map<String, ArgumentValue> arguments,
        List<Directive> directives,
        List<Selection> selections,
        SourceLocation location
) implements Selection {

    public FieldSelection {
        Objects.requireNonNull(name, "name");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments == null ? Map.of() : arguments));
        directives = List.copyOf(directives == null ? List.of() : directives);
        selections = List.copyOf(selections == null ? List.of() : selections);
        location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public static FieldSelection of(String name, Selection... selections) {
        return new FieldSelection(null, name, Map.of(), List.of(), List.of(selections), null);
    }

    /** Key under which the value appears in the response: alias if present, else the field name. */
    public String responseKey() {
        return alias != null ? alias : name;
    }

    public FieldSelection withAlias(String newAlias) {
        return new FieldSelection(newAlias, name, arguments, directives, selections, location);
    }

    public FieldSelection withArgument(String argName, ArgumentValue value) {
        var args = new LinkedHashMap<>(arguments);
        args.put(argName, value);
        return new FieldSelection(alias, name, args, directives, selections, location);
    }

    public FieldSelection withDirective(Directive directive) {
        var dirs = new ArrayList<>(directives);
        dirs.add(directive);
        return new FieldSelection(alias, name, arguments, dirs, selections, location);
    }

    public FieldSelection at(int line, int column) {
        return new FieldSelection(alias, name, arguments, directives, selections, new SourceLocation(line, column));
    }
}
