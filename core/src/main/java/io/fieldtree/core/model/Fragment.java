package io.fieldtree.core.model;

import java.util.*;

/**
 * Named (spread) or inline fragment attached to a selection.
 * <p>
 * Once merged, {@code fields} also holds every field of the enclosing selection,
 * so a fragment decodes on its own whatever the entry point.
 *
 * @param name          null for inline fragments
 * @param typeCondition type the runtime object must satisfy
 */
public record Fragment(
        String name,
        String typeCondition,
        List<Field> fields,
        Set<Origin> originPaths,
        Deferral deferral,
        InclusionCondition condition
) {
    public Fragment {
        Objects.requireNonNull(typeCondition, "typeCondition");
        fields = List.copyOf(fields == null ? List.of() : fields);
        originPaths = Collections.unmodifiableSet(new LinkedHashSet<>(originPaths == null ? Set.of() : originPaths));
        condition = condition == null ? InclusionCondition.ALWAYS : condition;
    }

    public boolean isInline() { return name == null; }

    /**
     * Stable identity used by the accessor table: the name of a named fragment,
     * or type condition plus source position for an inline one.
     */
    public String identity() {
        if (name != null) return name;
        Origin first = originPaths.isEmpty() ? null : originPaths.iterator().next();
        return "... on " + typeCondition + (first == null ? "" : "@" + first.location());
    }

    /** Preferred accessor handle: {@code heroDetails} for {@code HeroDetails}, {@code asDroid} for {@code ... on Droid}. */
    public String defaultAccessor() {
        if (name != null) {
            return Character.toLowerCase(name.charAt(0)) + name.substring(1);
        }
        return "as" + typeCondition;
    }

    public Fragment withFields(List<Field> newFields) {
        return new Fragment(name, typeCondition, newFields, originPaths, deferral, condition);
    }

    @Override
    public String toString() {
        return identity() + " " + fields;
    }
}
