package io.fieldtree.codec;

import io.fieldtree.core.model.Field;
import io.fieldtree.core.model.Fragment;
import io.fieldtree.core.schema.NamedTypeKind;
import io.fieldtree.core.schema.TypeGraph;
import io.fieldtree.core.tree.CanonicalTree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a fragment's part of a decoded object through its accessor handle
 * ({@code heroDetails}, {@code asDroid}) without walking the tree again.
 */
public final class FragmentAccess {

    private FragmentAccess() {
    }

    /**
     * @param field  field whose selection carries the fragment; {@code tree.root()} for top-level fragments
     * @param object decoded value of that field
     * @return the fragment's keys in fragment order, or empty when the object's runtime
     *         type does not satisfy the fragment's type condition
     * @throws IllegalArgumentException if no fragment is reachable through {@code accessor}
     */
    public static Optional<Map<String, Object>> view(
            CanonicalTree tree,
            Field field,
            Map<String, Object> object,
            String accessor
    ) {
        Fragment fragment = field.fragments().byAccessor(accessor).orElseThrow(() -> new IllegalArgumentException(
                "no fragment reachable through '" + accessor + "' on " + field.responseKey()));

        String runtimeType = runtimeType(tree.graph(), field, object);
        if (runtimeType == null || !tree.graph().covers(fragment.typeCondition(), runtimeType)) {
            return Optional.empty();
        }

        Map<String, Object> out = new LinkedHashMap<>();
        for (Field f : fragment.fields()) {
            if (object.containsKey(f.responseKey())) {
                out.put(f.responseKey(), object.get(f.responseKey()));
            }
        }
        return Optional.of(out);
    }

    private static String runtimeType(TypeGraph graph, Field field, Map<String, Object> object) {
        if (object.get(TypeGraph.TYPENAME) instanceof String t) return t;
        String declared = field.type().namedType();
        return graph.kind(declared) == NamedTypeKind.OBJECT ? declared : null;
    }
}
