package io.fieldtree.core.tree;

import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.merge.MergeEngine;
import io.fieldtree.core.model.Field;
import io.fieldtree.core.model.Fragment;
import io.fieldtree.core.schema.TypeGraph;

import java.util.*;

/**
 * Derives {@link ObjectShape}s from canonical fields.
 * <p>
 * For a polymorphic level, every conditional fragment expands to the concrete types it
 * applies to; the variant of a concrete type is the merge of all fragments applying to it
 * (each already carries the parent fields). Variant order follows fragment order.
 */
final class ShapeCompiler {

    private final TypeGraph graph;
    private final MergeEngine engine;
    private final PolymorphicFallback fallback;

    ShapeCompiler(TypeGraph graph, MergeEngine engine, PolymorphicFallback fallback) {
        this.graph = graph;
        this.engine = engine;
        this.fallback = fallback;
    }

    ObjectShape compile(Field field, ResponsePath path) {
        String typeName = field.type().namedType();
        List<Field> fields = field.subSelection();
        List<Fragment> fragments = field.fragments().fragments();

        if (!engine.isPolymorphic(typeName, fragments)) {
            return ObjectShape.flat(typeName, slots(fields, path));
        }

        List<Fragment> conditional = new ArrayList<>();
        for (Fragment fr : fragments) {
            if (!engine.isUnconditional(fr, typeName)) conditional.add(fr);
        }

        Map<String, ObjectShape> variants = new LinkedHashMap<>();
        for (String concrete : concreteTypes(typeName, conditional)) {
            List<Field> merged = null;
            for (Fragment fr : conditional) {
                if (!graph.covers(fr.typeCondition(), concrete)) continue;
                merged = merged == null ? fr.fields() : engine.mergeFields(merged, fr.fields(), path);
            }
            if (merged != null) {
                variants.put(concrete, ObjectShape.flat(concrete, slots(merged, path)));
            }
        }

        List<FieldSlot> base = slots(fields, path);
        ObjectShape catchAll = fallback == PolymorphicFallback.CATCH_ALL ? ObjectShape.flat(typeName, base) : null;
        return ObjectShape.polymorphic(typeName, base, variants, catchAll);
    }

    private List<FieldSlot> slots(List<Field> fields, ResponsePath path) {
        List<FieldSlot> out = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            Field f = fields.get(i);
            ObjectShape child = f.isLeaf() ? null : compile(f, path.append(f.responseKey()));
            out.add(new FieldSlot(i, f, child));
        }
        return out;
    }

    /** Concrete types reachable through the fragments, in fragment order then by name. */
    private Set<String> concreteTypes(String typeName, List<Fragment> fragments) {
        Set<String> possible = graph.possibleTypes(typeName);
        Set<String> out = new LinkedHashSet<>();
        for (Fragment fr : fragments) {
            List<String> sorted = new ArrayList<>(graph.possibleTypes(fr.typeCondition()));
            Collections.sort(sorted);
            for (String t : sorted) {
                if (possible.contains(t)) out.add(t);
            }
        }
        return out;
    }
}
