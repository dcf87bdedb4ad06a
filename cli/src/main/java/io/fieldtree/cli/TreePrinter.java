package io.fieldtree.cli;

import io.fieldtree.core.model.Field;
import io.fieldtree.core.model.Origin;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.FieldSlot;
import io.fieldtree.core.tree.ObjectShape;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Human-readable dump of a canonical tree: slots in canonical order with their types,
 * deferrals, conditions and origins; polymorphic positions list each variant's slots.
 */
final class TreePrinter {

    private TreePrinter() {
    }

    static String print(CanonicalTree tree) {
        StringBuilder sb = new StringBuilder();
        String kind = tree.operationType() == null ? "fragment" : tree.operationType().name().toLowerCase(Locale.ROOT);
        sb.append(kind).append(' ').append(tree.name())
                .append(" on ").append(tree.shape().typeName())
                .append(" (fallback ").append(tree.fallback()).append(")\n");
        if (!tree.variables().isEmpty()) {
            sb.append("variables: ").append(tree.variables().stream()
                    .map(v -> "$" + v.name() + ": " + v.type())
                    .collect(Collectors.joining(", "))).append('\n');
        }
        if (!tree.deferLabels().isEmpty()) {
            sb.append("defer labels: ").append(tree.deferLabels()).append('\n');
        }
        shape(sb, tree.shape(), 1);
        return sb.toString();
    }

    private static void shape(StringBuilder sb, ObjectShape shape, int depth) {
        for (FieldSlot slot : shape.slots()) {
            slot(sb, slot, depth);
        }
        if (!shape.isPolymorphic()) return;
        for (Map.Entry<String, ObjectShape> v : shape.variants().entrySet()) {
            indent(sb, depth).append("... on ").append(v.getKey()).append('\n');
            shape(sb, v.getValue(), depth + 1);
        }
        if (shape.catchAll().isPresent()) {
            indent(sb, depth).append("... otherwise (").append(shape.typeName()).append(")\n");
        }
    }

    private static void slot(StringBuilder sb, FieldSlot slot, int depth) {
        Field f = slot.field();
        indent(sb, depth).append(slot.index()).append(' ').append(f.responseKey());
        if (!f.responseKey().equals(f.schemaFieldName())) sb.append(" <- ").append(f.schemaFieldName());
        sb.append(": ").append(f.type());
        if (!f.arguments().isEmpty()) sb.append(' ').append(f.arguments().keySet());
        if (f.isDeferred()) sb.append(' ').append(f.deferral());
        if (!f.condition().isAlways()) sb.append(" if ").append(f.condition());
        if (!f.originPaths().isEmpty()) {
            sb.append("  # ").append(f.originPaths().stream().map(Origin::toString).collect(Collectors.joining(", ")));
        }
        sb.append('\n');
        if (!slot.isLeaf()) shape(sb, slot.child(), depth + 1);
    }

    private static StringBuilder indent(StringBuilder sb, int depth) {
        return sb.append("  ".repeat(depth));
    }
}
