package io.fieldtree.core.tree;

import io.fieldtree.core.document.OperationType;
import io.fieldtree.core.document.VariableDefinition;
import io.fieldtree.core.model.Field;
import io.fieldtree.core.schema.TypeGraph;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fully merged selection of one operation (or fragment definition) plus its precomputed
 * shapes. The single source of truth for decode and encode.
 * <p>
 * Immutable after construction; safe to share across threads and requests.
 */
public final class CanonicalTree {

    private final String name;
    private final OperationType operationType;
    private final Field root;
    private final ObjectShape shape;
    private final List<VariableDefinition> variables;
    private final Set<String> referencedVariables;
    private final Set<String> deferLabels;
    private final PolymorphicFallback fallback;
    private final TypeGraph graph;

    CanonicalTree(
            String name,
            OperationType operationType,
            Field root,
            ObjectShape shape,
            List<VariableDefinition> variables,
            Set<String> referencedVariables,
            Set<String> deferLabels,
            PolymorphicFallback fallback,
            TypeGraph graph
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.operationType = operationType;
        this.root = Objects.requireNonNull(root, "root");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.variables = List.copyOf(variables);
        this.referencedVariables = Set.copyOf(referencedVariables);
        this.deferLabels = Set.copyOf(deferLabels);
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /** Operation or fragment name. */
    public String name() { return name; }

    /** Null for a tree compiled from a fragment definition. */
    public OperationType operationType() { return operationType; }

    /** Synthetic root field; its sub-selection is the merged top-level selection. */
    public Field root() { return root; }

    /** Shape of the root object. */
    public ObjectShape shape() { return shape; }

    /** Variables declared by the operation (empty for fragments). */
    public List<VariableDefinition> variables() { return variables; }

    /** Variables read anywhere in the tree: arguments, conditions, defaults. */
    public Set<String> referencedVariables() { return referencedVariables; }

    public Set<String> deferLabels() { return deferLabels; }

    public PolymorphicFallback fallback() { return fallback; }

    public TypeGraph graph() { return graph; }

    @Override
    public String toString() {
        return "CanonicalTree[" + name + " " + shape + "]";
    }
}
