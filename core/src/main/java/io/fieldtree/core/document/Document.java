package io.fieldtree.core.document;

import java.util.List;
import java.util.Optional;

/**
 * Parsed, syntax-checked executable document: operations plus the fragment
 * definitions they may spread.
 */
public record Document(List<OperationDefinition> operations, List<FragmentDefinition> fragments) {

    public Document {
        operations = List.copyOf(operations == null ? List.of() : operations);
        fragments = List.copyOf(fragments == null ? List.of() : fragments);
    }

    public Optional<OperationDefinition> operation(String name) {
        return operations.stream().filter(o -> o.name().equals(name)).findFirst();
    }

    public Optional<FragmentDefinition> fragment(String name) {
        return fragments.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
