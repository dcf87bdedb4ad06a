package io.fieldtree.core.document;

import java.util.List;
import java.util.Objects;

public record OperationDefinition(
        OperationType operationType,
        String name,
        List<VariableDefinition> variables,
        List<Selection> selections,
        SourceLocation location
) {
    public OperationDefinition {
        Objects.requireNonNull(operationType, "operationType");
        Objects.requireNonNull(name, "name");
        variables = List.copyOf(variables == null ? List.of() : variables);
        selections = List.copyOf(selections == null ? List.of() : selections);
        location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public static OperationDefinition query(String name, Selection... selections) {
        return new OperationDefinition(OperationType.QUERY, name, List.of(), List.of(selections), null);
    }

    public OperationDefinition withVariables(List<VariableDefinition> newVariables) {
        return new OperationDefinition(operationType, name, newVariables, selections, location);
    }
}
