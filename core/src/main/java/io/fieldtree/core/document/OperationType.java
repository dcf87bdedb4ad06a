package io.fieldtree.core.document;

public enum OperationType {
    QUERY,
    MUTATION,
    SUBSCRIPTION
}
