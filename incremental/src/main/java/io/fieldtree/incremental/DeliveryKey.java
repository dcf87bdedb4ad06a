package io.fieldtree.incremental;

import io.fieldtree.core.ResponsePath;

/**
 * Identifies one expected delivery: the defer label plus the path it is delivered at
 * (the field's path for field-level deferrals, the object's path for fragment-level ones).
 * The same labeled deferral inside a list yields one key per element.
 *
 * @param label null for unlabeled deferrals
 */
public record DeliveryKey(String label, ResponsePath path) {

    @Override
    public String toString() {
        return (label == null ? "<unlabeled>" : label) + "@" + path;
    }
}
