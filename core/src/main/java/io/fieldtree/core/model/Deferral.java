package io.fieldtree.core.model;

import io.fieldtree.core.document.ArgumentValue;

import java.util.function.Function;

/**
 * Marks a field (or every field of a fragment) as delivered after the base payload.
 *
 * @param label         optional label from the defer directive, unique per operation
 * @param typeCondition type condition of the deferred fragment; null when the directive sits
 *                      on a field itself
 * @param condition     the directive's {@code if} argument; null when it always defers
 */
public record Deferral(String label, String typeCondition, ArgumentValue condition) {

    public static Deferral onField(String label) {
        return new Deferral(label, null, null);
    }

    public static Deferral onFragment(String label, String typeCondition) {
        return new Deferral(label, typeCondition, null);
    }

    public Deferral when(ArgumentValue ifArgument) {
        return new Deferral(label, typeCondition, ifArgument);
    }

    /** Field-level deferrals are delivered at the field's own path, fragment-level ones at the object. */
    public boolean isFieldLevel() { return typeCondition == null; }

    /**
     * Whether delivery is actually deferred under the given variables. A false {@code if}
     * means the value arrives with the base payload.
     *
     * @throws IllegalArgumentException if {@code if} does not evaluate to a boolean
     */
    public boolean isActive(Function<String, Object> variables) {
        if (condition == null) return true;
        Object v;
        if (condition instanceof ArgumentValue.Literal l) {
            v = l.value();
        } else if (condition instanceof ArgumentValue.VariableRef ref) {
            v = variables.apply(ref.name());
        } else {
            throw new IllegalArgumentException("defer 'if' must be a boolean literal or variable: " + condition);
        }
        if (!(v instanceof Boolean b)) {
            throw new IllegalArgumentException("defer 'if' did not evaluate to a boolean: " + v);
        }
        return b;
    }

    @Override
    public String toString() {
        String l = label == null ? "<unlabeled>" : "\"" + label + "\"";
        String on = isFieldLevel() ? "" : " on " + typeCondition;
        String when = condition == null ? "" : " if " + condition;
        return "@defer(" + l + on + when + ")";
    }
}
