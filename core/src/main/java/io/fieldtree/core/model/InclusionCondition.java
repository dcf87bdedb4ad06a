package io.fieldtree.core.model;

import io.fieldtree.core.document.ArgumentValue;
import io.fieldtree.core.document.Directive;

import java.util.*;
import java.util.function.Function;

/**
 * Static {@code @include}/{@code @skip} annotations of a field, kept unevaluated
 * until variables are known.
 * <p>
 * Representation: a disjunction of clauses, each clause a conjunction of terms.
 *  - a fragment's condition is AND-ed into every field it contributes;
 *  - merging two occurrences of a field OR-s their conditions.
 * A clause without terms always holds.
 */
public final class InclusionCondition {

    /** {@code value} must evaluate to {@code expected}: true for include, false for skip. */
    public record Term(ArgumentValue value, boolean expected) {}

    public static final InclusionCondition ALWAYS = new InclusionCondition(List.of(List.of()));

    private final List<List<Term>> clauses;

    private InclusionCondition(List<List<Term>> clauses) {
        this.clauses = clauses.stream().map(List::copyOf).toList();
    }

    public static InclusionCondition fromDirectives(List<Directive> directives) {
        List<Term> terms = new ArrayList<>();
        for (Directive d : directives) {
            if (d.name().equals("include") || d.name().equals("skip")) {
                ArgumentValue cond = d.argument("if");
                if (cond == null) throw new IllegalArgumentException("@" + d.name() + " requires an 'if' argument");
                terms.add(new Term(cond, d.name().equals("include")));
            }
        }
        return terms.isEmpty() ? ALWAYS : new InclusionCondition(List.of(terms));
    }

    public boolean isAlways() {
        for (List<Term> c : clauses) {
            if (c.isEmpty()) return true;
        }
        return false;
    }

    public InclusionCondition and(InclusionCondition other) {
        if (isAlways() && clauses.size() == 1) return other;
        if (other.isAlways() && other.clauses.size() == 1) return this;
        Set<List<Term>> out = new LinkedHashSet<>();
        for (List<Term> a : clauses) {
            for (List<Term> b : other.clauses) {
                var merged = new ArrayList<Term>(a);
                for (Term t : b) {
                    if (!merged.contains(t)) merged.add(t);
                }
                out.add(merged);
            }
        }
        return new InclusionCondition(new ArrayList<>(out));
    }

    public InclusionCondition or(InclusionCondition other) {
        if (isAlways() || other.isAlways()) return ALWAYS;
        Set<List<Term>> out = new LinkedHashSet<>(clauses);
        out.addAll(other.clauses);
        return new InclusionCondition(new ArrayList<>(out));
    }

    /**
     * Evaluate against resolved variables.
     *
     * @param variables lookup of a resolved variable value by name
     * @throws IllegalArgumentException if a condition does not evaluate to a boolean
     */
    public boolean evaluate(Function<String, Object> variables) {
        for (List<Term> clause : clauses) {
            boolean all = true;
            for (Term t : clause) {
                if (truth(t.value(), variables) != t.expected()) {
                    all = false;
                    break;
                }
            }
            if (all) return true;
        }
        return false;
    }

    /** Names of the variables the condition reads. */
    public Set<String> variables() {
        Set<String> out = new LinkedHashSet<>();
        for (List<Term> c : clauses) {
            for (Term t : c) ArgumentValue.collectVariables(t.value(), out);
        }
        return out;
    }

    private static boolean truth(ArgumentValue value, Function<String, Object> variables) {
        Object v;
        if (value instanceof ArgumentValue.Literal l) {
            v = l.value();
        } else if (value instanceof ArgumentValue.VariableRef ref) {
            v = variables.apply(ref.name());
        } else {
            throw new IllegalArgumentException("condition must be a boolean literal or variable: " + value);
        }
        if (!(v instanceof Boolean b)) {
            throw new IllegalArgumentException("condition did not evaluate to a boolean: " + v);
        }
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InclusionCondition other)) return false;
        if (isAlways() && other.isAlways()) return true;
        return new HashSet<>(clauses).equals(new HashSet<>(other.clauses));
    }

    @Override
    public int hashCode() {
        return isAlways() ? 1 : new HashSet<>(clauses).hashCode();
    }

    @Override
    public String toString() {
        return isAlways() ? "always" : clauses.toString();
    }
}
