package io.fieldtree.core.merge;

import io.fieldtree.core.CompileException;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.model.*;
import io.fieldtree.core.schema.NamedTypeKind;
import io.fieldtree.core.schema.TypeGraph;
import io.fieldtree.core.schema.TypeRef;

import java.util.*;

/**
 * Unifies sibling fields and fragments that target the same response key.
 * <p>
 * Algorithm for {@code mergeFields(A, B)}:
 *  - For every field a in A, take the first not-yet-consumed field b in B with the
 *    same response key and mark it consumed.
 *  - No match: emit a unchanged. Match: emit merge(a, b), recursively.
 *  - Append the unconsumed fields of B in their original order.
 * <p>
 * {@code mergeFragments(existing, parentFields, incoming)} matches fragments by name
 * (inline fragments only match the very same occurrence), merges matched pairs and pushes
 * the current parent fields into every fragment so each one stays self-sufficient.
 * <p>
 * Notes:
 *  - Inputs are never modified; every step allocates new lists and nodes.
 *  - Response-key order is first-occurrence order across the inputs. Shape slot indices are
 *    derived from it, so it must stay stable.
 *  - Conflicts (same key, different schema field / arguments / deferral, or same fragment
 *    name with different type conditions) are reported, never resolved silently.
 */
public final class MergeEngine {

    private final TypeGraph graph;
    private final boolean addTypename;

    public MergeEngine(TypeGraph graph, boolean addTypename) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.addTypename = addTypename;
    }

    public List<Field> mergeFields(List<Field> a, List<Field> b) {
        return mergeFields(a, b, ResponsePath.root());
    }

    /**
     * Merge two sibling field lists living at {@code path}.
     */
    public List<Field> mergeFields(List<Field> a, List<Field> b, ResponsePath path) {
        if (b.isEmpty()) return a;

        boolean[] consumed = new boolean[b.size()];
        List<Field> out = new ArrayList<>(a.size() + b.size());

        for (Field fa : a) {
            int match = -1;
            for (int i = 0; i < b.size(); i++) {
                if (!consumed[i] && b.get(i).responseKey().equals(fa.responseKey())) {
                    match = i;
                    break;
                }
            }
            if (match < 0) {
                out.add(fa);
            } else {
                consumed[match] = true;
                out.add(merge(fa, b.get(match), path));
            }
        }
        for (int i = 0; i < b.size(); i++) {
            if (!consumed[i]) out.add(b.get(i));
        }
        return List.copyOf(out);
    }

    /**
     * Merge two occurrences of the same response key.
     *
     * @param parentPath path of the selection both fields belong to
     */
    public Field merge(Field a, Field b, ResponsePath parentPath) {
        ResponsePath path = parentPath.append(a.responseKey());

        if (!a.schemaFieldName().equals(b.schemaFieldName())) {
            throw new CompileException(ErrorKind.FIELD_MERGE_CONFLICT, path,
                    "'" + a.responseKey() + "' selects both '" + a.schemaFieldName()
                            + "' and '" + b.schemaFieldName() + "'");
        }
        if (!a.arguments().equals(b.arguments())) {
            throw new CompileException(ErrorKind.FIELD_MERGE_CONFLICT, path,
                    "'" + a.responseKey() + "' is selected with different arguments "
                            + a.arguments() + " and " + b.arguments());
        }

        List<Field> sub = mergeFields(a.subSelection(), b.subSelection(), path);
        List<Fragment> fragments = mergeFragments(a.fragments().fragments(), sub, b.fragments().fragments(), path);
        Map<String, String> accessors = a.fragments().unionAccessors(b.fragments().accessors());

        return new Field(
                a.responseKey(),
                a.schemaFieldName(),
                a.type(),
                a.kind(),
                a.arguments(),
                sub,
                new FragmentAttachments(fragments, accessors),
                union(a.originPaths(), b.originPaths()),
                mergeDeferral(a.deferral(), b.deferral(), ErrorKind.FIELD_MERGE_CONFLICT, path),
                a.condition().or(b.condition())
        );
    }

    /**
     * Merge the fragments attached to one selection level.
     *
     * @param existing     fragments already attached
     * @param parentFields merged fields of the enclosing selection, pushed into every fragment
     * @param incoming     fragments contributed by the other side
     */
    public List<Fragment> mergeFragments(
            List<Fragment> existing,
            List<Field> parentFields,
            List<Fragment> incoming,
            ResponsePath path
    ) {
        boolean[] consumed = new boolean[incoming.size()];
        List<Fragment> out = new ArrayList<>(existing.size() + incoming.size());

        for (Fragment e : existing) {
            int match = -1;
            for (int i = 0; i < incoming.size(); i++) {
                if (!consumed[i] && sameFragment(e, incoming.get(i))) {
                    match = i;
                    break;
                }
            }
            if (match < 0) {
                // The parent level may have grown in this step: push it again.
                out.add(e.withFields(mergeFields(e.fields(), parentFields, path)));
                continue;
            }

            consumed[match] = true;
            Fragment in = incoming.get(match);
            if (!e.typeCondition().equals(in.typeCondition())) {
                throw new CompileException(ErrorKind.FRAGMENT_MERGE_CONFLICT, path,
                        "fragment " + e.name() + " is attached on both " + e.typeCondition()
                                + " and " + in.typeCondition());
            }
            List<Field> fields = mergeFields(mergeFields(e.fields(), in.fields(), path), parentFields, path);
            out.add(new Fragment(
                    e.name(),
                    e.typeCondition(),
                    fields,
                    union(e.originPaths(), in.originPaths()),
                    mergeDeferral(e.deferral(), in.deferral(), ErrorKind.FRAGMENT_MERGE_CONFLICT, path),
                    e.condition().or(in.condition())
            ));
        }
        for (int i = 0; i < incoming.size(); i++) {
            if (!consumed[i]) out.add(incoming.get(i));
        }
        return List.copyOf(out);
    }

    /**
     * Canonicalize a raw field produced by {@link SelectionBuilder}.
     * <p>
     * Steps, per selection level:
     *  1) fold the direct children one at a time (document order);
     *  2) canonicalize every attached fragment;
     *  3) merge the fields of fragments that always apply into the level itself;
     *  4) prepend {@code __typename} to polymorphic levels when enabled;
     *  5) fold the fragments, pushing the final level fields into each.
     */
    public Field normalize(Field raw) {
        return normalize(raw, ResponsePath.root());
    }

    private Field normalize(Field raw, ResponsePath path) {
        if (raw.isLeaf()) return raw;
        String enclosing = raw.type().namedType();

        List<Field> fields = fold(raw.subSelection(), path);

        List<Fragment> normalized = new ArrayList<>();
        for (Fragment fr : raw.fragments().fragments()) {
            normalized.add(fr.withFields(fold(fr.fields(), path)));
        }
        for (Fragment fr : normalized) {
            if (isUnconditional(fr, enclosing)) {
                fields = mergeFields(fields, fr.fields(), path);
            }
        }
        if (addTypename && isPolymorphic(enclosing, normalized) && !hasKey(fields, TypeGraph.TYPENAME)) {
            var withTypename = new ArrayList<Field>(fields.size() + 1);
            withTypename.add(typenameField());
            withTypename.addAll(fields);
            fields = List.copyOf(withTypename);
        }

        List<Fragment> fragments = List.of();
        for (Fragment fr : normalized) {
            Fragment pushed = fr.withFields(mergeFields(fr.fields(), fields, path));
            fragments = mergeFragments(fragments, fields, List.of(pushed), path);
        }
        return raw.withSubSelection(fields).withFragments(raw.fragments().withFragments(fragments));
    }

    /** True when the fragment's type condition holds for every value of {@code enclosingType}. */
    public boolean isUnconditional(Fragment fragment, String enclosingType) {
        return graph.covers(fragment.typeCondition(), enclosingType);
    }

    /**
     * A level is polymorphic when its type is abstract and at least one attached
     * fragment only applies to some of its possible types.
     */
    public boolean isPolymorphic(String enclosingType, List<Fragment> fragments) {
        if (graph.kind(enclosingType) == NamedTypeKind.OBJECT) return false;
        for (Fragment fr : fragments) {
            if (!isUnconditional(fr, enclosingType)) return true;
        }
        return false;
    }

    // ---------- helpers ----------

    private List<Field> fold(List<Field> raw, ResponsePath path) {
        List<Field> out = List.of();
        for (Field child : raw) {
            Field canonical = normalize(child, path.append(child.responseKey()));
            out = mergeFields(out, List.of(canonical), path);
        }
        return out;
    }

    /**
     * Two different deferrals on the same key are a conflict; when only one side is
     * deferred the field is delivered with the base payload.
     */
    private static Deferral mergeDeferral(Deferral a, Deferral b, ErrorKind conflict, ResponsePath path) {
        if (a == null || b == null) return null;
        if (!a.equals(b)) {
            throw new CompileException(conflict, path, "delivered by both " + a + " and " + b);
        }
        return a;
    }

    private static boolean sameFragment(Fragment a, Fragment b) {
        if (a.name() != null) return a.name().equals(b.name());
        return b.name() == null && a.identity().equals(b.identity());
    }

    private static Set<Origin> union(Set<Origin> a, Set<Origin> b) {
        if (b.isEmpty() || a.containsAll(b)) return a;
        var out = new LinkedHashSet<>(a);
        out.addAll(b);
        return out;
    }

    private static boolean hasKey(List<Field> fields, String key) {
        for (Field f : fields) {
            if (f.responseKey().equals(key)) return true;
        }
        return false;
    }

    private static Field typenameField() {
        return new Field(TypeGraph.TYPENAME, TypeGraph.TYPENAME, TypeRef.named("String", false),
                NamedTypeKind.SCALAR, Map.of(), List.of(), FragmentAttachments.EMPTY, Set.of(), null,
                InclusionCondition.ALWAYS);
    }
}
