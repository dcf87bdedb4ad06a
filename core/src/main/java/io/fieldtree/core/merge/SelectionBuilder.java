package io.fieldtree.core.merge;

import io.fieldtree.core.CompileException;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.document.*;
import io.fieldtree.core.model.*;
import io.fieldtree.core.schema.NamedTypeKind;
import io.fieldtree.core.schema.SchemaField;
import io.fieldtree.core.schema.TypeGraph;

import java.util.*;
import java.util.logging.Logger;

/**
 * Turns one operation or fragment definition into raw {@link Field}/{@link Fragment} nodes
 * with schema types resolved. Nothing is merged here: sibling fields may still share a
 * response key and the same fragment may be attached twice.
 * <p>
 * Rules applied while walking the document:
 *  - every field is looked up on its enclosing type; a miss is a schema mismatch;
 *  - {@code @include}/{@code @skip} stay static annotations, AND-ed with the enclosing
 *    fragment's annotations;
 *  - the defer directive becomes a {@link Deferral}: on a field it is field-level, on a
 *    fragment it is stamped onto every field the fragment contributes;
 *  - defer labels must be unique across the directives reachable from the root; a fragment
 *    spread twice expands the same directive twice, which is one occurrence;
 *  - fragments nested inside a fragment are folded into it when their type condition
 *    always holds there, and hoisted to the enclosing level otherwise.
 * <p>
 * One instance builds one root; it keeps per-root state (labels, warnings, variables).
 */
public final class SelectionBuilder {
    private static final Logger log = Logger.getLogger(SelectionBuilder.class.getName());

    private final TypeGraph graph;
    private final Document document;
    private final CompilerOptions options;

    /** Label to the directive that declared it, compared by identity. */
    private final Map<String, Directive> deferLabels = new LinkedHashMap<>();
    private final Deque<String> fragmentStack = new ArrayDeque<>();
    private final Set<String> referencedVariables = new LinkedHashSet<>();
    private final List<String> warnings = new ArrayList<>();

    public SelectionBuilder(TypeGraph graph, Document document, CompilerOptions options) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.document = Objects.requireNonNull(document, "document");
        this.options = Objects.requireNonNull(options, "options");
    }

    /** Raw root field of an operation, typed by the schema's root type for its operation type. */
    public Field buildOperation(OperationDefinition op) {
        String rootType = graph.rootType(op.operationType()).orElseThrow(() -> new CompileException(
                ErrorKind.SCHEMA_MISMATCH, ResponsePath.root(),
                "schema has no root type for " + op.operationType()));
        String container = op.operationType().name().toLowerCase(Locale.ROOT) + " " + op.name();
        for (VariableDefinition v : op.variables()) {
            if (v.hasDefault()) ArgumentValue.collectVariables(v.defaultValue(), referencedVariables);
        }

        Level level = collect(rootType, op.selections(), new Scope(container, InclusionCondition.ALWAYS, null),
                ResponsePath.root());
        return Field.root(op.name(), rootType, graph.kind(rootType), level.fields,
                FragmentAttachments.of(level.fragments), new Origin(container, op.location()));
    }

    /** Raw root field of a fragment definition, typed by its type condition. */
    public Field buildFragment(FragmentDefinition def) {
        requireType(def.typeCondition(), ResponsePath.root());
        String container = "fragment " + def.name();
        fragmentStack.push(def.name());
        try {
            Level level = collect(def.typeCondition(), def.selections(),
                    new Scope(container, InclusionCondition.ALWAYS, null), ResponsePath.root());
            return Field.root(def.name(), def.typeCondition(), graph.kind(def.typeCondition()), level.fields,
                    FragmentAttachments.of(level.fragments), new Origin(container, def.location()));
        } finally {
            fragmentStack.pop();
        }
    }

    /** Variables read by arguments, conditions and defaults of the built root. */
    public Set<String> referencedVariables() {
        return Collections.unmodifiableSet(referencedVariables);
    }

    public Set<String> deferLabels() {
        return Collections.unmodifiableSet(deferLabels.keySet());
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    // ---------- walk ----------

    /** What the enclosing definition imposes on the selections below it. */
    private record Scope(String container, InclusionCondition condition, Deferral deferral) {}

    /** Fields and fragments collected at one selection level, in document order. */
    private static final class Level {
        final List<Field> fields = new ArrayList<>();
        final List<Fragment> fragments = new ArrayList<>();
    }

    private Level collect(String enclosingType, List<Selection> selections, Scope scope, ResponsePath path) {
        Level level = new Level();
        for (Selection sel : selections) {
            if (sel instanceof FieldSelection fs) {
                level.fields.add(buildField(enclosingType, fs, scope, path));
            } else if (sel instanceof FragmentSpread spread) {
                addSpread(level, spread, scope, path);
            } else if (sel instanceof InlineFragment inline) {
                String condition = inline.typeCondition() != null ? inline.typeCondition() : enclosingType;
                requireType(condition, path);
                attach(level, null, condition, inline.selections(), inline.directives(),
                        "... on " + condition, inline.location(), scope, path);
            }
        }
        return level;
    }

    private Field buildField(String enclosingType, FieldSelection fs, Scope scope, ResponsePath path) {
        ResponsePath fieldPath = path.append(fs.responseKey());
        SchemaField def = graph.field(enclosingType, fs.name()).orElseThrow(() -> new CompileException(
                ErrorKind.SCHEMA_MISMATCH, fieldPath,
                "type " + enclosingType + " has no field '" + fs.name() + "'"));
        String named = def.type().namedType();
        requireType(named, fieldPath);
        if (def.isDeprecated()) {
            warn(fieldPath, "field " + enclosingType + "." + fs.name() + " is deprecated: " + def.deprecationReason());
        }

        NamedTypeKind kind = graph.kind(named);
        Deferral own = deferral(fs.directives(), null, fieldPath);
        Deferral deferral = own != null ? own : scope.deferral();
        InclusionCondition condition = scope.condition().and(inclusion(fs.directives(), fieldPath));
        referencedVariables.addAll(condition.variables());
        for (ArgumentValue arg : fs.arguments().values()) {
            ArgumentValue.collectVariables(arg, referencedVariables);
        }

        List<Field> children = List.of();
        FragmentAttachments fragments = FragmentAttachments.EMPTY;
        if (kind.isLeaf()) {
            if (!fs.selections().isEmpty()) {
                throw new CompileException(ErrorKind.SCHEMA_MISMATCH, fieldPath,
                        "leaf field of type " + def.type() + " cannot have a selection");
            }
        } else {
            if (fs.selections().isEmpty()) {
                throw new CompileException(ErrorKind.SCHEMA_MISMATCH, fieldPath,
                        "field of type " + def.type() + " requires a selection");
            }
            // Children are delivered together with their parent: no deferral or condition flows down.
            Level child = collect(named, fs.selections(),
                    new Scope(scope.container(), InclusionCondition.ALWAYS, null), fieldPath);
            children = child.fields;
            fragments = FragmentAttachments.of(child.fragments);
        }

        return new Field(fs.responseKey(), fs.name(), def.type(), kind, fs.arguments(), children, fragments,
                Set.of(new Origin(scope.container(), fs.location())), deferral, condition);
    }

    private void addSpread(Level level, FragmentSpread spread, Scope scope, ResponsePath path) {
        FragmentDefinition def = document.fragment(spread.name()).orElseThrow(() -> new CompileException(
                ErrorKind.SCHEMA_MISMATCH, path, "unknown fragment " + spread.name()));
        if (fragmentStack.contains(def.name())) {
            throw new CompileException(ErrorKind.SCHEMA_MISMATCH, path,
                    "fragment cycle through " + def.name() + " " + fragmentStack);
        }
        requireType(def.typeCondition(), path);

        fragmentStack.push(def.name());
        try {
            attach(level, def.name(), def.typeCondition(), def.selections(), spread.directives(),
                    "fragment " + def.name(), spread.location(), scope, path);
        } finally {
            fragmentStack.pop();
        }
    }

    private void attach(
            Level level,
            String name,
            String typeCondition,
            List<Selection> selections,
            List<Directive> directives,
            String container,
            SourceLocation location,
            Scope scope,
            ResponsePath path
    ) {
        Deferral own = deferral(directives, typeCondition, path);
        Deferral deferral = own != null ? own : scope.deferral();
        InclusionCondition condition = scope.condition().and(inclusion(directives, path));
        referencedVariables.addAll(condition.variables());

        Level inner = collect(typeCondition, selections, new Scope(container, condition, deferral), path);

        List<Field> fields = new ArrayList<>(inner.fields);
        List<Fragment> hoisted = new ArrayList<>();
        for (Fragment nested : inner.fragments) {
            if (graph.covers(nested.typeCondition(), typeCondition)) {
                fields.addAll(nested.fields());
            } else {
                hoisted.add(nested);
            }
        }
        level.fragments.add(new Fragment(name, typeCondition, fields, Set.of(new Origin(container, location)),
                deferral, condition));
        level.fragments.addAll(hoisted);
    }

    /**
     * Deferral declared by {@code directives}, or null.
     * A literal {@code if: false} disables it; a variable {@code if} is kept on the deferral
     * and evaluated once variables are known.
     */
    private Deferral deferral(List<Directive> directives, String typeCondition, ResponsePath path) {
        for (Directive d : directives) {
            if (!d.name().equals(options.deferDirectiveName())) continue;

            ArgumentValue enabled = d.argument("if");
            if (enabled instanceof ArgumentValue.Literal flag && Boolean.FALSE.equals(flag.value())) return null;
            if (enabled != null) ArgumentValue.collectVariables(enabled, referencedVariables);

            String label = null;
            if (d.argument("label") instanceof ArgumentValue.Literal text && text.value() != null) {
                label = text.value().toString();
            }
            if (label != null) {
                Directive first = deferLabels.putIfAbsent(label, d);
                if (first != null && first != d) {
                    throw new CompileException(ErrorKind.DUPLICATE_DEFER_LABEL, path,
                            "defer label \"" + label + "\" is used more than once");
                }
            }
            Deferral deferral = typeCondition == null ? Deferral.onField(label) : Deferral.onFragment(label, typeCondition);
            boolean always = enabled == null
                    || (enabled instanceof ArgumentValue.Literal on && Boolean.TRUE.equals(on.value()));
            return always ? deferral : deferral.when(enabled);
        }
        return null;
    }

    private static InclusionCondition inclusion(List<Directive> directives, ResponsePath path) {
        try {
            return InclusionCondition.fromDirectives(directives);
        } catch (IllegalArgumentException e) {
            throw new CompileException(ErrorKind.SCHEMA_MISMATCH, path, e.getMessage());
        }
    }

    private void requireType(String typeName, ResponsePath path) {
        if (!graph.hasType(typeName)) {
            throw new CompileException(ErrorKind.SCHEMA_MISMATCH, path, "unknown type " + typeName);
        }
    }

    private void warn(ResponsePath path, String message) {
        if (!options.warnOnDeprecatedUsages()) return;
        warnings.add(path + ": " + message);
        log.warning(message + " (at " + path + ")");
    }
}
