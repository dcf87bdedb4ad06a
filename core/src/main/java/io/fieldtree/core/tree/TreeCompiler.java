package io.fieldtree.core.tree;

import io.fieldtree.core.CompileException;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.document.Document;
import io.fieldtree.core.document.FragmentDefinition;
import io.fieldtree.core.document.OperationDefinition;
import io.fieldtree.core.merge.CompilerOptions;
import io.fieldtree.core.merge.MergeEngine;
import io.fieldtree.core.merge.SelectionBuilder;
import io.fieldtree.core.model.Field;
import io.fieldtree.core.schema.TypeGraph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point of compilation: document + schema -> {@link CanonicalTree}.
 * <p>
 * Pipeline per root:
 *  1) {@link SelectionBuilder}: resolve types, capture deferrals and conditions;
 *  2) {@link MergeEngine#normalize(Field)}: unify keys, push parent fields into fragments;
 *  3) {@link ShapeCompiler}: slot tables and polymorphic variants.
 * Any failure aborts the root; no partial tree is returned.
 */
public final class TreeCompiler {
    private static final Logger log = Logger.getLogger(TreeCompiler.class.getName());

    private final TypeGraph graph;
    private final CompilerOptions options;
    private final MergeEngine engine;

    public TreeCompiler(TypeGraph graph, CompilerOptions options) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.options = Objects.requireNonNull(options, "options");
        this.engine = new MergeEngine(graph, options.addTypename());
    }

    public CompilerOptions options() { return options; }

    public CanonicalTree compileOperation(Document document, String operationName, PolymorphicFallback fallback) {
        OperationDefinition op = document.operation(operationName).orElseThrow(
                () -> new IllegalArgumentException("unknown operation " + operationName));

        var builder = new SelectionBuilder(graph, document, options);
        Field raw = builder.buildOperation(op);
        return finish(op.name(), op, raw, builder, fallback);
    }

    public CanonicalTree compileFragment(Document document, String fragmentName, PolymorphicFallback fallback) {
        FragmentDefinition def = document.fragment(fragmentName).orElseThrow(
                () -> new IllegalArgumentException("unknown fragment " + fragmentName));

        var builder = new SelectionBuilder(graph, document, options);
        Field raw = builder.buildFragment(def);
        return finish(def.name(), null, raw, builder, fallback);
    }

    /** Every operation of the document, keyed by name in document order. */
    public Map<String, CanonicalTree> compileAll(Document document, PolymorphicFallback fallback) {
        Map<String, CanonicalTree> out = new LinkedHashMap<>();
        for (OperationDefinition op : document.operations()) {
            out.put(op.name(), compileOperation(document, op.name(), fallback));
        }
        return out;
    }

    private CanonicalTree finish(
            String name,
            OperationDefinition op,
            Field raw,
            SelectionBuilder builder,
            PolymorphicFallback fallback
    ) {
        Objects.requireNonNull(fallback, "fallback");
        if (options.failOnWarnings() && !builder.warnings().isEmpty()) {
            throw new CompileException(ErrorKind.WARNINGS_AS_ERRORS, ResponsePath.root(),
                    builder.warnings().size() + " warning(s) in " + name + ": " + builder.warnings());
        }

        Field root = engine.normalize(raw);
        ObjectShape shape = new ShapeCompiler(graph, engine, fallback).compile(root, ResponsePath.root());

        var tree = new CanonicalTree(
                name,
                op == null ? null : op.operationType(),
                root,
                shape,
                op == null ? List.of() : op.variables(),
                builder.referencedVariables(),
                builder.deferLabels(),
                fallback,
                graph
        );
        log.fine(() -> "compiled " + tree + " (" + root.subSelection().size() + " top-level fields, "
                + builder.deferLabels().size() + " defer labels)");
        return tree;
    }
}
