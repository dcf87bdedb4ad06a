package io.fieldtree.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.fieldtree.codec.ResponseDecoder;
import io.fieldtree.codec.ResponseEncoder;
import io.fieldtree.codec.ScalarRegistry;
import io.fieldtree.codec.Variables;
import io.fieldtree.core.FieldTreeException;
import io.fieldtree.core.document.Document;
import io.fieldtree.core.merge.CompilerOptions;
import io.fieldtree.core.schema.TypeGraph;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.PolymorphicFallback;
import io.fieldtree.core.tree.TreeCompiler;
import io.fieldtree.incremental.IncrementalDeliveryMerger;
import io.fieldtree.incremental.IncrementalPatch;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Command-line front end over JSON inputs.
 *
 * Usage:
 *   fieldtree compile --schema schema.json --document doc.json [--operation Name | --fragment Name]
 *                     [--catch-all] [--options options.json]
 *   fieldtree decode  --schema schema.json --document doc.json [--operation Name] --payload data.json
 *                     [--variables vars.json] [--patches patches.json] [--catch-all] [--options options.json]
 *
 * Examples:
 *   fieldtree compile -s schema.json -d hero.json
 *   fieldtree decode -s schema.json -d hero.json -p base.json --patches deferred.json
 *
 * Exit codes: 0 on success, 1 on usage errors, 2 on compile/decode/patch failures.
 */
public final class Cli {

    private final PrintStream out;
    private final PrintStream err;

    Cli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Cli(System.out, System.err).run(args));
    }

    int run(String[] args) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.isHelp()) {
                out.println(USAGE);
                return 0;
            }
            switch (cfg.command()) {
                case "compile" -> compile(cfg);
                case "decode" -> decode(cfg);
                default -> throw new CliException("unknown command: " + cfg.command());
            }
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        } catch (FieldTreeException e) {
            err.println("error: " + e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            err.println("error: " + e.getMessage());
            e.printStackTrace(err);
            return 2;
        }
    }

    private void compile(CliConfig cfg) {
        TypeGraph graph = JsonLoader.loadSchema(cfg.schemaPath());
        Document doc = JsonLoader.loadDocument(cfg.documentPath());
        TreeCompiler compiler = new TreeCompiler(graph, JsonLoader.loadOptions(cfg.optionsPath()));
        PolymorphicFallback fallback = fallback(cfg);

        if (cfg.fragment() != null) {
            out.print(TreePrinter.print(compiler.compileFragment(doc, cfg.fragment(), fallback)));
        } else if (cfg.operation() != null) {
            out.print(TreePrinter.print(compiler.compileOperation(doc, cfg.operation(), fallback)));
        } else {
            for (CanonicalTree tree : compiler.compileAll(doc, fallback).values()) {
                out.print(TreePrinter.print(tree));
            }
        }
    }

    private void decode(CliConfig cfg) {
        TypeGraph graph = JsonLoader.loadSchema(cfg.schemaPath());
        Document doc = JsonLoader.loadDocument(cfg.documentPath());
        CompilerOptions options = JsonLoader.loadOptions(cfg.optionsPath());
        CanonicalTree tree = new TreeCompiler(graph, options)
                .compileOperation(doc, operationName(cfg, doc), fallback(cfg));

        ScalarRegistry scalars = ScalarRegistry.fromMapping(options.customScalarsMapping());
        Map<String, Object> supplied = cfg.variablesPath() == null
                ? Map.of()
                : Variables.fromJson(JsonLoader.readTree(cfg.variablesPath()));
        Variables variables = Variables.forTree(tree, supplied);
        var decoder = new ResponseDecoder(scalars);
        JsonNode payload = JsonLoader.readTree(cfg.payloadPath());

        Map<String, Object> result;
        if (cfg.patchesPath() == null) {
            result = decoder.decode(tree, payload, variables);
        } else {
            List<IncrementalPatch> patches = JsonLoader.loadPatches(cfg.patchesPath());
            var merger = IncrementalDeliveryMerger.start(decoder, tree, payload, variables);
            for (IncrementalPatch p : patches) merger.apply(p);
            if (!merger.isComplete()) {
                err.println("warning: delivery incomplete, pending " + merger.pendingDeliveries());
            }
            result = merger.currentResult();
        }

        JsonNode encoded = new ResponseEncoder(scalars).encode(tree, result, variables);
        try {
            out.println(JsonLoader.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(encoded));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot write result", e);
        }
    }

    private static String operationName(CliConfig cfg, Document doc) {
        if (cfg.operation() != null) return cfg.operation();
        if (doc.operations().size() != 1) {
            throw new CliException("document has " + doc.operations().size() + " operations, pick one with --operation");
        }
        return doc.operations().get(0).name();
    }

    private static PolymorphicFallback fallback(CliConfig cfg) {
        return cfg.catchAll() ? PolymorphicFallback.CATCH_ALL : PolymorphicFallback.STRICT;
    }

    private static final String USAGE = """
            Usage:
              fieldtree compile --schema <file> --document <file> [--operation <name> | --fragment <name>]
                                [--catch-all] [--options <file>]
              fieldtree decode  --schema <file> --document <file> [--operation <name>] --payload <file>
                                [--variables <file>] [--patches <file>] [--catch-all] [--options <file>]
            """;

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
