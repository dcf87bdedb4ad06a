package io.fieldtree.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldtree.cli.dto.CompilerOptionsJson;
import io.fieldtree.cli.dto.DocumentJson;
import io.fieldtree.cli.dto.SchemaJson;
import io.fieldtree.cli.dto.SelectionJson;
import io.fieldtree.core.document.*;
import io.fieldtree.core.merge.CompilerOptions;
import io.fieldtree.core.schema.*;
import io.fieldtree.incremental.IncrementalPatch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the CLI's JSON inputs (schema, document, options, payloads, patches) with Jackson
 * and converts them into the compiler's model types.
 */
final class JsonLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonLoader() {
    }

    static TypeGraph loadSchema(Path path) {
        SchemaJson json = read(path, SchemaJson.class, "schema");
        if (json.types == null) throw new IllegalArgumentException("schema " + path + " has no 'types'");

        TypeGraph.Builder b = TypeGraph.builder();
        for (SchemaJson.TypeJson t : json.types) {
            NamedTypeKind kind = NamedTypeKind.valueOf(required(t.kind, "kind of type " + t.name));
            Map<String, SchemaField> fields = new LinkedHashMap<>();
            for (SchemaJson.FieldJson f : orEmpty(t.fields)) {
                fields.put(f.name, new SchemaField(f.name, TypeRef.parse(required(f.type, "type of " + t.name + "." + f.name)),
                        f.deprecationReason));
            }
            b.type(new SchemaType(required(t.name, "type name"), kind, fields,
                    t.possibleTypes == null ? null : new LinkedHashSet<>(t.possibleTypes), t.enumValues));
        }
        if (json.queryType != null) b.root(OperationType.QUERY, json.queryType);
        if (json.mutationType != null) b.root(OperationType.MUTATION, json.mutationType);
        if (json.subscriptionType != null) b.root(OperationType.SUBSCRIPTION, json.subscriptionType);
        return b.build();
    }

    static Document loadDocument(Path path) {
        DocumentJson json = read(path, DocumentJson.class, "document");

        List<OperationDefinition> ops = new ArrayList<>();
        for (DocumentJson.OperationJson o : orEmpty(json.operations)) {
            OperationType type = o.operationType == null
                    ? OperationType.QUERY
                    : OperationType.valueOf(o.operationType.toUpperCase(Locale.ROOT));
            List<VariableDefinition> vars = new ArrayList<>();
            for (DocumentJson.VariableJson v : orEmpty(o.variables)) {
                vars.add(new VariableDefinition(required(v.name, "variable name"),
                        TypeRef.parse(required(v.type, "type of $" + v.name)),
                        v.defaultValue == null ? null : argument(v.defaultValue)));
            }
            ops.add(new OperationDefinition(type, required(o.name, "operation name"), vars,
                    selections(o.selections), location(o.line, o.column)));
        }

        List<FragmentDefinition> fragments = new ArrayList<>();
        for (DocumentJson.FragmentJson f : orEmpty(json.fragments)) {
            fragments.add(new FragmentDefinition(required(f.name, "fragment name"),
                    required(f.typeCondition, "type condition of " + f.name),
                    selections(f.selections), location(f.line, f.column)));
        }
        return new Document(ops, fragments);
    }

    /** Defaults when {@code path} is null. */
    static CompilerOptions loadOptions(Path path) {
        CompilerOptions d = CompilerOptions.defaults();
        if (path == null) return d;
        CompilerOptionsJson json = read(path, CompilerOptionsJson.class, "options");
        return new CompilerOptions(
                json.addTypename != null ? json.addTypename : d.addTypename(),
                json.warnOnDeprecatedUsages != null ? json.warnOnDeprecatedUsages : d.warnOnDeprecatedUsages(),
                json.failOnWarnings != null ? json.failOnWarnings : d.failOnWarnings(),
                json.deferDirectiveName != null ? json.deferDirectiveName : d.deferDirectiveName(),
                json.customScalarsMapping != null ? json.customScalarsMapping : d.customScalarsMapping()
        );
    }

    static JsonNode readTree(Path path) {
        try {
            return MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON from " + path, e);
        }
    }

    /** A JSON array of patches, applied in array order. */
    static List<IncrementalPatch> loadPatches(Path path) {
        JsonNode node = readTree(path);
        if (!node.isArray()) throw new IllegalArgumentException("patches file " + path + " must hold a JSON array");
        List<IncrementalPatch> out = new ArrayList<>(node.size());
        for (JsonNode p : node) out.add(IncrementalPatch.fromJson(p));
        return out;
    }

    static ObjectMapper mapper() { return MAPPER; }

    // ---------- helpers ----------

    private static <T> T read(Path path, Class<T> type, String what) {
        try {
            return MAPPER.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + what + " from " + path, e);
        }
    }

    private static List<Selection> selections(List<SelectionJson> json) {
        List<Selection> out = new ArrayList<>();
        for (SelectionJson s : orEmpty(json)) out.add(selection(s));
        return out;
    }

    private static Selection selection(SelectionJson s) {
        String kind = s.kind == null ? "Field" : s.kind;
        List<Directive> directives = directives(s.directives);
        SourceLocation loc = location(s.line, s.column);
        return switch (kind) {
            case "Field" -> new FieldSelection(s.alias, required(s.name, "field name"), arguments(s.arguments),
                    directives, selections(s.selections), loc);
            case "FragmentSpread" -> new FragmentSpread(required(s.name, "spread name"), directives, loc);
            case "InlineFragment" -> new InlineFragment(s.typeCondition, directives, selections(s.selections), loc);
            default -> throw new IllegalArgumentException("unknown selection kind: " + kind);
        };
    }

    private static List<Directive> directives(List<SelectionJson.DirectiveJson> json) {
        List<Directive> out = new ArrayList<>();
        for (SelectionJson.DirectiveJson d : orEmpty(json)) {
            out.add(new Directive(required(d.name, "directive name"), arguments(d.arguments)));
        }
        return out;
    }

    private static Map<String, ArgumentValue> arguments(Map<String, JsonNode> json) {
        Map<String, ArgumentValue> out = new LinkedHashMap<>();
        if (json == null) return out;
        for (var e : json.entrySet()) out.put(e.getKey(), argument(e.getValue()));
        return out;
    }

    /** {@code {"kind":"Variable","variableName":...}} is a reference; anything else is taken literally. */
    static ArgumentValue argument(JsonNode node) {
        if (node == null || node.isNull()) return ArgumentValue.literal(null);
        if (node.isObject()) {
            JsonNode kind = node.get("kind");
            if (kind != null && "Variable".equals(kind.asText()) && node.has("variableName")) {
                return ArgumentValue.variable(node.get("variableName").asText());
            }
            Map<String, ArgumentValue> fields = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> fields.put(e.getKey(), argument(e.getValue())));
            return new ArgumentValue.ObjectValue(fields);
        }
        if (node.isArray()) {
            List<ArgumentValue> items = new ArrayList<>();
            for (JsonNode item : node) items.add(argument(item));
            return new ArgumentValue.ListValue(items);
        }
        if (node.isTextual()) return ArgumentValue.literal(node.textValue());
        if (node.isBoolean()) return ArgumentValue.literal(node.booleanValue());
        if (node.isIntegralNumber()) {
            return ArgumentValue.literal(node.canConvertToInt() ? (Object) node.intValue() : node.longValue());
        }
        return ArgumentValue.literal(node.numberValue());
    }

    private static SourceLocation location(Integer line, Integer column) {
        if (line == null) return SourceLocation.UNKNOWN;
        return new SourceLocation(line, column == null ? 0 : column);
    }

    private static String required(String value, String what) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("missing " + what);
        return value;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
