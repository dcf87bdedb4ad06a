package io.fieldtree.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldtree.core.document.*;
import io.fieldtree.core.merge.CompilerOptions;
import io.fieldtree.core.schema.TypeGraph;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.PolymorphicFallback;
import io.fieldtree.core.tree.TreeCompiler;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Schema, document and JSON helpers shared by the codec tests. */
final class Fixtures {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    static TypeGraph schema() {
        return TypeGraph.builder()
                .scalar("Date")
                .scalar("Decimal")
                .enumType("Episode", "NEWHOPE", "EMPIRE", "JEDI")
                .object("Query",
                        "hero", "Character",
                        "droid", "Droid",
                        "computers", "[Computer!]!",
                        "tags", "[String]")
                .interfaceType("Character", Set.of("Human", "Droid"),
                        "id", "ID!",
                        "name", "String!",
                        "appearsIn", "[Episode!]")
                .object("Human",
                        "id", "ID!",
                        "name", "String!",
                        "appearsIn", "[Episode!]",
                        "homePlanet", "String",
                        "birthDate", "Date")
                .object("Droid",
                        "id", "ID!",
                        "name", "String!",
                        "appearsIn", "[Episode!]",
                        "primaryFunction", "String")
                .object("Computer",
                        "id", "ID!",
                        "cpu", "String!",
                        "year", "Int",
                        "price", "Decimal",
                        "screen", "Screen!")
                .object("Screen",
                        "resolution", "String!",
                        "isColor", "Boolean!")
                .build();
    }

    static CanonicalTree compile(OperationDefinition op, PolymorphicFallback fallback, FragmentDefinition... fragments) {
        var doc = new Document(List.of(op), List.of(fragments));
        return new TreeCompiler(schema(), CompilerOptions.defaults()).compileOperation(doc, op.name(), fallback);
    }

    static CanonicalTree compile(OperationDefinition op, FragmentDefinition... fragments) {
        return compile(op, PolymorphicFallback.STRICT, fragments);
    }

    static FieldSelection field(String name, Selection... selections) {
        return FieldSelection.of(name, selections);
    }

    static InlineFragment on(String typeCondition, Selection... selections) {
        return InlineFragment.on(typeCondition, selections);
    }

    static Directive defer(String label) {
        return Directive.of("defer", "label", ArgumentValue.literal(label));
    }

    static Directive deferIf(String label, String variable) {
        return new Directive("defer", Map.of("label", ArgumentValue.literal(label), "if", ArgumentValue.variable(variable)));
    }

    static Directive include(String variable) {
        return Directive.of("include", "if", ArgumentValue.variable(variable));
    }

    /** Parses JSON written with single quotes for readability. */
    static JsonNode json(String singleQuoted) {
        try {
            return MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
