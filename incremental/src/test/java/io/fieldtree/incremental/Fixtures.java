package io.fieldtree.incremental;

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

final class Fixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    static TypeGraph schema() {
        return TypeGraph.builder()
                .object("Query",
                        "hero", "Character",
                        "computers", "[Computer!]!")
                .interfaceType("Character", Set.of("Human", "Droid"),
                        "id", "ID!",
                        "name", "String!",
                        "friends", "[Character]")
                .object("Human",
                        "id", "ID!",
                        "name", "String!",
                        "friends", "[Character]",
                        "homePlanet", "String")
                .object("Droid",
                        "id", "ID!",
                        "name", "String!",
                        "friends", "[Character]",
                        "primaryFunction", "String")
                .object("Computer",
                        "id", "ID!",
                        "cpu", "String",
                        "screen", "Screen!")
                .object("Screen",
                        "resolution", "String!",
                        "isColor", "Boolean!")
                .build();
    }

    static CanonicalTree compile(PolymorphicFallback fallback, Selection... selections) {
        var op = OperationDefinition.query("Q", selections);
        return new TreeCompiler(schema(), CompilerOptions.defaults())
                .compileOperation(new Document(List.of(op), List.of()), "Q", fallback);
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

    static JsonNode json(String singleQuoted) {
        try {
            return MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
