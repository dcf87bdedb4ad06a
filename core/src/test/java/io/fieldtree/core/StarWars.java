package io.fieldtree.core;

import io.fieldtree.core.document.*;
import io.fieldtree.core.schema.TypeGraph;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared schema and document helpers for the compiler specs.
 */
public final class StarWars {

    private StarWars() {
        // fixtures
    }

    public static TypeGraph schema() {
        return TypeGraph.builder()
                .scalar("Date")
                .enumType("Episode", "NEWHOPE", "EMPIRE", "JEDI")
                .object("Query",
                        "hero", "Character",
                        "droid", "Droid",
                        "computers", "[Computer!]!",
                        "search", "[SearchResult]")
                .interfaceType("Character", Set.of("Human", "Droid"),
                        "id", "ID!",
                        "name", "String!",
                        "friends", "[Character]")
                .object("Human",
                        "id", "ID!",
                        "name", "String!",
                        "friends", "[Character]",
                        "homePlanet", "String",
                        "height", "Float",
                        "birthDate", "Date")
                .object("Droid",
                        "id", "ID!",
                        "name", "String!",
                        "friends", "[Character]",
                        "primaryFunction", "String",
                        "serial", "String")
                .object("Starship",
                        "id", "ID!",
                        "name", "String!",
                        "length", "Float")
                .union("SearchResult", "Human", "Droid", "Starship")
                .object("Computer",
                        "id", "ID!",
                        "cpu", "String!",
                        "year", "Int",
                        "screen", "Screen!")
                .object("Screen",
                        "resolution", "String!",
                        "isColor", "Boolean!")
                .deprecate("Droid", "serial", "use id")
                .build();
    }

    public static FieldSelection field(String name, Selection... selections) {
        return FieldSelection.of(name, selections);
    }

    public static InlineFragment on(String typeCondition, Selection... selections) {
        return InlineFragment.on(typeCondition, selections);
    }

    public static FragmentSpread spread(String name) {
        return FragmentSpread.of(name);
    }

    public static Directive defer(String label) {
        return Directive.of("defer", "label", ArgumentValue.literal(label));
    }

    public static Directive deferIf(String label, String variable) {
        return new Directive("defer", Map.of("label", ArgumentValue.literal(label), "if", ArgumentValue.variable(variable)));
    }

    public static Directive include(String variable) {
        return Directive.of("include", "if", ArgumentValue.variable(variable));
    }

    public static Directive skip(String variable) {
        return Directive.of("skip", "if", ArgumentValue.variable(variable));
    }

    public static Document document(OperationDefinition operation, FragmentDefinition... fragments) {
        return new Document(List.of(operation), List.of(fragments));
    }
}
