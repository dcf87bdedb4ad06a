package io.fieldtree.codec;

import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.document.OperationDefinition;
import io.fieldtree.core.document.VariableDefinition;
import io.fieldtree.core.schema.TypeRef;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.ObjectShape;
import io.fieldtree.core.tree.PolymorphicFallback;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.fieldtree.codec.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior tests for base payload decoding.
 */
class ResponseDecoderTest {

    private final ResponseDecoder decoder = new ResponseDecoder(ScalarRegistry.defaults());

    private static final OperationDefinition HERO = OperationDefinition.query("Hero",
            field("hero",
                    field("name"),
                    on("Human", field("homePlanet")),
                    on("Droid", field("primaryFunction"))));

    private static final OperationDefinition COMPUTERS = OperationDefinition.query("Computers",
            field("computers", field("id"), field("year"), field("screen", field("resolution"), field("isColor"))));

    @SuppressWarnings("unchecked")
    private static Map<String, Object> obj(Object value) {
        return (Map<String, Object>) value;
    }

    private CodecException failure(CanonicalTree tree, String payload) {
        return assertThrows(CodecException.class, () -> decoder.decode(tree, json(payload), Variables.empty()));
    }

    @Test
    void discriminator_selects_the_matching_variant() {
        CanonicalTree tree = compile(HERO);

        var out = decoder.decode(tree, json("{'hero': {'__typename': 'Droid', 'name': 'R2-D2', 'primaryFunction': 'Astromech'}}"),
                Variables.empty());

        Map<String, Object> hero = obj(out.get("hero"));
        assertEquals(List.of("primaryFunction", "__typename", "name"), new ArrayList<>(hero.keySet()));
        assertEquals("Astromech", hero.get("primaryFunction"));
        assertEquals("R2-D2", hero.get("name"));
    }

    @Test
    void unknown_discriminator_without_catch_all_is_unhandled() {
        var e = failure(compile(HERO), "{'hero': {'__typename': 'Starship', 'name': 'Falcon'}}");

        assertEquals(ErrorKind.UNHANDLED_TYPE_CONDITION, e.kind());
        assertEquals(ResponsePath.of("hero"), e.path());
    }

    @Test
    void unknown_discriminator_with_catch_all_keeps_the_shared_fields() {
        var op = OperationDefinition.query("Hero", field("hero", field("name"), on("Droid", field("primaryFunction"))));
        CanonicalTree tree = compile(op, PolymorphicFallback.CATCH_ALL);

        var out = decoder.decode(tree, json("{'hero': {'__typename': 'Human', 'name': 'Luke', 'homePlanet': 'Tatooine'}}"),
                Variables.empty());

        assertEquals(Map.of("__typename", "Human", "name", "Luke"), out.get("hero"));
    }

    @Test
    void polymorphic_object_without_discriminator_fails() {
        var e = failure(compile(HERO), "{'hero': {'name': 'R2-D2'}}");
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals(ResponsePath.of("hero", "__typename"), e.path());
    }

    @Test
    void discriminator_can_come_from_the_enclosing_context() {
        CanonicalTree tree = compile(HERO);
        ObjectShape hero = tree.shape().slot("hero").child();

        var out = decoder.decodeObject(hero, json("{'name': 'R2-D2'}"), "Droid", Variables.empty(),
                ResponsePath.of("hero"), DecodeListener.NONE);

        assertEquals("Droid", out.get("__typename"));
        assertNull(out.get("primaryFunction"));
        assertTrue(out.containsKey("primaryFunction"));
    }

    @Test
    void missing_non_null_field_names_the_field() {
        var op = OperationDefinition.query("Droid", field("droid", field("name")));

        var e = failure(compile(op), "{'droid': {}}");
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals(ResponsePath.of("droid", "name"), e.path());

        var top = failure(compile(COMPUTERS), "{}");
        assertEquals(ResponsePath.of("computers"), top.path());
    }

    @Test
    void absent_nullable_fields_decode_as_null_and_unknown_keys_are_ignored() {
        var out = decoder.decode(compile(COMPUTERS),
                json("{'computers': [{'id': 1, 'extra': true, 'screen': {'isColor': false, 'resolution': '640x480'}}]}"),
                Variables.empty());

        Map<String, Object> c = obj(((List<?>) out.get("computers")).get(0));
        assertEquals(List.of("id", "year", "screen"), new ArrayList<>(c.keySet()));
        assertEquals("1", c.get("id"));
        assertNull(c.get("year"));
        assertEquals(List.of("resolution", "isColor"), new ArrayList<>(obj(c.get("screen")).keySet()));
    }

    @Test
    void null_for_non_null_is_a_violation_at_the_exact_position() {
        var e = failure(compile(COMPUTERS),
                "{'computers': [{'id': 1, 'screen': {'resolution': 'a', 'isColor': true}}, null]}");
        assertEquals(ErrorKind.NON_NULL_VIOLATION, e.kind());
        assertEquals(ResponsePath.of("computers", 1), e.path());

        var nested = failure(compile(COMPUTERS), "{'computers': [{'id': 1, 'screen': null}]}");
        assertEquals(ResponsePath.of("computers", 0, "screen"), nested.path());
    }

    @Test
    void wrong_json_shape_is_a_type_mismatch() {
        var e = failure(compile(COMPUTERS), "{'computers': {'id': 1}}");
        assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        assertEquals(ResponsePath.of("computers"), e.path());
    }

    @Test
    void scalar_that_does_not_coerce_is_reported() {
        var e = failure(compile(COMPUTERS),
                "{'computers': [{'id': 1, 'year': '1977', 'screen': {'resolution': 'a', 'isColor': true}}]}");
        assertEquals(ErrorKind.SCALAR_COERCION_ERROR, e.kind());
        assertEquals(ResponsePath.of("computers", 0, "year"), e.path());
    }

    @Test
    void lists_of_enums_and_nullable_elements() {
        var op = OperationDefinition.query("Q", field("tags"), field("droid", field("appearsIn")));

        var out = decoder.decode(compile(op), json("{'tags': ['a', null], 'droid': {'appearsIn': ['JEDI', 'EMPIRE']}}"),
                Variables.empty());

        assertEquals(Arrays.asList("a", null), out.get("tags"));
        assertEquals(List.of("JEDI", "EMPIRE"), obj(out.get("droid")).get("appearsIn"));
    }

    @Test
    void deferred_fields_are_skipped_in_the_base_payload() {
        var op = OperationDefinition.query("Q",
                field("computers", field("id"),
                        field("screen", field("resolution"), field("isColor")).withDirective(defer("screen"))));

        var out = decoder.decode(compile(op),
                json("{'computers': [{'id': 7, 'screen': {'resolution': 'a', 'isColor': true}}]}"), Variables.empty());

        assertEquals(Map.of("id", "7"), ((List<?>) out.get("computers")).get(0));
    }

    @Test
    void defer_with_a_false_if_reads_the_field_from_the_base_payload() {
        var op = OperationDefinition.query("Q",
                field("computers", field("id"),
                        field("screen", field("resolution"), field("isColor")).withDirective(deferIf("screen", "flag"))))
                .withVariables(List.of(new VariableDefinition("flag", TypeRef.parse("Boolean!"), null)));
        CanonicalTree tree = compile(op);
        var payload = json("{'computers': [{'id': 7, 'screen': {'resolution': 'a', 'isColor': true}}]}");

        var eager = decoder.decode(tree, payload, Variables.forTree(tree, Map.of("flag", false)));
        assertEquals(Map.of("resolution", "a", "isColor", true),
                obj(((List<?>) eager.get("computers")).get(0)).get("screen"));

        var deferred = decoder.decode(tree, payload, Variables.forTree(tree, Map.of("flag", true)));
        assertEquals(Map.of("id", "7"), ((List<?>) deferred.get("computers")).get(0));

        var e = assertThrows(CodecException.class, () -> decoder.decode(tree,
                json("{'computers': [{'id': 7}]}"), Variables.forTree(tree, Map.of("flag", false))));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals(ResponsePath.of("computers", 0, "screen"), e.path());
    }

    @Test
    void defer_if_that_is_not_a_boolean_is_a_type_mismatch() {
        var op = OperationDefinition.query("Q",
                field("computers", field("id"), field("screen", field("isColor")).withDirective(deferIf("screen", "flag"))));
        CanonicalTree tree = compile(op);

        var e = assertThrows(CodecException.class, () -> decoder.decode(tree,
                json("{'computers': [{'id': 7}]}"), Variables.forTree(tree, Map.of("flag", "yes"))));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        assertEquals(ResponsePath.of("computers", 0, "screen"), e.path());
    }

    @Test
    void excluded_fields_are_neither_read_nor_required() {
        var op = OperationDefinition.query("Q", field("droid", field("id"), field("name").withDirective(include("withName"))))
                .withVariables(List.of(new VariableDefinition("withName",
                        TypeRef.parse("Boolean!"), null)));
        CanonicalTree tree = compile(op);

        var off = decoder.decode(tree, json("{'droid': {'id': 'x', 'name': 'R2'}}"),
                Variables.forTree(tree, Map.of("withName", false)));
        assertEquals(Map.of("id", "x"), off.get("droid"));

        var on = decoder.decode(tree, json("{'droid': {'id': 'x', 'name': 'R2'}}"),
                Variables.forTree(tree, Map.of("withName", true)));
        assertEquals("R2", obj(on.get("droid")).get("name"));
    }

    @Test
    void unbound_variable_fails_before_decoding() {
        var op = OperationDefinition.query("Q", field("droid", field("id").withDirective(include("flag"))));

        var e = failure(compile(op), "{'droid': {'id': 'x'}}");
        assertEquals(ErrorKind.MISSING_VARIABLE, e.kind());
    }

    @Test
    void custom_scalars_use_the_registered_class() {
        var op = OperationDefinition.query("Q", field("computers", field("price"), field("screen", field("isColor"))));
        var custom = new ResponseDecoder(ScalarRegistry.fromMapping(Map.of("Decimal", "java.math.BigDecimal")));

        var out = custom.decode(compile(op), json("{'computers': [{'price': 12.5, 'screen': {'isColor': true}}]}"),
                Variables.empty());

        assertEquals(new BigDecimal("12.5"), obj(((List<?>) out.get("computers")).get(0)).get("price"));
    }

    @Test
    void listener_sees_every_object_with_its_path() {
        List<String> seen = new ArrayList<>();
        decoder.decode(compile(COMPUTERS),
                json("{'computers': [{'id': 1, 'screen': {'resolution': 'a', 'isColor': true}}]}"),
                Variables.empty(), (path, shape, value) -> seen.add(path + " " + shape.typeName()));

        assertEquals(List.of("computers[0].screen Screen", "computers[0] Computer", "$ Query"), seen);
    }
}
