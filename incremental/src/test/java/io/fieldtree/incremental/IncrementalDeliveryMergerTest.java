package io.fieldtree.incremental;

import io.fieldtree.codec.CodecException;
import io.fieldtree.codec.ResponseDecoder;
import io.fieldtree.codec.ScalarRegistry;
import io.fieldtree.codec.Variables;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.PolymorphicFallback;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.fieldtree.incremental.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior tests for grafting deferred deliveries into a decoded result.
 */
class IncrementalDeliveryMergerTest {

    private final ResponseDecoder decoder = new ResponseDecoder(ScalarRegistry.defaults());

    private final CanonicalTree screens = compile(PolymorphicFallback.STRICT,
            field("computers", field("id"),
                    field("screen", field("resolution"), field("isColor")).withDirective(defer("screen"))));

    private IncrementalDeliveryMerger start(CanonicalTree tree, String base) {
        return IncrementalDeliveryMerger.start(decoder, tree, json(base), Variables.empty());
    }

    private static IncrementalPatch patch(String label, String data, boolean isFinal, Object... path) {
        return new IncrementalPatch(ResponsePath.of(path), label, json(data), isFinal);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> computer(IncrementalDeliveryMerger m, int i) {
        return (Map<String, Object>) ((List<?>) m.currentResult().get("computers")).get(i);
    }

    @Test
    void deferred_field_is_absent_until_its_patch_completes_the_delivery() {
        var m = start(screens, "{'computers': [{'id': 'c1'}]}");

        assertFalse(m.isComplete());
        assertEquals(Set.of("screen"), m.pendingLabels());
        assertEquals(Map.of("id", "c1"), computer(m, 0));

        m.apply(patch("screen", "{'resolution': '640x480', 'isColor': true}", true, "computers", 0, "screen"));

        assertTrue(m.isComplete());
        assertEquals(IncrementalDeliveryMerger.State.COMPLETE, m.state());
        assertEquals(List.of("id", "screen"), new ArrayList<>(computer(m, 0).keySet()));
        assertEquals(Map.of("resolution", "640x480", "isColor", true), computer(m, 0).get("screen"));
    }

    @Test
    void deferral_switched_off_by_its_if_arrives_with_the_base_and_leaves_nothing_pending() {
        CanonicalTree tree = compile(PolymorphicFallback.STRICT,
                field("computers", field("id"),
                        field("screen", field("resolution"), field("isColor")).withDirective(deferIf("s", "flag"))));
        var base = json("{'computers': [{'id': 'c1', 'screen': {'resolution': '640x480', 'isColor': true}}]}");

        var eager = IncrementalDeliveryMerger.start(decoder, tree, base, Variables.of(Map.of("flag", false)));
        assertTrue(eager.isComplete());
        assertTrue(eager.pendingDeliveries().isEmpty());
        assertEquals(Map.of("resolution", "640x480", "isColor", true), computer(eager, 0).get("screen"));

        var deferred = IncrementalDeliveryMerger.start(decoder, tree, base, Variables.of(Map.of("flag", true)));
        assertFalse(deferred.isComplete());
        assertEquals(Set.of(new DeliveryKey("s", ResponsePath.of("computers", 0, "screen"))),
                deferred.pendingDeliveries());
        assertEquals(Map.of("id", "c1"), computer(deferred, 0));
    }

    @Test
    void one_delivery_per_list_element_in_any_order() {
        var m = start(screens, "{'computers': [{'id': 'c1'}, {'id': 'c2'}]}");
        assertEquals(Set.of(
                new DeliveryKey("screen", ResponsePath.of("computers", 0, "screen")),
                new DeliveryKey("screen", ResponsePath.of("computers", 1, "screen"))), m.pendingDeliveries());

        m.apply(patch("screen", "{'resolution': 'b', 'isColor': false}", false, "computers", 1, "screen"));
        assertFalse(m.isComplete());
        m.apply(patch("screen", "{'resolution': 'a', 'isColor': true}", true, "computers", 0, "screen"));

        assertTrue(m.isComplete());
        assertEquals("a", ((Map<?, ?>) computer(m, 0).get("screen")).get("resolution"));
        assertEquals("b", ((Map<?, ?>) computer(m, 1).get("screen")).get("resolution"));
    }

    @Test
    void same_patch_twice_is_a_duplicate() {
        var m = start(screens, "{'computers': [{'id': 'c1'}, {'id': 'c2'}]}");
        var first = patch("screen", "{'resolution': 'a', 'isColor': true}", false, "computers", 0, "screen");
        m.apply(first);

        var e = assertThrows(PatchException.class, () -> m.apply(first));
        assertEquals(ErrorKind.DUPLICATE_PATCH, e.kind());

        var wrongLabel = patch("other", "{'resolution': 'a', 'isColor': true}", false, "computers", 1, "screen");
        assertEquals(ErrorKind.DUPLICATE_PATCH, assertThrows(PatchException.class, () -> m.apply(wrongLabel)).kind());
    }

    @Test
    void patch_for_a_path_that_does_not_exist_is_unresolvable() {
        var m = start(screens, "{'computers': [{'id': 'c1'}]}");

        var e = assertThrows(PatchException.class,
                () -> m.apply(patch("screen", "{'resolution': 'a', 'isColor': true}", true, "computers", 3, "screen")));
        assertEquals(ErrorKind.UNRESOLVABLE_PATCH_PATH, e.kind());
        assertEquals(ResponsePath.of("computers", 3, "screen"), e.path());
    }

    @Test
    void final_patch_with_deliveries_outstanding_is_incomplete() {
        var m = start(screens, "{'computers': [{'id': 'c1'}, {'id': 'c2'}]}");

        var e = assertThrows(PatchException.class,
                () -> m.apply(patch("screen", "{'resolution': 'a', 'isColor': true}", true, "computers", 0, "screen")));

        assertEquals(ErrorKind.INCOMPLETE_DELIVERY, e.kind());
        assertFalse(m.isComplete());
        assertTrue(computer(m, 0).containsKey("screen"), "the patch itself is grafted");
        assertEquals(Set.of(new DeliveryKey("screen", ResponsePath.of("computers", 1, "screen"))),
                m.pendingDeliveries());
    }

    @Test
    void failing_patch_leaves_result_and_pending_set_untouched() {
        var m = start(screens, "{'computers': [{'id': 'c1'}]}");

        var e = assertThrows(CodecException.class,
                () -> m.apply(patch("screen", "{'resolution': 'a', 'isColor': 'yes'}", true, "computers", 0, "screen")));
        assertEquals(ErrorKind.SCALAR_COERCION_ERROR, e.kind());
        assertEquals(ResponsePath.of("computers", 0, "screen", "isColor"), e.path());
        assertEquals(Map.of("id", "c1"), computer(m, 0));
        assertEquals(Set.of("screen"), m.pendingLabels());

        m.apply(patch("screen", "{'resolution': 'a', 'isColor': true}", true, "computers", 0, "screen"));
        assertTrue(m.isComplete());
    }

    @Test
    void nested_deferral_is_discovered_when_its_parent_is_grafted() {
        CanonicalTree tree = compile(PolymorphicFallback.STRICT,
                field("computers", field("id"),
                        field("screen", field("resolution"), field("isColor").withDirective(defer("color")))
                                .withDirective(defer("screen"))));
        var m = start(tree, "{'computers': [{'id': 'c1'}]}");
        assertEquals(Set.of("screen"), m.pendingLabels());

        m.apply(patch("screen", "{'resolution': 'a', 'isColor': true}", false, "computers", 0, "screen"));
        assertEquals(Set.of("color"), m.pendingLabels());
        assertEquals(Map.of("resolution", "a"), computer(m, 0).get("screen"));

        m.apply(patch("color", "false", true, "computers", 0, "screen", "isColor"));
        assertTrue(m.isComplete());
        assertEquals(Map.of("resolution", "a", "isColor", false), computer(m, 0).get("screen"));
    }

    @Test
    void deferred_fragment_is_delivered_at_its_object_in_canonical_order() {
        CanonicalTree tree = compile(PolymorphicFallback.CATCH_ALL,
                field("hero", field("name"), on("Droid", field("primaryFunction")).withDirective(defer("droid"))));
        var m = start(tree, "{'hero': {'__typename': 'Droid', 'name': 'R2-D2'}}");
        assertEquals(Set.of(new DeliveryKey("droid", ResponsePath.of("hero"))), m.pendingDeliveries());

        m.apply(patch("droid", "{'primaryFunction': 'Astromech'}", true, "hero"));

        @SuppressWarnings("unchecked")
        Map<String, Object> hero = (Map<String, Object>) m.currentResult().get("hero");
        assertEquals(List.of("primaryFunction", "__typename", "name"), new ArrayList<>(hero.keySet()));
        assertTrue(m.isComplete());
    }

    @Test
    void deferred_fragment_that_does_not_apply_is_never_pending() {
        CanonicalTree tree = compile(PolymorphicFallback.CATCH_ALL,
                field("hero", field("name"), on("Droid", field("primaryFunction")).withDirective(defer("droid"))));
        var m = start(tree, "{'hero': {'__typename': 'Human', 'name': 'Luke'}}");

        assertTrue(m.isComplete());
        var e = assertThrows(PatchException.class, () -> m.apply(patch("droid", "{'primaryFunction': 'x'}", true, "hero")));
        assertEquals(ErrorKind.DUPLICATE_PATCH, e.kind());
    }

    @Test
    void object_addressed_patch_may_carry_a_deferred_field() {
        var m = start(screens, "{'computers': [{'id': 'c1'}]}");

        m.apply(patch("screen", "{'screen': {'resolution': 'a', 'isColor': true}}", true, "computers", 0));

        assertTrue(m.isComplete());
        assertEquals(List.of("id", "screen"), new ArrayList<>(computer(m, 0).keySet()));
    }

    @Test
    void patches_parse_from_the_wire_form() {
        var p = IncrementalPatch.fromJson(json("{'path': ['computers', 0, 'screen'], 'label': 'screen',"
                + " 'data': {'resolution': 'a'}, 'hasNext': false}"));
        assertEquals(ResponsePath.of("computers", 0, "screen"), p.path());
        assertEquals("screen", p.label());
        assertTrue(p.isFinal());

        var unlabeled = IncrementalPatch.fromJson(json("{'path': [], 'data': {}, 'hasNext': true}"));
        assertNull(unlabeled.label());
        assertFalse(unlabeled.isFinal());

        assertThrows(IllegalArgumentException.class, () -> IncrementalPatch.fromJson(json("{'data': {}}")));
    }
}
