package io.fieldtree.codec;

import io.fieldtree.core.document.FragmentDefinition;
import io.fieldtree.core.document.FragmentSpread;
import io.fieldtree.core.document.OperationDefinition;
import io.fieldtree.core.model.Field;
import io.fieldtree.core.tree.CanonicalTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.fieldtree.codec.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FragmentAccessTest {

    private final ResponseDecoder decoder = new ResponseDecoder(ScalarRegistry.defaults());

    private final CanonicalTree tree = compile(
            OperationDefinition.query("Hero", field("hero", field("id"), FragmentSpread.of("HeroDetails"),
                    on("Droid", field("primaryFunction")))),
            FragmentDefinition.of("HeroDetails", "Character", field("name")));

    private final Field hero = tree.root().subSelection().get(0);

    @SuppressWarnings("unchecked")
    private Map<String, Object> decodeHero(String payload) {
        return (Map<String, Object>) decoder.decode(tree, json(payload), Variables.empty()).get("hero");
    }

    @Test
    void named_fragment_view_holds_its_fields_and_the_inherited_ones() {
        var value = decodeHero("{'hero': {'__typename': 'Droid', 'id': '1', 'name': 'R2', 'primaryFunction': 'x'}}");

        Map<String, Object> details = FragmentAccess.view(tree, hero, value, "heroDetails").orElseThrow();
        assertEquals(List.of("name", "__typename", "id"), List.copyOf(details.keySet()));
    }

    @Test
    void inline_fragment_view_is_empty_for_other_types() {
        var droid = decodeHero("{'hero': {'__typename': 'Droid', 'id': '1', 'name': 'R2'}}");
        assertEquals("R2", FragmentAccess.view(tree, hero, droid, "asDroid").orElseThrow().get("name"));

        var human = Map.<String, Object>of("__typename", "Human", "id", "2", "name", "Luke");
        assertTrue(FragmentAccess.view(tree, hero, human, "asDroid").isEmpty());
    }

    @Test
    void unknown_accessor_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> FragmentAccess.view(tree, hero, Map.of(), "asStarship"));
    }
}
