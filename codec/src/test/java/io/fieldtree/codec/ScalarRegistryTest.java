package io.fieldtree.codec;

import com.fasterxml.jackson.databind.node.TextNode;
import io.fieldtree.core.schema.NamedTypeKind;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.fieldtree.codec.Fixtures.json;
import static org.junit.jupiter.api.Assertions.*;

class ScalarRegistryTest {

    private final ScalarRegistry registry = ScalarRegistry.defaults();

    @Test
    void built_in_int_rejects_fractions_and_overflow() {
        var coercion = registry.coercion("Int", NamedTypeKind.SCALAR);
        assertEquals(42, coercion.decode(json("42")));
        assertThrows(IllegalArgumentException.class, () -> coercion.decode(json("4.2")));
        assertThrows(IllegalArgumentException.class, () -> coercion.decode(json("3000000000")));
    }

    @Test
    void ids_accept_integers_and_come_back_as_strings() {
        var coercion = registry.coercion("ID", NamedTypeKind.SCALAR);
        assertEquals("7", coercion.decode(json("7")));
        assertEquals(new TextNode("7"), coercion.encode("7"));
    }

    @Test
    void enums_are_names() {
        var coercion = registry.coercion("Episode", NamedTypeKind.ENUM);
        assertEquals("JEDI", coercion.decode(json("\"JEDI\"")));
        assertEquals(new TextNode("SECONDS"), coercion.encode(TimeUnit.SECONDS));
    }

    @Test
    void unregistered_custom_scalars_pass_through() {
        var coercion = registry.coercion("Date", NamedTypeKind.SCALAR);
        assertEquals("2024-01-01", coercion.decode(json("\"2024-01-01\"")));
        assertEquals(Map.of("lat", 1), coercion.decode(json("{\"lat\": 1}")));
    }

    @Test
    void mapping_binds_scalars_to_java_classes() {
        var mapped = ScalarRegistry.fromMapping(Map.of("Url", "java.net.URI"));
        var coercion = mapped.coercion("Url", NamedTypeKind.SCALAR);

        assertEquals(URI.create("https://example.org/r2"), coercion.decode(json("\"https://example.org/r2\"")));
        assertThrows(IllegalArgumentException.class, () -> coercion.encode("not a uri object"));
        assertTrue(mapped.isRegistered("Url"));
    }

    @Test
    void mapping_to_an_unknown_class_fails_fast() {
        assertThrows(IllegalArgumentException.class,
                () -> ScalarRegistry.fromMapping(Map.of("Date", "com.example.NoSuchDate")));
    }

    @Test
    void explicit_registration_overrides_built_ins() {
        var upper = ScalarCoercion.of(n -> n.textValue().toUpperCase(), v -> new TextNode(v.toString()));
        assertEquals("R2", registry.with("String", upper).coercion("String", NamedTypeKind.SCALAR).decode(json("\"r2\"")));
    }
}
