package io.fieldtree.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponsePathTest {

    @Test
    void renders_keys_and_indices() {
        var p = ResponsePath.root().append("computers").append(0).append("screen");
        assertEquals("computers[0].screen", p.toString());
        assertEquals("$", ResponsePath.root().toString());
        assertEquals(ResponsePath.of("computers", 0, "screen"), p);
    }

    @Test
    void parent_and_last() {
        var p = ResponsePath.of("search", 2);
        assertEquals(2, p.last());
        assertEquals(ResponsePath.of("search"), p.parent());
        assertTrue(ResponsePath.root().parent().isRoot());
        assertNull(ResponsePath.root().last());
    }

    @Test
    void rejects_other_segment_types() {
        assertThrows(IllegalArgumentException.class, () -> ResponsePath.of("a", 1L));
    }

    @Test
    void exception_message_names_kind_and_path() {
        var e = new FieldTreeException(ErrorKind.NON_NULL_VIOLATION, ResponsePath.of("hero", "name"), "null");
        assertEquals("NON_NULL_VIOLATION at hero.name: null", e.getMessage());
        assertEquals(ErrorKind.NON_NULL_VIOLATION, e.kind());
    }
}
