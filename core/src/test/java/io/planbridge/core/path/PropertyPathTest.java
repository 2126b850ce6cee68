// file: core/src/test/java/io/planbridge/core/path/PropertyPathTest.java
package io.planbridge.core.path;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Path text form, parsing and ordering.
 */
class PropertyPathTest {

    @Test
    void formats_names_indices_and_quoted_keys() {
        assertEquals("tests[0].nested", PropertyPath.of("tests", 0, "nested").toString());
        assertEquals("labels[\"a b\"]", PropertyPath.of("labels", "a b").toString());
        assertEquals("", PropertyPath.root().toString());
    }

    @Test
    void parse_inverts_format() {
        for (String text : List.of("a", "a.b", "tests[12].nested", "labels[\"a.b\"].x", "rules.*.port")) {
            assertEquals(text, PropertyPath.parse(text).toString());
        }
        assertEquals(PropertyPath.of("labels", "say \"hi\""), PropertyPath.parse("labels[\"say \\\"hi\\\"\"]"));
    }

    @Test
    void parse_rejects_malformed_paths() {
        assertThrows(IllegalArgumentException.class, () -> PropertyPath.parse("a..b"));
        assertThrows(IllegalArgumentException.class, () -> PropertyPath.parse("a[1"));
        assertThrows(IllegalArgumentException.class, () -> PropertyPath.parse("a[x]"));
        assertThrows(IllegalArgumentException.class, () -> PropertyPath.parse("a."));
    }

    @Test
    void ordering_puts_indices_before_names_and_parents_first() {
        var paths = new ArrayList<>(List.of(
                PropertyPath.parse("b"),
                PropertyPath.parse("a.x"),
                PropertyPath.parse("a"),
                PropertyPath.parse("a[1]"),
                PropertyPath.parse("a[0]")));
        Collections.sort(paths);

        assertEquals(List.of("a", "a[0]", "a[1]", "a.x", "b"), paths.stream().map(PropertyPath::toString).toList());
    }

    @Test
    void top_level_parent_and_last_helpers() {
        var p = PropertyPath.parse("tests[0].nested");

        assertEquals("tests", p.topLevel());
        assertEquals(PropertyPath.parse("tests[0]"), p.parent());
        assertEquals("nested", p.last());
    }
}
