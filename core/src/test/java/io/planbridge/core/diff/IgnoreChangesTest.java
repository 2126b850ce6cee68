// file: core/src/test/java/io/planbridge/core/diff/IgnoreChangesTest.java
package io.planbridge.core.diff;

import io.planbridge.core.schema.ResourceSchema;
import io.planbridge.core.schema.SchemaNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.planbridge.core.value.ValueTree.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Ignored paths take their value from the old tree.
 */
class IgnoreChangesTest {

    @Test
    void changed_value_is_reset_to_old() {
        var olds = object("name", of("a"), "size", of(1));
        var news = object("name", of("b"), "size", of(2));

        var out = IgnoreChanges.apply(olds, news, List.of("name"));

        assertEquals(object("name", of("a"), "size", of(2)), out);
    }

    @Test
    void value_only_in_new_is_removed_and_value_only_in_old_is_restored() {
        var olds = object("keep", of("k"));
        var news = object("extra", of("e"));

        var out = IgnoreChanges.apply(olds, news, List.of("extra", "keep"));

        assertEquals(object("keep", of("k")), out);
    }

    @Test
    void nested_paths_and_wildcards() {
        var olds = object("rules", list(object("port", of(80), "note", of("x")), object("port", of(443), "note", of("y"))),
                "labels", map(Map.of("a", of("1"), "b", of("2"))));
        var news = object("rules", list(object("port", of(81), "note", of("x2")), object("port", of(444), "note", of("y"))),
                "labels", map(Map.of("a", of("9"), "c", of("3"))));

        var out = IgnoreChanges.apply(olds, news, List.of("rules[*].port", "labels.*"));

        var expected = object("rules", list(object("port", of(80), "note", of("x2")), object("port", of(443), "note", of("y"))),
                "labels", map(Map.of("a", of("1"), "b", of("2"))));
        assertEquals(expected, out);
    }

    @Test
    void list_index_only_in_old_is_restored() {
        var olds = object("tests", list(of("a"), of("b")));
        var news = object("tests", list(of("a")));

        var out = IgnoreChanges.apply(olds, news, List.of("tests[1]"));

        assertEquals(olds, out);
        var s = new ResourceSchema("prov:index/test:Test", SchemaNode.block(Map.of(
                "tests", SchemaNode.list(SchemaNode.string()).optional())));
        assertTrue(DiffEngine.diff(s, olds, news, DiffOptions.defaults().withIgnoreChanges(List.of("tests[1]"))).isEmpty());
    }

    @Test
    void wildcard_restores_old_only_elements_and_absent_lists() {
        var olds = object("tests", list(of("a"), of("b")));

        assertEquals(olds, IgnoreChanges.apply(olds, object("tests", list(of("x"))), List.of("tests[*]")));
        assertEquals(olds, IgnoreChanges.apply(olds, object(), List.of("tests[*]")));
        assertEquals(object(), IgnoreChanges.apply(object(), object(), List.of("tests[3]")));
    }

    @Test
    void paths_into_scalars_leave_new_unchanged() {
        var olds = object("name", of("a"));
        var news = object("name", of("b"));

        assertEquals(news, IgnoreChanges.apply(olds, news, List.of("name.inner", "name[0]")));
    }

    @Test
    void malformed_path_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> IgnoreChanges.apply(object(), object(), List.of("a..b")));
    }
}
