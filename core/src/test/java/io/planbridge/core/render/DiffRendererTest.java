// file: core/src/test/java/io/planbridge/core/render/DiffRendererTest.java
package io.planbridge.core.render;

import io.planbridge.core.diff.DiffEngine;
import io.planbridge.core.diff.DiffResult;
import io.planbridge.core.schema.ResourceSchema;
import io.planbridge.core.schema.SchemaNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.planbridge.core.value.ValueTree.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire kinds and the human-readable preview.
 */
class DiffRendererTest {

    private static final ResourceSchema SCHEMA = new ResourceSchema("prov:Test", SchemaNode.block(Map.of(
            "name", SchemaNode.string().required().forceNew(),
            "password", SchemaNode.string().optional().sensitive(),
            "tests", SchemaNode.list(SchemaNode.string()).optional(),
            "note", SchemaNode.string().optional())));

    @Test
    void wire_map_encodes_kind_and_replace() {
        var result = DiffEngine.diff(SCHEMA,
                object("name", of("a"), "note", of("n")),
                object("name", of("b"), "tests", list(of("x"))));

        Map<String, WireKind> wire = DiffRenderer.toWire(result);

        assertEquals(Map.of(
                "name", WireKind.UPDATE_REPLACE,
                "note", WireKind.DELETE,
                "tests", WireKind.ADD), wire);
        assertEquals(List.of("name", "note", "tests"), List.copyOf(wire.keySet()));
    }

    @Test
    void resource_block_nests_entries_and_hides_secrets() {
        var olds = object("name", of("a"), "tests", list(of("x"), of("y")), "password", of("p1"));
        var news = object("name", of("b"), "tests", list(of("x"), of("z")), "password", of("p2"));
        DiffResult diff = DiffEngine.diff(SCHEMA, olds, news);

        String text = DiffRenderer.renderResource(ResourceChange.of("prov:Test", "res", true, diff), Colorization.NEVER);

        assertEquals(
                "+- prov:Test res (replace)\n"
                        + "    +- name: \"a\" => \"b\"\n"
                        + "    ~ password: [secret] => [secret]\n"
                        + "    ~ tests: [\n"
                        + "        ~ [1]: \"y\" => \"z\"\n"
                        + "      ]\n",
                text);
    }

    @Test
    void preview_sorts_resources_and_summarizes() {
        var plain = new ResourceSchema("prov:Test", SchemaNode.block(Map.of("name", SchemaNode.string().optional())));
        var create = ResourceChange.of("prov:Test", "b", false, DiffEngine.diff(plain, nil(), object("name", of("n"))));
        var delete = ResourceChange.delete("prov:Test", "a");
        var same = ResourceChange.of("prov:Test", "c", true, DiffResult.empty());

        String text = DiffRenderer.preview(List.of(same, create, delete), Colorization.NEVER);

        assertEquals(
                "- prov:Test a (delete)\n"
                        + "\n"
                        + "+ prov:Test b (create)\n"
                        + "    + name: \"n\"\n"
                        + "\n"
                        + "Resources:\n"
                        + "    + 1 to create\n"
                        + "    - 1 to delete\n"
                        + "    1 unchanged\n",
                text);
    }

    @Test
    void unknowns_and_collections_are_formatted_inline() {
        var olds = object("name", of("a"));
        var news = object("name", of("a"), "note", unknown(), "tests", list(of("x"), of("y")));
        DiffResult diff = DiffEngine.diff(SCHEMA, olds, news);

        String text = DiffRenderer.renderResource(ResourceChange.of("prov:Test", "r", true, diff), Colorization.NEVER);

        assertTrue(text.contains("    + note: (unknown)\n"), text);
        assertTrue(text.contains("    + tests: [\"x\", \"y\"]\n"), text);
        assertTrue(text.startsWith("~ prov:Test r (update)\n"), text);
    }

    @Test
    void colorization_wraps_marked_lines() {
        String text = DiffRenderer.preview(List.of(ResourceChange.delete("prov:Test", "a")), Colorization.ALWAYS);

        assertTrue(text.startsWith("\u001B[31m- prov:Test a (delete)\u001B[0m\n"), text);
        assertEquals(text, DiffRenderer.preview(List.of(ResourceChange.delete("prov:Test", "a")), Colorization.ALWAYS));
    }

    @Test
    void empty_preview_says_no_changes() {
        assertEquals("Resources:\n    no changes\n", DiffRenderer.preview(List.of(), Colorization.NEVER));
    }
}
