package io.planbridge.core.schema;

import io.planbridge.core.path.PropertyPath;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Path resolution through blocks, collections and singleton wrappers.
 */
class SchemaNodeTest {

    private static final SchemaNode PORT = SchemaNode.number().required().forceNew();

    private static final SchemaNode ROOT = SchemaNode.block(Map.of(
            "listener", SchemaNode.list(SchemaNode.block(Map.of("port", PORT))).singleton(),
            "rules", SchemaNode.list(SchemaNode.block(Map.of("port", PORT))),
            "labels", SchemaNode.map(SchemaNode.string()),
            "id", SchemaNode.string().optional().computed()
    ));

    @Test
    void singleton_wrapper_has_no_path_segment() {
        assertSame(PORT, ROOT.lookup(PropertyPath.parse("listener.port")));
        assertNull(ROOT.lookup(PropertyPath.parse("listener[0].port")));
    }

    @Test
    void lists_take_indices_and_maps_take_keys() {
        assertSame(PORT, ROOT.lookup(PropertyPath.parse("rules[3].port")));
        assertNull(ROOT.lookup(PropertyPath.parse("rules.port")));
        assertEquals(ScalarType.STRING, ROOT.lookup(PropertyPath.parse("labels.env")).scalarType());
    }

    @Test
    void unknown_fields_resolve_to_null() {
        assertNull(ROOT.lookup(PropertyPath.parse("nope")));
        assertNull(ROOT.lookup(PropertyPath.parse("id.deeper")));
    }

    @Test
    void flags_are_copied_not_mutated() {
        SchemaNode plain = SchemaNode.string();
        SchemaNode flagged = plain.forceNew().sensitive();

        assertFalse(plain.isForceNew());
        assertTrue(flagged.isForceNew());
        assertTrue(flagged.isSensitive());
        assertTrue(ROOT.field("id").isProviderFilled());
        assertFalse(PORT.isProviderFilled());
    }

    @Test
    void singleton_requires_list_of_blocks() {
        assertThrows(IllegalArgumentException.class, () -> SchemaNode.list(SchemaNode.string()).singleton());
        assertEquals("singleton list<block[port]>", ROOT.field("listener").describe());
    }
}
