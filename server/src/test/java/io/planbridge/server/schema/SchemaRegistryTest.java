// file: server/src/test/java/io/planbridge/server/schema/SchemaRegistryTest.java
package io.planbridge.server.schema;

import io.planbridge.core.schema.ResourceSchema;
import io.planbridge.core.schema.ScalarType;
import io.planbridge.core.schema.SchemaNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies resource schemas can be loaded from the JSON schema document.
 */
class SchemaRegistryTest {

    @TempDir
    Path tmp;

    @Test
    void loads_bundled_test_schema() {
        SchemaRegistry registry = SchemaRegistry.fromClasspath("/test-schema.json");

        assertEquals(List.of("prov:index/test:Replaced", "prov:index/test:Test"), List.copyOf(registry.tokens()));

        ResourceSchema test = registry.get("prov:index/test:Test");
        assertFalse(test.deleteBeforeReplace());
        SchemaNode name = test.root().field("name");
        assertTrue(name.isRequired());
        assertTrue(name.isForceNew());
        assertTrue(test.root().field("id").isProviderFilled());
        assertEquals(SchemaNode.Kind.SET, test.root().field("tags").kind());
        assertEquals(ScalarType.STRING, test.root().field("tags").elem().scalarType());
        assertTrue(test.root().field("password").isSensitive());

        assertTrue(registry.get("prov:index/test:Replaced").deleteBeforeReplace());
    }

    @Test
    void loads_nested_blocks_from_file() throws Exception {
        String json = """
                {
                  "resources": {
                    "prov:index/lb:Lb": {
                      "properties": {
                        "listener": {
                          "type": "list",
                          "maxItemsOne": true,
                          "elem": {
                            "type": "block",
                            "fields": {
                              "port": { "type": "number", "required": true, "forceNew": true }
                            }
                          }
                        }
                      }
                    }
                  }
                }
                """;
        Path file = tmp.resolve("schema.json");
        Files.writeString(file, json);

        ResourceSchema lb = SchemaRegistry.fromJsonFile(file).get("prov:index/lb:Lb");

        SchemaNode listener = lb.root().field("listener");
        assertTrue(listener.isSingleton());
        assertTrue(listener.elem().isBlock());
        assertEquals(ScalarType.NUMBER, listener.elem().field("port").scalarType());
    }

    @Test
    void unknown_type_token_is_rejected() {
        SchemaRegistry registry = SchemaRegistry.fromClasspath("/test-schema.json");

        var ex = assertThrows(IllegalArgumentException.class, () -> registry.get("prov:index/nope:Nope"));
        assertEquals("unknown resource type prov:index/nope:Nope", ex.getMessage());
    }

    @Test
    void unknown_field_type_is_rejected() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, """
                {"resources": {"t:m:R": {"properties": {"x": {"type": "tuple"}}}}}
                """);

        var ex = assertThrows(IllegalArgumentException.class, () -> SchemaRegistry.fromJsonFile(file));
        assertEquals("unknown type 'tuple' at t:m:R.x", ex.getMessage());
    }

    @Test
    void missing_classpath_resource_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> SchemaRegistry.fromClasspath("/nope.json"));
    }
}
