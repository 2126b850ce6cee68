// file: server/src/main/java/io/planbridge/server/schema/SchemaRegistry.java
package io.planbridge.server.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.planbridge.core.schema.ResourceSchema;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.server.dto.SchemaDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Read-only table of resource schemas keyed by type token.
 * Built once at startup from a JSON {@link SchemaDocument} and shared by all requests.
 */
public final class SchemaRegistry {

    private static final Logger log = Logger.getLogger(SchemaRegistry.class.getName());

    private final Map<String, ResourceSchema> schemas;

    public SchemaRegistry(Map<String, ResourceSchema> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    public static SchemaRegistry fromJsonFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read schema file " + path, e);
        }
    }

    /** Load the schema bundled on the classpath under {@code resource}. */
    public static SchemaRegistry fromClasspath(String resource) {
        try (InputStream in = SchemaRegistry.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalArgumentException("schema resource not found: " + resource);
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read schema resource " + resource, e);
        }
    }

    public static SchemaRegistry fromJson(InputStream in) throws IOException {
        SchemaDocument doc = new ObjectMapper().readValue(in, SchemaDocument.class);
        if (doc.resources == null || doc.resources.isEmpty()) {
            throw new IllegalArgumentException("schema document declares no resources");
        }
        var out = new LinkedHashMap<String, ResourceSchema>();
        doc.resources.forEach((token, res) -> out.put(token, toSchema(token, res)));
        log.info(() -> "loaded " + out.size() + " resource schemas");
        return new SchemaRegistry(out);
    }

    /**
     * @throws IllegalArgumentException if no schema is registered for {@code token}
     */
    public ResourceSchema get(String token) {
        ResourceSchema s = schemas.get(token);
        if (s == null) throw new IllegalArgumentException("unknown resource type " + token);
        return s;
    }

    public Set<String> tokens() {
        return new TreeMap<>(schemas).keySet();
    }

    private static ResourceSchema toSchema(String token, SchemaDocument.Resource res) {
        Objects.requireNonNull(res, "resource " + token);
        var fields = new LinkedHashMap<String, SchemaNode>();
        if (res.properties != null) {
            res.properties.forEach((name, f) -> fields.put(name, toNode(token + "." + name, f)));
        }
        return new ResourceSchema(token, SchemaNode.block(fields), res.deleteBeforeReplace);
    }

    private static SchemaNode toNode(String where, SchemaDocument.Field f) {
        if (f == null || f.type == null) throw new IllegalArgumentException("missing type at " + where);
        SchemaNode node = switch (f.type) {
            case "string" -> SchemaNode.string();
            case "number" -> SchemaNode.number();
            case "bool" -> SchemaNode.bool();
            case "list" -> SchemaNode.list(toNode(where + "[]", f.elem));
            case "set" -> SchemaNode.set(toNode(where + "[]", f.elem));
            case "map" -> SchemaNode.map(toNode(where + "{}", f.elem));
            case "block" -> {
                var fields = new LinkedHashMap<String, SchemaNode>();
                if (f.fields != null) f.fields.forEach((n, sub) -> fields.put(n, toNode(where + "." + n, sub)));
                yield SchemaNode.block(fields);
            }
            default -> throw new IllegalArgumentException("unknown type '" + f.type + "' at " + where);
        };
        if (f.required) node = node.required();
        if (f.optional) node = node.optional();
        if (f.computed) node = node.computed();
        if (f.forceNew) node = node.forceNew();
        if (f.sensitive) node = node.sensitive();
        if (f.maxItemsOne) node = node.singleton();
        return node;
    }
}
