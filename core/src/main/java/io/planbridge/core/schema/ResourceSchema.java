// file: core/src/main/java/io/planbridge/core/schema/ResourceSchema.java
package io.planbridge.core.schema;

import java.util.Objects;

/**
 * Schema of one resource type as exposed through the provider protocol.
 *
 * @param token               resource type token, for example {@code example:index:Widget}
 * @param root                top-level block holding the resource's properties
 * @param deleteBeforeReplace when a replace is planned, delete the old instance first
 */
public record ResourceSchema(String token, SchemaNode root, boolean deleteBeforeReplace) {

    public ResourceSchema {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(root, "root");
        if (token.isBlank()) throw new IllegalArgumentException("token must not be blank");
        if (!root.isBlock()) throw new IllegalArgumentException("resource root must be a block, got " + root.describe());
    }

    public ResourceSchema(String token, SchemaNode root) {
        this(token, root, false);
    }
}
