// file: server/src/main/java/io/planbridge/server/Urn.java
package io.planbridge.server;

import java.util.Objects;

/**
 * Resource identity as sent by the deployment engine:
 * {@code urn:<stack>::<project>::<type>::<name>}.
 * The type selects the resource schema; the name is only used for display.
 */
public record Urn(String stack, String project, String type, String name) {

    private static final String PREFIX = "urn:";
    private static final String SEP = "::";

    public Urn {
        Objects.requireNonNull(stack, "stack");
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        if (type.isBlank()) throw new IllegalArgumentException("urn type must not be empty");
    }

    /**
     * @throws IllegalArgumentException if the text is not a four-part urn
     */
    public static Urn parse(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            throw new IllegalArgumentException("invalid urn: " + text);
        }
        // The name is last and may itself contain "::".
        String[] parts = text.substring(PREFIX.length()).split(SEP, 4);
        if (parts.length != 4) {
            throw new IllegalArgumentException("invalid urn: " + text);
        }
        return new Urn(parts[0], parts[1], parts[2], parts[3]);
    }

    @Override public String toString() {
        return PREFIX + stack + SEP + project + SEP + type + SEP + name;
    }
}
