// file: core/src/main/java/io/planbridge/core/render/ResourceChange.java
package io.planbridge.core.render;

import io.planbridge.core.diff.DiffResult;

import java.util.Objects;

/**
 * One resource's planned step, the unit of a preview.
 *
 * @param type resource type token, e.g. {@code prov:index/test:Test}
 * @param name logical resource name
 * @param op   planned operation
 * @param diff detailed diff; empty for DELETE and SAME
 */
public record ResourceChange(String type, String name, Operation op, DiffResult diff) {

    public enum Operation {
        CREATE("+", "create"),
        UPDATE("~", "update"),
        REPLACE("+-", "replace"),
        DELETE("-", "delete"),
        SAME(" ", "same");

        final String marker;
        final String label;

        Operation(String marker, String label) {
            this.marker = marker;
            this.label = label;
        }
    }

    public ResourceChange {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(op, "op");
        diff = diff == null ? DiffResult.empty() : diff;
    }

    /**
     * Classify a diff of an existing (or, with {@code exists=false}, new) resource.
     * No prior state means CREATE; no change means SAME; otherwise the replace bit decides.
     */
    public static ResourceChange of(String type, String name, boolean exists, DiffResult diff) {
        Operation op;
        if (!exists) op = Operation.CREATE;
        else if (!diff.hasChanges()) op = Operation.SAME;
        else if (diff.replace()) op = Operation.REPLACE;
        else op = Operation.UPDATE;
        return new ResourceChange(type, name, op, diff);
    }

    public static ResourceChange delete(String type, String name) {
        return new ResourceChange(type, name, Operation.DELETE, DiffResult.empty());
    }
}
