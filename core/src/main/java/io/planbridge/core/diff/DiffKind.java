// file: core/src/main/java/io/planbridge/core/diff/DiffKind.java
package io.planbridge.core.diff;

/** Base classification of one changed path. */
public enum DiffKind {
    ADD,
    DELETE,
    UPDATE
}
