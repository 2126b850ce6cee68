// file: core/src/main/java/io/planbridge/core/diff/DiffException.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;

/**
 * Failure of a single resource's diff evaluation.
 * <p>
 * Kinds:
 *  - UNEXPECTED_TYPE: a value's shape contradicts its schema (e.g. a scalar where a list is declared).
 *  - STRUCTURAL:      the inputs cannot be diffed at all (e.g. a set element with no content hash).
 * <p>
 * The engine is a pure function, so neither kind is worth retrying.
 */
public final class DiffException extends RuntimeException {

    public enum Kind { UNEXPECTED_TYPE, STRUCTURAL }

    private final Kind kind;
    private final PropertyPath path;

    public DiffException(Kind kind, PropertyPath path, String message) {
        super(message);
        this.kind = kind;
        this.path = path;
    }

    public DiffException(Kind kind, PropertyPath path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public static DiffException unexpectedType(PropertyPath path) {
        return new DiffException(Kind.UNEXPECTED_TYPE, path, "unexpected type at field " + describe(path));
    }

    static String describe(PropertyPath path) {
        return path == null || path.isRoot() ? "<root>" : path.toString();
    }

    public Kind kind() { return kind; }

    public PropertyPath path() { return path; }
}
