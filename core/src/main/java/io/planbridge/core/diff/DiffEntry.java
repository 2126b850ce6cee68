// file: core/src/main/java/io/planbridge/core/diff/DiffEntry.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.value.ValueTree;

import java.util.Objects;

/**
 * One changed path of a detailed diff.
 *
 * @param path     where the change is
 * @param kind     ADD, DELETE or UPDATE
 * @param replace  the change forces replacement of the resource
 * @param secret   the values at this path must not be shown
 * @param oldValue subtree before the change (Null for ADD)
 * @param newValue subtree after the change (Null for DELETE)
 */
public record DiffEntry(
        PropertyPath path,
        DiffKind kind,
        boolean replace,
        boolean secret,
        ValueTree oldValue,
        ValueTree newValue
) {
    public DiffEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(oldValue, "oldValue");
        Objects.requireNonNull(newValue, "newValue");
    }

    static DiffEntry of(PropertyPath path, DiffKind kind, ValueTree oldValue, ValueTree newValue) {
        return new DiffEntry(path, kind, false, false, oldValue, newValue);
    }

    public DiffEntry withReplace(boolean replace) {
        return new DiffEntry(path, kind, replace, secret, oldValue, newValue);
    }

    public DiffEntry withSecret(boolean secret) {
        return new DiffEntry(path, kind, replace, secret, oldValue, newValue);
    }
}
