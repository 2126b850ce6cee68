// file: core/src/main/java/io/planbridge/core/diff/DiffOptions.java
package io.planbridge.core.diff;

import java.util.List;
import java.util.Objects;

/**
 * Per-call knobs of {@link DiffEngine}.
 *
 * @param ignoreChanges   property paths whose changes are masked before diffing
 * @param replaceOverride caller override of the replace decision
 */
public record DiffOptions(List<String> ignoreChanges, ReplaceOverride replaceOverride) {

    private static final DiffOptions DEFAULTS = new DiffOptions(List.of(), ReplaceOverride.NONE);

    public DiffOptions {
        ignoreChanges = List.copyOf(ignoreChanges == null ? List.of() : ignoreChanges);
        replaceOverride = Objects.requireNonNullElse(replaceOverride, ReplaceOverride.NONE);
    }

    public static DiffOptions defaults() { return DEFAULTS; }

    public DiffOptions withIgnoreChanges(List<String> paths) {
        return new DiffOptions(paths, replaceOverride);
    }

    public DiffOptions withReplaceOverride(ReplaceOverride override) {
        return new DiffOptions(ignoreChanges, override);
    }
}
