// file: core/src/main/java/io/planbridge/core/diff/ReplaceOverride.java
package io.planbridge.core.diff;

/**
 * Caller override of the computed replace decision.
 *  - NONE:     keep the computed decision.
 *  - FORCE:    the resource must be replaced even if no entry says so.
 *  - SUPPRESS: no entry may force a replace.
 */
public enum ReplaceOverride {
    NONE,
    FORCE,
    SUPPRESS
}
