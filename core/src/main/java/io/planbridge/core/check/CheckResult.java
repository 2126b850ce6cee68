// file: core/src/main/java/io/planbridge/core/check/CheckResult.java
package io.planbridge.core.check;

import io.planbridge.core.value.ValueTree;

import java.util.List;

/**
 * Outcome of {@link InputChecker#check}.
 *
 * @param inputs   the inputs to carry forward, with dropped fields removed
 * @param failures problems the user must fix; empty when the inputs are valid
 */
public record CheckResult(ValueTree inputs, List<CheckFailure> failures) {
    public CheckResult {
        failures = List.copyOf(failures);
    }

    public boolean ok() { return failures.isEmpty(); }
}
