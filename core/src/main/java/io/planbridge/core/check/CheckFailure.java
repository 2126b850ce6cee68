// file: core/src/main/java/io/planbridge/core/check/CheckFailure.java
package io.planbridge.core.check;

import java.util.Objects;

/**
 * A validation problem tied to one property.
 *
 * @param property path text of the offending property, empty for the whole resource
 * @param reason   human-readable message
 */
public record CheckFailure(String property, String reason) {
    public CheckFailure {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(reason, "reason");
    }
}
