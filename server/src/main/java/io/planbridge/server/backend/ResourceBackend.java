// file: server/src/main/java/io/planbridge/server/backend/ResourceBackend.java
package io.planbridge.server.backend;

import io.planbridge.core.check.CheckFailure;
import io.planbridge.core.value.ValueTree;
import io.planbridge.server.Urn;

import java.util.List;

/**
 * The provider that actually owns resources. The bridge calls it for validation and to apply
 * changes; diffs never reach it.
 * <p>
 * Implementations must be safe for concurrent calls on different resources. Calls on the same
 * resource are serialized by the deployment engine.
 */
public interface ResourceBackend {

    /** Field-level problems with the proposed inputs; empty when they are acceptable. */
    List<CheckFailure> validate(Urn urn, ValueTree inputs);

    /**
     * Create the resource. In preview mode nothing is created and values the provider would
     * compute come back Unknown.
     */
    Created create(Urn urn, ValueTree inputs, boolean preview);

    /** Apply new inputs to an existing resource and return its outputs. */
    ValueTree update(String id, Urn urn, ValueTree olds, ValueTree news, boolean preview);

    /** Current outputs of the resource, or null when it no longer exists. */
    ValueTree read(String id, Urn urn);

    /**
     * Delete the resource.
     *
     * @throws IllegalArgumentException if no resource has this id
     */
    void delete(String id, Urn urn);

    record Created(String id, ValueTree outputs) {}
}
