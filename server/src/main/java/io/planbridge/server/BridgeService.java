// file: server/src/main/java/io/planbridge/server/BridgeService.java
package io.planbridge.server;

import io.planbridge.core.check.CheckResult;
import io.planbridge.core.check.InputChecker;
import io.planbridge.core.diff.DiffEngine;
import io.planbridge.core.diff.DiffOptions;
import io.planbridge.core.diff.DiffResult;
import io.planbridge.core.render.Colorization;
import io.planbridge.core.render.DiffRenderer;
import io.planbridge.core.render.ResourceChange;
import io.planbridge.core.schema.ResourceSchema;
import io.planbridge.core.secret.SecretPropagator;
import io.planbridge.core.value.ValueTree;
import io.planbridge.server.backend.ResourceBackend;
import io.planbridge.server.schema.SchemaRegistry;

import java.util.List;

/**
 * Resource operations of the bridge, independent of any transport.
 * <p>
 * Responsibilities:
 *  - Resolve the resource schema from the urn type.
 *  - Run input checks, detailed diffs and previews through the core engine.
 *  - Forward create, update, read and delete to the {@link ResourceBackend} and mark secret
 *    outputs.
 * <p>
 * Stateless apart from its collaborators; safe for concurrent use.
 */
public final class BridgeService {

    private final SchemaRegistry schemas;
    private final ResourceBackend backend;
    private final Colorization color;

    public BridgeService(SchemaRegistry schemas, ResourceBackend backend, Colorization color) {
        this.schemas = schemas;
        this.backend = backend;
        this.color = color;
    }

    /** Everything the engine needs to know about one resource's pending change. */
    public record Planned(
            DiffResult result,
            List<String> stables,
            boolean deleteBeforeReplace,
            String preview
    ) {}

    public CheckResult check(Urn urn, ValueTree olds, ValueTree news) {
        ResourceSchema schema = schemas.get(urn.type());
        return InputChecker.check(schema, news, backend.validate(urn, news));
    }

    public Planned diff(Urn urn, ValueTree olds, ValueTree news, DiffOptions options) {
        ResourceSchema schema = schemas.get(urn.type());
        DiffResult result = DiffEngine.diff(schema, olds, news, options);
        var change = ResourceChange.of(urn.type(), urn.name(), olds.isPresent(), result);
        return new Planned(
                result,
                DiffEngine.stables(schema, result),
                result.replace() && schema.deleteBeforeReplace(),
                DiffRenderer.renderResource(change, color)
        );
    }

    public ResourceBackend.Created create(Urn urn, ValueTree inputs, boolean preview) {
        ResourceSchema schema = schemas.get(urn.type());
        ResourceBackend.Created created = backend.create(urn, inputs, preview);
        ValueTree outputs = SecretPropagator.markOutputs(schema.root(), inputs, ValueTree.nil(), created.outputs());
        return new ResourceBackend.Created(created.id(), outputs);
    }

    public ValueTree update(String id, Urn urn, ValueTree olds, ValueTree news, boolean preview) {
        ResourceSchema schema = schemas.get(urn.type());
        ValueTree outputs = backend.update(id, urn, olds, news, preview);
        return SecretPropagator.markOutputs(schema.root(), news, olds, outputs);
    }

    /** Refreshed state of one resource; a null id means it is gone. */
    public record Read(String id, ValueTree outputs, ValueTree inputs) {}

    /**
     * Current outputs from the backend, with the inputs that would produce them.
     * Prior outputs and inputs only carry secret bits over to the result.
     */
    public Read read(String id, Urn urn, ValueTree priorOutputs, ValueTree priorInputs) {
        ResourceSchema schema = schemas.get(urn.type());
        ValueTree current = backend.read(id, urn);
        if (current == null) return new Read(null, ValueTree.nil(), ValueTree.nil());
        ValueTree outputs = SecretPropagator.markOutputs(schema.root(), priorInputs, priorOutputs, current);
        return new Read(id, outputs, InputChecker.extractInputs(schema, outputs));
    }

    /** Delete through the backend and return the rendered delete step. */
    public String delete(String id, Urn urn) {
        schemas.get(urn.type()); // rejects unknown types
        backend.delete(id, urn);
        return DiffRenderer.renderResource(ResourceChange.delete(urn.type(), urn.name()), color);
    }

    public Colorization color() { return color; }
}
