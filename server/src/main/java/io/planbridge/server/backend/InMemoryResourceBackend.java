// file: server/src/main/java/io/planbridge/server/backend/InMemoryResourceBackend.java
package io.planbridge.server.backend;

import io.planbridge.core.check.CheckFailure;
import io.planbridge.core.schema.ScalarType;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.ValueTree;
import io.planbridge.server.Urn;
import io.planbridge.server.schema.SchemaRegistry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Backend that keeps resources in memory, for local runs and tests.
 * <p>
 * Behavior:
 *  - outputs echo the inputs;
 *  - ids are {@code <name>-<n>} with a process-wide counter;
 *  - top-level computed string fields the inputs leave out are filled with
 *    {@code <id>-<field>}, or Unknown in preview mode;
 *  - validation accepts everything;
 *  - delete forgets the resource, later reads return null.
 */
public final class InMemoryResourceBackend implements ResourceBackend {

    private static final Logger log = Logger.getLogger(InMemoryResourceBackend.class.getName());

    private final SchemaRegistry schemas;
    private final Map<String, ValueTree> resources = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public InMemoryResourceBackend(SchemaRegistry schemas) {
        this.schemas = schemas;
    }

    @Override
    public List<CheckFailure> validate(Urn urn, ValueTree inputs) {
        return List.of();
    }

    @Override
    public Created create(Urn urn, ValueTree inputs, boolean preview) {
        if (preview) {
            return new Created("", fillComputed(urn, inputs, null));
        }
        String id = urn.name() + "-" + nextId.getAndIncrement();
        ValueTree outputs = fillComputed(urn, inputs, id);
        resources.put(id, outputs);
        log.fine(() -> "created " + urn + " as " + id);
        return new Created(id, outputs);
    }

    @Override
    public ValueTree update(String id, Urn urn, ValueTree olds, ValueTree news, boolean preview) {
        if (!preview && !resources.containsKey(id)) {
            throw new IllegalArgumentException("no such resource " + id);
        }
        ValueTree outputs = fillComputed(urn, news, preview ? null : id);
        if (!preview) resources.put(id, outputs);
        return outputs;
    }

    @Override
    public ValueTree read(String id, Urn urn) {
        return resources.get(id);
    }

    @Override
    public void delete(String id, Urn urn) {
        if (resources.remove(id) == null) {
            throw new IllegalArgumentException("no such resource " + id);
        }
        log.fine(() -> "deleted " + urn + " (" + id + ")");
    }

    int size() {
        return resources.size();
    }

    private ValueTree fillComputed(Urn urn, ValueTree inputs, String id) {
        var out = inputs.isNull() ? ValueTree.object() : (ValueTree.ObjectValue) inputs;
        for (var f : schemas.get(urn.type()).root().fields().entrySet()) {
            SchemaNode field = f.getValue();
            if (!field.isProviderFilled() || field.scalarType() != ScalarType.STRING) continue;
            if (out.get(f.getKey()).isPresent()) continue;
            ValueTree filled = id == null ? ValueTree.unknown() : ValueTree.of(id + "-" + f.getKey());
            out = out.with(f.getKey(), filled);
        }
        return out;
    }
}
