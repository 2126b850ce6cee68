// file: core/src/main/java/io/planbridge/core/diff/DiffEngine.java
package io.planbridge.core.diff;

import io.planbridge.core.schema.ResourceSchema;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.secret.SecretPropagator;
import io.planbridge.core.value.ValueTree;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the detailed diff for one resource.
 * <p>
 * Pipeline:
 *  1) shape both value trees after the schema ({@link SchemaConformer});
 *  2) mask ignored properties ({@link IgnoreChanges});
 *  3) walk the trees ({@link TreeDiffer});
 *  4) decide replacement ({@link ReplaceResolver}), then apply the caller's override;
 *  5) mark secret entries ({@link SecretPropagator}).
 * <p>
 * Pure and stateless: the same inputs always give the same result, and concurrent calls need
 * no coordination. Failures are {@link DiffException}s scoped to this resource.
 */
public final class DiffEngine {

    private DiffEngine() {}

    public static DiffResult diff(ResourceSchema schema, ValueTree olds, ValueTree news) {
        return diff(schema, olds, news, DiffOptions.defaults());
    }

    public static DiffResult diff(ResourceSchema schema, ValueTree olds, ValueTree news, DiffOptions options) {
        SchemaNode root = schema.root();
        ValueTree o = SchemaConformer.conform(root, olds);
        ValueTree n = SchemaConformer.conform(root, news);
        if (!options.ignoreChanges().isEmpty()) {
            n = IgnoreChanges.apply(o, n, options.ignoreChanges());
        }

        List<DiffEntry> entries = TreeDiffer.diff(root, o, n);
        entries = ReplaceResolver.resolve(root, entries);
        entries = ReplaceResolver.applyOverride(entries, options.replaceOverride());
        entries = SecretPropagator.annotate(root, o, n, entries);
        return new DiffResult(entries);
    }

    /**
     * Top-level ForceNew properties whose value did not change.
     * Tells the engine which properties stay stable across a replace.
     */
    public static List<String> stables(ResourceSchema schema, DiffResult result) {
        var changed = result.changedProperties();
        return schema.root().fields().entrySet().stream()
                .filter(f -> f.getValue().isForceNew())
                .map(Map.Entry::getKey)
                .filter(name -> !changed.contains(name))
                .sorted()
                .toList();
    }
}
