// file: core/src/main/java/io/planbridge/core/diff/ReplaceResolver.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.ValueTree;
import io.planbridge.core.value.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides which diff entries force the resource to be replaced.
 * <p>
 * An entry replaces when either:
 *  - some schema node on its path (the entry's own node included) is ForceNew, or
 *  - the subtree it adds or removes holds a non-null value under a ForceNew descendant.
 *    An UPDATE only replaces through its path, even when the new value is Unknown.
 * <p>
 * The subtree check is computed recursively and OR-ed upwards, so a single ForceNew leaf deep
 * inside an added block is enough. There is no partial replace: the resource-level decision
 * is the OR of all entries (see {@link DiffResult#replace()}).
 */
public final class ReplaceResolver {

    /** Path of the synthetic entry added when a replace is forced without any changed field. */
    public static final PropertyPath META = PropertyPath.of("__meta");

    private ReplaceResolver() {}

    public static List<DiffEntry> resolve(SchemaNode root, List<DiffEntry> entries) {
        var out = new ArrayList<DiffEntry>(entries.size());
        for (DiffEntry e : entries) {
            out.add(e.withReplace(triggersReplace(root, e)));
        }
        return out;
    }

    static boolean triggersReplace(SchemaNode root, DiffEntry e) {
        if (pathForcesNew(root, e.path())) return true;
        SchemaNode at = root.lookup(e.path());
        if (at == null) return false;
        return switch (e.kind()) {
            case ADD -> subtreeForcesNew(at, e.newValue());
            case DELETE -> subtreeForcesNew(at, e.oldValue());
            case UPDATE -> false;
        };
    }

    /** True if any node from the root down to the end of {@code path} is ForceNew. */
    public static boolean pathForcesNew(SchemaNode root, PropertyPath path) {
        SchemaNode cur = root;
        if (cur.isForceNew()) return true;
        for (Object segment : path.segments()) {
            // Singleton wrappers have no segment of their own; their element block is checked here.
            if (cur.isSingleton() && cur.elem().isForceNew()) return true;
            cur = cur.child(segment);
            if (cur == null) return false;
            if (cur.isForceNew()) return true;
        }
        return false;
    }

    /** True if {@code value} holds a non-null value at a ForceNew node of {@code schema}. */
    static boolean subtreeForcesNew(SchemaNode schema, ValueTree value) {
        if (schema == null || value.isNull()) return false;
        if (schema.isForceNew()) return true;
        if (value.isUnknown()) return false;

        switch (schema.kind()) {
            case SCALAR:
                return false;
            case LIST:
            case SET:
                if (schema.isSingleton()) return subtreeForcesNew(schema.elem(), value);
                for (ValueTree element : Values.children(value)) {
                    if (subtreeForcesNew(schema.elem(), element)) return true;
                }
                return false;
            case MAP:
                for (ValueTree element : Values.children(value)) {
                    if (subtreeForcesNew(schema.elem(), element)) return true;
                }
                return false;
            case BLOCK:
                Map<String, ValueTree> fields = Values.entriesOf(value);
                if (fields == null) return false;
                for (var f : fields.entrySet()) {
                    if (subtreeForcesNew(schema.field(f.getKey()), f.getValue())) return true;
                }
                return false;
            default:
                return false;
        }
    }

    /**
     * Apply a caller's override after the schema decision.
     * FORCE adds a synthetic {@link #META} entry when nothing replaces yet, or marks the
     * existing entry at that path; SUPPRESS clears every replace bit.
     */
    public static List<DiffEntry> applyOverride(List<DiffEntry> entries, ReplaceOverride override) {
        switch (override) {
            case FORCE: {
                for (DiffEntry e : entries) {
                    if (e.replace()) return entries;
                }
                var out = new ArrayList<>(entries);
                for (int i = 0; i < out.size(); i++) {
                    if (out.get(i).path().equals(META)) {
                        out.set(i, out.get(i).withReplace(true));
                        return out;
                    }
                }
                out.add(new DiffEntry(META, DiffKind.UPDATE, true, false, ValueTree.nil(), ValueTree.nil()));
                return out;
            }
            case SUPPRESS: {
                var out = new ArrayList<DiffEntry>(entries.size());
                for (DiffEntry e : entries) out.add(e.withReplace(false));
                return out;
            }
            default:
                return entries;
        }
    }
}
