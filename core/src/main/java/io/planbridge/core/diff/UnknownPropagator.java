// file: core/src/main/java/io/planbridge/core/diff/UnknownPropagator.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;

/**
 * Rules for values that are not known yet and for values the provider fills in.
 * <p>
 * Unknown:
 *  - a new Unknown against an old Null is an ADD;
 *  - a new Unknown against any old present value is an UPDATE, never a DELETE;
 *  - a whole collection or object that becomes Unknown is one entry at its own path, the
 *    walk does not descend into it;
 *  - a set holding not-yet-known elements cannot be matched by hash and is reported as one
 *    entry at the set's path.
 * <p>
 * Computed:
 *  - a computed, not required field that is absent (Null) from the new configuration is
 *    left to the provider and produces no entry, ForceNew or not.
 */
final class UnknownPropagator {

    private UnknownPropagator() {}

    /**
     * Record the entry for a node where either side is Unknown.
     *
     * @return true if the node was handled and the walk must not descend
     */
    static boolean handle(TreeDiffer differ, PropertyPath path, ValueTree old, ValueTree neu) {
        if (neu.isUnknown()) {
            if (old.isUnknown()) return true;
            differ.record(path, old.isNull() ? DiffKind.ADD : DiffKind.UPDATE, old, neu);
            return true;
        }
        if (old.isUnknown()) {
            differ.record(path, neu.isNull() ? DiffKind.DELETE : DiffKind.UPDATE, old, neu);
            return true;
        }
        return false;
    }

    /** Single entry for a set whose elements cannot all be hashed. */
    static void collapse(TreeDiffer differ, PropertyPath path, SetValue old, SetValue neu) {
        differ.record(path, old.isEmpty() ? DiffKind.ADD : DiffKind.UPDATE, old, neu);
    }

    /** True if the field is provider-filled and the user left it out. */
    static boolean leftToProvider(SchemaNode field, ValueTree neu) {
        return field != null && field.isProviderFilled() && neu.isNull();
    }
}
