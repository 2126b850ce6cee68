// file: core/src/main/java/io/planbridge/core/diff/MapDiffer.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.ValueTree;

import java.util.TreeSet;

/**
 * Key-wise diff of string-keyed maps.
 * Keys only in new are ADD, keys only in old are DELETE, keys on both sides recurse into the
 * element schema, equal values are skipped. Keys are visited in sorted order.
 */
final class MapDiffer {

    private final TreeDiffer parent;

    MapDiffer(TreeDiffer parent) {
        this.parent = parent;
    }

    void diff(PropertyPath path, SchemaNode schema, ValueTree.MapValue old, ValueTree.MapValue neu) {
        var keys = new TreeSet<>(old.entries().keySet());
        keys.addAll(neu.entries().keySet());
        for (String key : keys) {
            parent.diffNode(path.name(key), schema.elem(), old.get(key), neu.get(key));
        }
    }
}
