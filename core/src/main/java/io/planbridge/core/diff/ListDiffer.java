// file: core/src/main/java/io/planbridge/core/diff/ListDiffer.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.ValueTree;
import io.planbridge.core.value.Values;

/**
 * Positional diff of ordered collections.
 * <p>
 * Steps:
 *  1) skip the equal leading run;
 *  2) when both lists have the same length, also skip the equal trailing run
 *     (with different lengths the tails are not aligned by position and are kept);
 *  3) compare the remaining window index by index, recursing into each pair;
 *  4) extra positions on the longer side become ADD (new longer) or DELETE (old longer).
 * <p>
 * This is not an edit-distance diff: inserting at the front of a list shows up as an UPDATE
 * at every shifted position plus an ADD at the end. Indices in the result always mean the
 * same position in both lists.
 */
final class ListDiffer {

    private final TreeDiffer parent;

    ListDiffer(TreeDiffer parent) {
        this.parent = parent;
    }

    void diff(PropertyPath path, SchemaNode schema, ValueTree.ListValue old, ValueTree.ListValue neu) {
        int oldLen = old.size();
        int newLen = neu.size();

        int start = 0;
        int common = Math.min(oldLen, newLen);
        while (start < common && Values.deepEquals(old.get(start), neu.get(start))) start++;

        int oldEnd = oldLen;
        int newEnd = newLen;
        if (oldLen == newLen) {
            while (oldEnd > start && Values.deepEquals(old.get(oldEnd - 1), neu.get(newEnd - 1))) {
                oldEnd--;
                newEnd--;
            }
        }

        int overlap = Math.min(oldEnd, newEnd);
        SchemaNode elem = schema.elem();
        for (int i = start; i < overlap; i++) {
            parent.diffNode(path.index(i), elem, old.get(i), neu.get(i));
        }
        for (int i = overlap; i < newEnd; i++) {
            parent.diffNode(path.index(i), elem, ValueTree.nil(), neu.get(i));
        }
        for (int i = overlap; i < oldEnd; i++) {
            parent.diffNode(path.index(i), elem, old.get(i), ValueTree.nil());
        }
    }
}
