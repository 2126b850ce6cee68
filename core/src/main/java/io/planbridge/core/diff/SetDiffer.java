// file: core/src/main/java/io/planbridge/core/diff/SetDiffer.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;
import io.planbridge.core.value.Values;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * Diff of unordered collections whose elements are identified by content hash.
 * <p>
 * Algorithm:
 *  1) elements whose hash is on both sides are unchanged and produce nothing;
 *  2) the leftovers of each side ("removed" from old, "added" in new) are taken in hash-rank
 *     order;
 *  3) a removed block element that equals an added one once its provider-filled fields left
 *     empty in the new element are ignored is the same element, and the pair is dropped;
 *  4) of what remains, the k-th removed and k-th added element are paired and diffed at synthetic index [k]
 *     (an UPDATE for scalars, field entries for blocks);
 *  5) unpaired added elements are ADD and unpaired removed elements are DELETE at the
 *     synthetic indices that follow.
 * <p>
 * Synthetic indices only exist to give each entry a distinct path; they say nothing about
 * element identity or order. Reordering a set, or repeating one of its elements, changes
 * nothing here because both sides were canonicalized by {@link SetValue}.
 * <p>
 * A side holding elements that are not yet known cannot be matched by hash; see
 * {@link UnknownPropagator#collapse}.
 */
final class SetDiffer {

    private final TreeDiffer parent;

    SetDiffer(TreeDiffer parent) {
        this.parent = parent;
    }

    void diff(PropertyPath path, SchemaNode schema, SetValue old, SetValue neu) {
        if (old.hasUnknownElements() || neu.hasUnknownElements()) {
            UnknownPropagator.collapse(parent, path, old, neu);
            return;
        }

        List<ValueTree> removed = onlyIn(old, neu);
        List<ValueTree> added = onlyIn(neu, old);
        if (removed.isEmpty() && added.isEmpty()) return;

        SchemaNode elem = schema.elem();
        if (elem.isBlock()) dropProviderFilledMatches(elem, removed, added);
        int paired = Math.min(removed.size(), added.size());
        for (int k = 0; k < paired; k++) {
            parent.diffNode(path.index(k), elem, removed.get(k), added.get(k));
        }
        for (int k = paired; k < added.size(); k++) {
            parent.diffNode(path.index(k), elem, ValueTree.nil(), added.get(k));
        }
        for (int k = paired; k < removed.size(); k++) {
            parent.diffNode(path.index(k), elem, removed.get(k), ValueTree.nil());
        }
    }

    /** Removes each removed/added pair that only differs by fields the provider fills in. */
    private static void dropProviderFilledMatches(SchemaNode block, List<ValueTree> removed, List<ValueTree> added) {
        for (Iterator<ValueTree> it = removed.iterator(); it.hasNext(); ) {
            ValueTree old = it.next();
            for (int j = 0; j < added.size(); j++) {
                if (sameIgnoringProviderFilled(block, old, added.get(j))) {
                    added.remove(j);
                    it.remove();
                    break;
                }
            }
        }
    }

    private static boolean sameIgnoringProviderFilled(SchemaNode block, ValueTree old, ValueTree neu) {
        if (!(old instanceof ValueTree.ObjectValue o) || !(neu instanceof ValueTree.ObjectValue n)) {
            return Values.deepEquals(old, neu);
        }
        var names = new TreeSet<String>(o.fields().keySet());
        names.addAll(n.fields().keySet());
        for (String name : names) {
            SchemaNode field = block.field(name);
            ValueTree nv = n.get(name);
            if (UnknownPropagator.leftToProvider(field, nv)) continue;
            ValueTree ov = o.get(name);
            boolean same;
            if (field != null && field.isBlock()) same = sameIgnoringProviderFilled(field, ov, nv);
            else if (field != null && field.isSingleton()) same = sameIgnoringProviderFilled(field.elem(), ov, nv);
            else same = Values.deepEquals(ov, nv);
            if (!same) return false;
        }
        return true;
    }

    /** Elements of {@code a} whose hash is absent from {@code b}, in hash order. */
    private static List<ValueTree> onlyIn(SetValue a, SetValue b) {
        var out = new ArrayList<ValueTree>();
        List<String> hashes = a.hashes();
        List<ValueTree> elements = a.hashedElements();
        for (int i = 0; i < hashes.size(); i++) {
            if (!b.containsHash(hashes.get(i))) out.add(elements.get(i));
        }
        return out;
    }
}
