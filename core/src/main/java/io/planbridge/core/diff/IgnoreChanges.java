// file: core/src/main/java/io/planbridge/core/diff/IgnoreChanges.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.value.ValueTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Masks user-ignored properties before diffing by copying the old value into the new tree.
 * <p>
 * For every path:
 *  - present on both sides: the new value is replaced by the old one;
 *  - present only in new: it is removed;
 *  - present only in old: it is restored in new, growing a shorter new list as needed.
 * A {@code *} segment stands for every list index or object/map key present on either side.
 * Paths that run into a scalar, a set or an unknown value stop there and leave the new tree
 * unchanged below that point.
 */
public final class IgnoreChanges {

    private IgnoreChanges() {}

    /**
     * @param paths property paths in {@link PropertyPath#parse} syntax
     * @throws IllegalArgumentException if a path is malformed
     */
    public static ValueTree apply(ValueTree olds, ValueTree news, List<String> paths) {
        ValueTree out = news;
        for (String text : paths) {
            PropertyPath path = PropertyPath.parse(text);
            if (path.isRoot()) continue;
            out = copy(olds, out, path.segments(), 0);
        }
        return out;
    }

    private static ValueTree copy(ValueTree old, ValueTree neu, List<Object> segments, int i) {
        if (i == segments.size()) return old;
        Object segment = segments.get(i);

        if (segment instanceof Integer index) {
            ValueTree.ListValue nl = asList(old, neu);
            if (nl == null) return neu;
            ValueTree oe = elementAt(old, index);
            ValueTree ne = index < nl.size() ? nl.get(index) : ValueTree.nil();
            return orNil(neu, put(nl, index, copy(oe, ne, segments, i + 1)));
        }

        String name = (String) segment;
        ValueTree.ListValue nl = asList(old, neu);
        if (nl != null) {
            if (!PropertyPath.WILDCARD.equals(name)) return neu;
            int size = Math.max(nl.size(), old instanceof ValueTree.ListValue ol ? ol.size() : 0);
            ValueTree.ListValue out = nl;
            for (int k = 0; k < size; k++) {
                ValueTree ne = k < out.size() ? out.get(k) : ValueTree.nil();
                out = put(out, k, copy(elementAt(old, k), ne, segments, i + 1));
            }
            return orNil(neu, out);
        }

        // Absent new container: rebuild it from the old one so restored fields have a home.
        boolean rebuilt = neu.isNull();
        if (rebuilt) {
            if (old instanceof ValueTree.ObjectValue) neu = ValueTree.object();
            else if (old instanceof ValueTree.MapValue) neu = ValueTree.map(Map.of());
            else return neu;
        }

        if (neu instanceof ValueTree.ObjectValue no) {
            var names = keysFor(name, old, no.fields().keySet());
            ValueTree.ObjectValue out = no;
            for (String n : names) {
                ValueTree nv = copy(child(old, n), no.get(n), segments, i + 1);
                out = nv.isNull() ? out.without(n) : out.with(n, nv);
            }
            return rebuilt && out.fields().isEmpty() ? ValueTree.nil() : out;
        }
        if (neu instanceof ValueTree.MapValue nm) {
            var names = keysFor(name, old, nm.entries().keySet());
            ValueTree.MapValue out = nm;
            for (String n : names) {
                ValueTree nv = copy(child(old, n), nm.get(n), segments, i + 1);
                out = nv.isNull() ? out.without(n) : out.with(n, nv);
            }
            return rebuilt && out.entries().isEmpty() ? ValueTree.nil() : out;
        }
        return neu;
    }

    /** The new list to edit; an absent new list is rebuilt when the old side has one. */
    private static ValueTree.ListValue asList(ValueTree old, ValueTree neu) {
        if (neu instanceof ValueTree.ListValue nl) return nl;
        if (neu.isNull() && old instanceof ValueTree.ListValue) return ValueTree.list();
        return null;
    }

    private static ValueTree orNil(ValueTree neu, ValueTree.ListValue rebuilt) {
        return neu.isNull() && rebuilt.size() == 0 ? ValueTree.nil() : rebuilt;
    }

    private static ValueTree elementAt(ValueTree v, int index) {
        return v instanceof ValueTree.ListValue l && index < l.size() ? l.get(index) : ValueTree.nil();
    }

    /** Sets {@code index}, growing the list with nulls when an old-only position is restored. */
    private static ValueTree.ListValue put(ValueTree.ListValue list, int index, ValueTree value) {
        if (index < list.size()) return list.with(index, value);
        if (value.isNull()) return list;
        var grown = new ArrayList<>(list.elements());
        while (grown.size() < index) grown.add(ValueTree.nil());
        grown.add(value);
        return new ValueTree.ListValue(grown, list.secret());
    }

    private static TreeSet<String> keysFor(String segment, ValueTree old, Set<String> newKeys) {
        var names = new TreeSet<String>();
        if (!PropertyPath.WILDCARD.equals(segment)) {
            names.add(segment);
            return names;
        }
        names.addAll(newKeys);
        if (old instanceof ValueTree.ObjectValue oo) names.addAll(oo.fields().keySet());
        if (old instanceof ValueTree.MapValue om) names.addAll(om.entries().keySet());
        return names;
    }

    private static ValueTree child(ValueTree v, String name) {
        if (v instanceof ValueTree.ObjectValue o) return o.get(name);
        if (v instanceof ValueTree.MapValue m) return m.get(name);
        return ValueTree.nil();
    }
}
