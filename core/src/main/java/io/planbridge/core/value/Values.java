// file: core/src/main/java/io/planbridge/core/value/Values.java
package io.planbridge.core.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Structural helpers over {@link ValueTree}.
 * <p>
 * Equality rule ({@link #deepEquals}):
 *  - the secret bit is ignored everywhere;
 *  - scalars compare by value;
 *  - lists compare element-wise in order;
 *  - sets compare by their hash sets, plus their unknown elements;
 *  - maps and objects compare key-wise, a missing key equals an explicit Null;
 *  - Unknown equals Unknown.
 */
public final class Values {

    private Values() {}

    public static boolean deepEquals(ValueTree a, ValueTree b) {
        if (a == b) return true;
        if (a instanceof ValueTree.Null) return b instanceof ValueTree.Null;
        if (a instanceof ValueTree.Unknown) return b instanceof ValueTree.Unknown;
        if (a instanceof ValueTree.Scalar x) {
            return b instanceof ValueTree.Scalar y && x.value().equals(y.value());
        }
        if (a instanceof ValueTree.ListValue x) {
            if (!(b instanceof ValueTree.ListValue y) || x.size() != y.size()) return false;
            for (int i = 0; i < x.size(); i++) {
                if (!deepEquals(x.get(i), y.get(i))) return false;
            }
            return true;
        }
        if (a instanceof SetValue x) {
            if (!(b instanceof SetValue y)) return false;
            if (!x.hashes().equals(y.hashes())) return false;
            List<ValueTree> xu = x.unhashedElements();
            List<ValueTree> yu = y.unhashedElements();
            if (xu.size() != yu.size()) return false;
            for (int i = 0; i < xu.size(); i++) {
                if (!deepEquals(xu.get(i), yu.get(i))) return false;
            }
            return true;
        }
        if (a instanceof ValueTree.MapValue x) {
            return b instanceof ValueTree.MapValue y && entriesEqual(x.entries(), y.entries());
        }
        if (a instanceof ValueTree.ObjectValue x) {
            return b instanceof ValueTree.ObjectValue y && entriesEqual(x.fields(), y.fields());
        }
        return false;
    }

    private static boolean entriesEqual(Map<String, ValueTree> x, Map<String, ValueTree> y) {
        var keys = new TreeSet<>(x.keySet());
        keys.addAll(y.keySet());
        for (String k : keys) {
            ValueTree xv = x.getOrDefault(k, ValueTree.nil());
            ValueTree yv = y.getOrDefault(k, ValueTree.nil());
            if (!deepEquals(xv, yv)) return false;
        }
        return true;
    }

    /** True if the value is Unknown or holds an Unknown anywhere below it. */
    public static boolean containsUnknowns(ValueTree v) {
        if (v instanceof ValueTree.Unknown) return true;
        for (ValueTree child : children(v)) {
            if (containsUnknowns(child)) return true;
        }
        return false;
    }

    /** True if the value or anything below it carries the secret bit. */
    public static boolean containsSecrets(ValueTree v) {
        if (v.secret()) return true;
        for (ValueTree child : children(v)) {
            if (containsSecrets(child)) return true;
        }
        return false;
    }

    /** Copy of the value with every secret bit cleared. */
    public static ValueTree stripSecrets(ValueTree v) {
        if (v instanceof ValueTree.ListValue l) {
            var out = new ArrayList<ValueTree>(l.size());
            for (ValueTree e : l.elements()) out.add(stripSecrets(e));
            return new ValueTree.ListValue(out, false);
        }
        if (v instanceof SetValue s) {
            var out = new ArrayList<ValueTree>(s.size());
            for (ValueTree e : s.elements()) out.add(stripSecrets(e));
            return SetValue.of(out, false);
        }
        if (v instanceof ValueTree.MapValue m) {
            return new ValueTree.MapValue(stripAll(m.entries()), false);
        }
        if (v instanceof ValueTree.ObjectValue o) {
            return new ValueTree.ObjectValue(stripAll(o.fields()), false);
        }
        return v.secret() ? v.withSecret(false) : v;
    }

    private static Map<String, ValueTree> stripAll(Map<String, ValueTree> in) {
        var out = new LinkedHashMap<String, ValueTree>();
        in.forEach((k, v) -> out.put(k, stripSecrets(v)));
        return out;
    }

    /** Direct children of a collection or object; empty for leaves. */
    public static List<ValueTree> children(ValueTree v) {
        if (v instanceof ValueTree.ListValue l) return l.elements();
        if (v instanceof SetValue s) return s.elements();
        if (v instanceof ValueTree.MapValue m) return List.copyOf(m.entries().values());
        if (v instanceof ValueTree.ObjectValue o) return List.copyOf(o.fields().values());
        return List.of();
    }

    /** Entries of a map or object value, or null for any other variant. */
    public static Map<String, ValueTree> entriesOf(ValueTree v) {
        if (v instanceof ValueTree.MapValue m) return m.entries();
        if (v instanceof ValueTree.ObjectValue o) return o.fields();
        return null;
    }
}
