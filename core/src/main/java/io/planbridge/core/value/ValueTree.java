// file: core/src/main/java/io/planbridge/core/value/ValueTree.java
package io.planbridge.core.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Concrete value of a resource's inputs or state.
 * <p>
 * Variants:
 *  - Null:        absent value.
 *  - Unknown:     value not known until the provider applies the change.
 *  - Scalar:      string, number (BigDecimal) or boolean.
 *  - ListValue:   ordered elements.
 *  - SetValue:    elements identified by content hash (see {@link SetValue}).
 *  - MapValue:    string keys to values, keys sorted.
 *  - ObjectValue: field names to values, names sorted.
 * <p>
 * Every node carries a {@code secret} bit. Structural equality used by the differs lives in
 * {@link Values#deepEquals(ValueTree, ValueTree)} and ignores that bit; record equality does not.
 * All variants are immutable.
 */
public sealed interface ValueTree
        permits ValueTree.Null, ValueTree.Unknown, ValueTree.Scalar,
                ValueTree.ListValue, SetValue, ValueTree.MapValue, ValueTree.ObjectValue {

    boolean secret();

    /** Same value with the secret bit set to {@code secret}. Children are unchanged. */
    ValueTree withSecret(boolean secret);

    default boolean isNull() { return this instanceof Null; }

    default boolean isUnknown() { return this instanceof Unknown; }

    /** Not Null. Unknown counts as present. */
    default boolean isPresent() { return !(this instanceof Null); }

    /** Short variant name, used in error messages. */
    default String typeName() {
        if (this instanceof Null) return "null";
        if (this instanceof Unknown) return "unknown";
        if (this instanceof Scalar s) return s.value() instanceof String ? "string"
                : s.value() instanceof Boolean ? "bool" : "number";
        if (this instanceof ListValue) return "list";
        if (this instanceof SetValue) return "set";
        if (this instanceof MapValue) return "map";
        return "object";
    }

    // ---------- factories ----------

    static Null nil() { return Null.PLAIN; }

    static Unknown unknown() { return Unknown.PLAIN; }

    static Scalar of(String s) { return new Scalar(s, false); }

    static Scalar of(boolean b) { return new Scalar(b, false); }

    static Scalar of(long n) { return new Scalar(BigDecimal.valueOf(n), false); }

    static Scalar of(double n) { return new Scalar(BigDecimal.valueOf(n), false); }

    static Scalar of(BigDecimal n) { return new Scalar(n, false); }

    static ListValue list(ValueTree... elements) { return new ListValue(List.of(elements), false); }

    static ListValue list(List<? extends ValueTree> elements) { return new ListValue(List.<ValueTree>copyOf(elements), false); }

    static SetValue set(ValueTree... elements) { return SetValue.of(List.of(elements)); }

    static SetValue set(List<? extends ValueTree> elements) { return SetValue.of(elements); }

    static MapValue map(Map<String, ? extends ValueTree> entries) { return new MapValue(Map.<String, ValueTree>copyOf(entries), false); }

    static ObjectValue object(Map<String, ? extends ValueTree> fields) { return new ObjectValue(Map.<String, ValueTree>copyOf(fields), false); }

    /** Object from alternating name/value arguments: {@code object("a", of(1), "b", of("x"))}. */
    static ObjectValue object(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) throw new IllegalArgumentException("expected name/value pairs");
        var fields = new LinkedHashMap<String, ValueTree>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            fields.put((String) namesAndValues[i], (ValueTree) namesAndValues[i + 1]);
        }
        return new ObjectValue(fields, false);
    }

    /** Wrap a value as secret, the equivalent of a user's "mark as secret" call. */
    static ValueTree secret(ValueTree value) { return value.withSecret(true); }

    // ---------- variants ----------

    record Null(boolean secret) implements ValueTree {
        static final Null PLAIN = new Null(false);

        @Override public Null withSecret(boolean secret) { return new Null(secret); }
    }

    record Unknown(boolean secret) implements ValueTree {
        static final Unknown PLAIN = new Unknown(false);

        @Override public Unknown withSecret(boolean secret) { return new Unknown(secret); }
    }

    /**
     * Primitive leaf. {@code value} is a String, Boolean or BigDecimal; numbers are stored
     * without trailing zeros so that 1.0 and 1 compare equal.
     */
    record Scalar(Object value, boolean secret) implements ValueTree {
        public Scalar {
            Objects.requireNonNull(value, "value");
            if (value instanceof BigDecimal d) {
                value = d.signum() == 0 ? BigDecimal.ZERO : d.stripTrailingZeros();
            } else if (value instanceof Number n) {
                value = new BigDecimal(n.toString()).stripTrailingZeros();
            } else if (!(value instanceof String) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException("unsupported scalar " + value.getClass().getName());
            }
        }

        @Override public Scalar withSecret(boolean secret) { return new Scalar(value, secret); }
    }

    record ListValue(List<ValueTree> elements, boolean secret) implements ValueTree {
        public ListValue {
            elements = List.copyOf(elements);
        }

        public int size() { return elements.size(); }

        public ValueTree get(int i) { return elements.get(i); }

        /** Copy with element {@code i} replaced. */
        public ListValue with(int i, ValueTree value) {
            var copy = new ArrayList<>(elements);
            copy.set(i, value);
            return new ListValue(copy, secret);
        }

        @Override public ListValue withSecret(boolean secret) { return new ListValue(elements, secret); }
    }

    record MapValue(Map<String, ValueTree> entries, boolean secret) implements ValueTree {
        public MapValue {
            entries = Collections.unmodifiableMap(new TreeMap<>(entries));
        }

        /** Entry value, or Null when the key is missing. */
        public ValueTree get(String key) { return entries.getOrDefault(key, nil()); }

        public MapValue with(String key, ValueTree value) {
            var copy = new TreeMap<>(entries);
            copy.put(key, value);
            return new MapValue(copy, secret);
        }

        public MapValue without(String key) {
            var copy = new TreeMap<>(entries);
            copy.remove(key);
            return new MapValue(copy, secret);
        }

        @Override public MapValue withSecret(boolean secret) { return new MapValue(entries, secret); }
    }

    record ObjectValue(Map<String, ValueTree> fields, boolean secret) implements ValueTree {
        public ObjectValue {
            fields = Collections.unmodifiableMap(new TreeMap<>(fields));
        }

        /** Field value, or Null when the field is missing. */
        public ValueTree get(String name) { return fields.getOrDefault(name, nil()); }

        public ObjectValue with(String name, ValueTree value) {
            var copy = new TreeMap<>(fields);
            copy.put(name, value);
            return new ObjectValue(copy, secret);
        }

        public ObjectValue without(String name) {
            var copy = new TreeMap<>(fields);
            copy.remove(name);
            return new ObjectValue(copy, secret);
        }

        @Override public ObjectValue withSecret(boolean secret) { return new ObjectValue(fields, secret); }
    }
}
