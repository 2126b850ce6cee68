// file: core/src/main/java/io/planbridge/core/value/SetValue.java
package io.planbridge.core.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Unordered collection whose elements are identified by content hash.
 * <p>
 * Construction:
 *  - every known element is hashed with {@link ValueHasher};
 *  - elements with an equal hash collapse to one (a secret duplicate keeps the secret bit);
 *  - known elements are kept in ascending hash order, the "hash rank";
 *  - elements that are or contain Unknown cannot be hashed and are kept, in input order,
 *    after the hashed ones.
 * <p>
 * Because of the canonical order two sets built from permutations of the same elements are
 * indistinguishable.
 */
public final class SetValue implements ValueTree {

    private final List<ValueTree> hashed;   // hash order
    private final List<String> hashes;      // parallel to hashed
    private final List<ValueTree> unhashed; // contain unknowns, input order
    private final boolean secret;

    private SetValue(List<ValueTree> hashed, List<String> hashes, List<ValueTree> unhashed, boolean secret) {
        this.hashed = hashed;
        this.hashes = hashes;
        this.unhashed = unhashed;
        this.secret = secret;
    }

    public static SetValue of(List<? extends ValueTree> elements) {
        return of(elements, false);
    }

    public static SetValue of(List<? extends ValueTree> elements, boolean secret) {
        Objects.requireNonNull(elements, "elements");
        var byHash = new TreeMap<String, ValueTree>();
        var unhashed = new ArrayList<ValueTree>();
        for (ValueTree e : elements) {
            Objects.requireNonNull(e, "element");
            if (Values.containsUnknowns(e)) {
                unhashed.add(e);
                continue;
            }
            String h = ValueHasher.hashHex(e);
            ValueTree prev = byHash.get(h);
            if (prev == null || (!prev.secret() && e.secret())) {
                byHash.put(h, e);
            }
        }
        return new SetValue(
                List.copyOf(byHash.values()),
                List.copyOf(byHash.keySet()),
                Collections.unmodifiableList(unhashed),
                secret
        );
    }

    /** All elements: hashed ones in hash order, then unhashed ones. */
    public List<ValueTree> elements() {
        if (unhashed.isEmpty()) return hashed;
        var all = new ArrayList<ValueTree>(hashed.size() + unhashed.size());
        all.addAll(hashed);
        all.addAll(unhashed);
        return Collections.unmodifiableList(all);
    }

    /** Known elements in hash order. */
    public List<ValueTree> hashedElements() { return hashed; }

    /** Hex hashes of {@link #hashedElements()}, same order. */
    public List<String> hashes() { return hashes; }

    public List<ValueTree> unhashedElements() { return unhashed; }

    public boolean hasUnknownElements() { return !unhashed.isEmpty(); }

    public int size() { return hashed.size() + unhashed.size(); }

    public boolean isEmpty() { return size() == 0; }

    public boolean containsHash(String hash) {
        return Collections.binarySearch(hashes, hash) >= 0;
    }

    @Override public boolean secret() { return secret; }

    @Override public SetValue withSecret(boolean secret) {
        return new SetValue(hashed, hashes, unhashed, secret);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetValue s)) return false;
        return secret == s.secret && hashed.equals(s.hashed) && unhashed.equals(s.unhashed);
    }

    @Override public int hashCode() { return Objects.hash(hashed, unhashed, secret); }

    @Override public String toString() { return "SetValue[elements=" + elements() + ", secret=" + secret + "]"; }
}
