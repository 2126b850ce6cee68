// file: core/src/main/java/io/planbridge/core/value/ValueHasher.java
package io.planbridge.core.value;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic structural hash of a value tree.
 * <p>
 * Each node is hashed as SHA-256 over a one-byte tag followed by its content:
 *  - 'n' null
 *  - 's' string, 'd' number (plain decimal text), 'b' boolean
 *  - 'l' list:   count, then child hashes in order
 *  - 'S' set:    count, then child hashes in sorted order (permutation independent)
 *  - 'm' map / 'o' object: count, then (key, child hash) pairs in key order;
 *                entries holding Null are skipped so "missing" and "null" hash alike
 * <p>
 * The secret bit is not part of the hash. Unknown values have no hash; hashing a tree
 * that contains one throws {@link UnhashableValueException}.
 */
public final class ValueHasher {

    private ValueHasher() {}

    /** Hash as lowercase hex; hex order is the "hash rank" used by set diffs. */
    public static String hashHex(ValueTree value) {
        return hex(hash(value));
    }

    public static byte[] hash(ValueTree value) {
        MessageDigest md = newDigest();
        if (value instanceof ValueTree.Null) {
            md.update((byte) 'n');
        } else if (value instanceof ValueTree.Unknown) {
            throw new UnhashableValueException("unknown values have no content hash");
        } else if (value instanceof ValueTree.Scalar s) {
            Object v = s.value();
            if (v instanceof String str) {
                md.update((byte) 's');
                putBytes(md, str.getBytes(StandardCharsets.UTF_8));
            } else if (v instanceof Boolean b) {
                md.update((byte) 'b');
                md.update((byte) (b ? 1 : 0));
            } else {
                md.update((byte) 'd');
                putBytes(md, ((BigDecimal) v).toPlainString().getBytes(StandardCharsets.UTF_8));
            }
        } else if (value instanceof ValueTree.ListValue l) {
            md.update((byte) 'l');
            md.update(intLE(l.size()));
            for (ValueTree e : l.elements()) md.update(hash(e));
        } else if (value instanceof SetValue set) {
            if (set.hasUnknownElements()) {
                throw new UnhashableValueException("set with unknown elements has no content hash");
            }
            md.update((byte) 'S');
            md.update(intLE(set.size()));
            // SetValue keeps elements in hash order already.
            for (String h : set.hashes()) md.update(h.getBytes(StandardCharsets.US_ASCII));
        } else if (value instanceof ValueTree.MapValue m) {
            md.update((byte) 'm');
            putEntries(md, m.entries());
        } else if (value instanceof ValueTree.ObjectValue o) {
            md.update((byte) 'o');
            putEntries(md, o.fields());
        }
        return md.digest();
    }

    private static void putEntries(MessageDigest md, Map<String, ValueTree> sortedEntries) {
        List<Map.Entry<String, ValueTree>> present = new ArrayList<>();
        for (var e : sortedEntries.entrySet()) {
            if (e.getValue().isPresent()) present.add(e);
        }
        md.update(intLE(present.size()));
        for (var e : present) {
            putBytes(md, e.getKey().getBytes(StandardCharsets.UTF_8));
            md.update(hash(e.getValue()));
        }
    }

    private static void putBytes(MessageDigest md, byte[] bytes) {
        md.update(intLE(bytes.length));
        md.update(bytes);
    }

    private static byte[] intLE(int v) {
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(v).array();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String hex(byte[] b) {
        StringBuilder sb = new StringBuilder(b.length * 2);
        for (byte x : b) {
            sb.append(String.format("%02x", x));
        }
        return sb.toString();
    }

    /** Raised when a content hash is requested for a value that has none. */
    public static final class UnhashableValueException extends RuntimeException {
        public UnhashableValueException(String message) {
            super(message);
        }
    }
}
