// file: core/src/main/java/io/planbridge/core/secret/SecretPropagator.java
package io.planbridge.core.secret;

import io.planbridge.core.diff.DiffEntry;
import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;
import io.planbridge.core.value.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks which values must never be shown in clear.
 * <p>
 * Secrecy is monotonic: once a property is secret because of its schema or of any input or
 * prior output, every derived value (diff entries, new outputs) stays secret.
 * <p>
 * A property is secret when:
 *  - the schema declares it, or one of its ancestors, sensitive; or
 *  - any old or new value at or above it carries the secret bit; or
 *  - any value inside the subtree that changed carries the secret bit.
 * Sets are addressed by synthetic indices, so a secret anywhere in a set on the path makes
 * everything below the set secret.
 */
public final class SecretPropagator {

    private SecretPropagator() {}

    /** Copy of {@code entries} with the secret bit set where it applies. */
    public static List<DiffEntry> annotate(SchemaNode root, ValueTree olds, ValueTree news, List<DiffEntry> entries) {
        var out = new ArrayList<DiffEntry>(entries.size());
        for (DiffEntry e : entries) {
            boolean secret = schemaSensitive(root, e.path())
                    || valueSecretAlong(olds, e.path())
                    || valueSecretAlong(news, e.path())
                    || Values.containsSecrets(e.oldValue())
                    || Values.containsSecrets(e.newValue());
            out.add(secret ? e.withSecret(true) : e);
        }
        return out;
    }

    /** True if any schema node from the root to the end of {@code path} is sensitive. */
    public static boolean schemaSensitive(SchemaNode root, PropertyPath path) {
        SchemaNode cur = root;
        if (cur.isSensitive()) return true;
        for (Object segment : path.segments()) {
            if (cur.isSingleton() && cur.elem().isSensitive()) return true;
            cur = cur.child(segment);
            if (cur == null) return false;
            if (cur.isSensitive()) return true;
        }
        return false;
    }

    /** True if any value node from the root to the end of {@code path} carries the secret bit. */
    static boolean valueSecretAlong(ValueTree root, PropertyPath path) {
        ValueTree cur = root;
        for (Object segment : path.segments()) {
            if (cur.secret()) return true;
            if (cur instanceof SetValue) return Values.containsSecrets(cur);
            cur = child(cur, segment);
            if (cur == null) return false;
        }
        return cur.secret();
    }

    /**
     * Mark outputs returned by the provider after a Create or Update.
     * A node becomes secret when its schema is sensitive, when the input at the same place was
     * secret, or when the prior persisted output there was secret. A set becomes wholly secret
     * if any of its input or prior elements was.
     *
     * @param inputs  the configuration sent to the provider, may be Null
     * @param prior   the previously persisted outputs, Null on create
     * @param outputs the provider's outputs
     */
    public static ValueTree markOutputs(SchemaNode schema, ValueTree inputs, ValueTree prior, ValueTree outputs) {
        return mark(schema, inputs, prior, outputs);
    }

    private static ValueTree mark(SchemaNode schema, ValueTree input, ValueTree prior, ValueTree out) {
        boolean secret = out.secret()
                || (schema != null && schema.isSensitive())
                || (input != null && input.secret())
                || (prior != null && prior.secret());
        if (secret) return out.withSecret(true);

        if (out instanceof SetValue s) {
            if ((input != null && Values.containsSecrets(input)) || (prior != null && Values.containsSecrets(prior))) {
                return s.withSecret(true);
            }
            SchemaNode elem = schema == null ? null : schema.elem();
            var elements = new ArrayList<ValueTree>(s.size());
            for (ValueTree e : s.elements()) elements.add(mark(elem, null, null, e));
            return SetValue.of(elements, false);
        }
        if (out instanceof ValueTree.ListValue l) {
            var elements = new ArrayList<ValueTree>(l.size());
            for (int i = 0; i < l.size(); i++) {
                elements.add(mark(childSchema(schema, i), child(input, i), child(prior, i), l.get(i)));
            }
            return new ValueTree.ListValue(elements, false);
        }
        Map<String, ValueTree> entries = Values.entriesOf(out);
        if (entries != null) {
            var marked = new LinkedHashMap<String, ValueTree>();
            entries.forEach((name, v) ->
                    marked.put(name, mark(childSchema(schema, name), child(input, name), child(prior, name), v)));
            return out instanceof ValueTree.MapValue
                    ? new ValueTree.MapValue(marked, false)
                    : new ValueTree.ObjectValue(marked, false);
        }
        return out;
    }

    /** Copy of the value with all secret bits cleared, for comparisons and trusted sinks. */
    public static ValueTree strip(ValueTree value) {
        return Values.stripSecrets(value);
    }

    private static SchemaNode childSchema(SchemaNode schema, Object segment) {
        return schema == null ? null : schema.child(segment);
    }

    private static ValueTree child(ValueTree v, Object segment) {
        if (v == null) return null;
        if (segment instanceof Integer i) {
            return v instanceof ValueTree.ListValue l && i < l.size() ? l.get(i) : null;
        }
        Map<String, ValueTree> entries = Values.entriesOf(v);
        return entries == null ? null : entries.get((String) segment);
    }
}
