// file: core/src/main/java/io/planbridge/core/check/InputChecker.java
package io.planbridge.core.check;

import io.planbridge.core.diff.DiffException;
import io.planbridge.core.diff.SchemaConformer;
import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.ResourceSchema;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;
import io.planbridge.core.value.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Validates a resource's inputs before they are diffed.
 * <p>
 * Checks, in order:
 *  1) every value fits its schema shape, otherwise a single {@code unexpected type at field <path>}
 *     failure is returned and nothing else is checked;
 *  2) every Required field that is Null is reported as {@code missing required property <path>}
 *     (Unknown counts as provided);
 *  3) failures reported by the provider for individual fields: a Computed, not Required field
 *     is dropped from the inputs with a warning, so the provider can fill it in; any other
 *     failure is returned unchanged.
 * <p>
 * {@link #extractInputs} goes the other way: it recovers inputs from stored outputs by
 * dropping every field the provider fills in.
 */
public final class InputChecker {

    private static final Logger LOG = Logger.getLogger(InputChecker.class.getName());

    private InputChecker() {}

    public static CheckResult check(ResourceSchema schema, ValueTree inputs, List<CheckFailure> providerFailures) {
        ValueTree shaped;
        try {
            shaped = SchemaConformer.conform(schema.root(), inputs);
        } catch (DiffException e) {
            String property = e.path() == null || e.path().isRoot() ? "" : e.path().toString();
            return new CheckResult(inputs, List.of(new CheckFailure(property, e.getMessage())));
        }

        var failures = new ArrayList<CheckFailure>();
        missingRequired(schema.root(), shaped.isNull() ? ValueTree.object() : shaped, PropertyPath.root(), failures);

        ValueTree cleaned = shaped;
        for (CheckFailure f : providerFailures) {
            PropertyPath path = f.property().isEmpty() ? PropertyPath.root() : PropertyPath.parse(f.property());
            SchemaNode field = path.isRoot() ? null : schema.root().lookup(path);
            if (field != null && field.isProviderFilled()) {
                LOG.warning(() -> "dropping provider-filled input " + path + " of " + schema.token() + ": " + f.reason());
                cleaned = remove(cleaned, path.segments(), 0);
            } else {
                failures.add(f);
            }
        }
        return new CheckResult(cleaned, failures);
    }

    /**
     * Inputs implied by a resource's outputs, as needed after a read or an import.
     * Provider-filled fields are removed at every block level, inside lists, sets and maps of
     * blocks included. Secret bits are kept.
     *
     * @throws DiffException if the outputs do not fit the schema
     */
    public static ValueTree extractInputs(ResourceSchema schema, ValueTree outputs) {
        return withoutProviderFilled(schema.root(), SchemaConformer.conform(schema.root(), outputs));
    }

    private static ValueTree withoutProviderFilled(SchemaNode block, ValueTree v) {
        if (!(v instanceof ValueTree.ObjectValue o)) return v;
        ValueTree.ObjectValue out = o;
        for (var f : o.fields().entrySet()) {
            SchemaNode field = block.field(f.getKey());
            if (field == null) continue;
            if (field.isProviderFilled()) {
                out = out.without(f.getKey());
                continue;
            }
            out = out.with(f.getKey(), nestedInputs(field, f.getValue()));
        }
        return out;
    }

    private static ValueTree nestedInputs(SchemaNode field, ValueTree v) {
        if (field.isBlock()) return withoutProviderFilled(field, v);
        if (field.isSingleton()) return withoutProviderFilled(field.elem(), v);
        if (field.elem() == null || !field.elem().isBlock()) return v;
        if (v instanceof SetValue s) {
            var elements = new ArrayList<ValueTree>(s.size());
            for (ValueTree e : s.elements()) elements.add(withoutProviderFilled(field.elem(), e));
            return SetValue.of(elements, s.secret());
        }
        if (v instanceof ValueTree.ListValue l) {
            var elements = new ArrayList<ValueTree>(l.size());
            for (ValueTree e : l.elements()) elements.add(withoutProviderFilled(field.elem(), e));
            return new ValueTree.ListValue(elements, l.secret());
        }
        if (v instanceof ValueTree.MapValue m) {
            ValueTree.MapValue out = m;
            for (var e : m.entries().entrySet()) out = out.with(e.getKey(), withoutProviderFilled(field.elem(), e.getValue()));
            return out;
        }
        return v;
    }

    private static void missingRequired(SchemaNode block, ValueTree value, PropertyPath path, List<CheckFailure> out) {
        Map<String, ValueTree> fields = Values.entriesOf(value);
        if (fields == null) return;
        for (var f : block.fields().entrySet()) {
            String name = f.getKey();
            SchemaNode field = f.getValue();
            ValueTree v = fields.getOrDefault(name, ValueTree.nil());
            PropertyPath at = path.name(name);
            if (v.isNull()) {
                if (field.isRequired()) out.add(new CheckFailure(at.toString(), "missing required property " + at));
                continue;
            }
            nested(field, v, at, out);
        }
    }

    private static void nested(SchemaNode field, ValueTree v, PropertyPath at, List<CheckFailure> out) {
        switch (field.kind()) {
            case BLOCK -> missingRequired(field, v, at, out);
            case LIST, SET -> {
                if (field.isSingleton()) {
                    missingRequired(field.elem(), v, at, out);
                } else if (field.elem().isBlock()) {
                    List<ValueTree> elements = Values.children(v);
                    for (int i = 0; i < elements.size(); i++) {
                        missingRequired(field.elem(), elements.get(i), at.index(i), out);
                    }
                }
            }
            case MAP -> {
                if (field.elem().isBlock()) {
                    Map<String, ValueTree> entries = Values.entriesOf(v);
                    if (entries != null) entries.forEach((k, e) -> missingRequired(field.elem(), e, at.name(k), out));
                }
            }
            default -> { }
        }
    }

    /** Copy of {@code v} without the object field or map key at the end of the path. */
    private static ValueTree remove(ValueTree v, List<Object> segments, int i) {
        Object segment = segments.get(i);
        boolean last = i == segments.size() - 1;
        if (segment instanceof Integer index) {
            if (last || !(v instanceof ValueTree.ListValue l) || index >= l.size()) return v;
            return l.with(index, remove(l.get(index), segments, i + 1));
        }
        String name = (String) segment;
        if (v instanceof ValueTree.ObjectValue o) {
            return last ? o.without(name) : o.with(name, remove(o.get(name), segments, i + 1));
        }
        if (v instanceof ValueTree.MapValue m) {
            return last ? m.without(name) : m.with(name, remove(m.get(name), segments, i + 1));
        }
        return v;
    }
}
