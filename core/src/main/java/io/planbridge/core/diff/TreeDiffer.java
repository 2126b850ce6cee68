// file: core/src/main/java/io/planbridge/core/diff/TreeDiffer.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.schema.SchemaNode;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;
import io.planbridge.core.value.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Recursive dispatcher of the detailed diff.
 * <p>
 * Walks a schema and two value trees in lock-step and records one raw {@link DiffEntry}
 * (replace and secret bits still unset) per changed path:
 *  1) deeply equal subtrees produce nothing;
 *  2) unknowns are handled by {@link UnknownPropagator};
 *  3) Null on one side is a single ADD or DELETE at the current path;
 *  4) otherwise the schema kind picks the differ: scalars are an UPDATE, lists go to
 *     {@link ListDiffer}, sets to {@link SetDiffer}, maps to {@link MapDiffer}, and blocks
 *     (including unwrapped singleton collections) are diffed field by field.
 * <p>
 * Inputs must already be shaped by {@link SchemaConformer}. One instance serves one call.
 */
public final class TreeDiffer {

    private final List<DiffEntry> out = new ArrayList<>();
    private final ListDiffer lists = new ListDiffer(this);
    private final SetDiffer sets = new SetDiffer(this);
    private final MapDiffer maps = new MapDiffer(this);

    private TreeDiffer() {}

    /**
     * Diff two resource objects against their root block. A Null side is treated as an
     * object with no fields, so creating a resource yields one ADD per top-level property.
     */
    public static List<DiffEntry> diff(SchemaNode root, ValueTree olds, ValueTree news) {
        var differ = new TreeDiffer();
        differ.diffBlock(PropertyPath.root(), root, asObject(olds), asObject(news));
        return differ.out;
    }

    private static ValueTree asObject(ValueTree v) {
        return v.isNull() ? ValueTree.object() : v;
    }

    void diffNode(PropertyPath path, SchemaNode schema, ValueTree old, ValueTree neu) {
        if (Values.deepEquals(old, neu)) return;
        if (UnknownPropagator.handle(this, path, old, neu)) return;
        if (old.isNull()) {
            record(path, DiffKind.ADD, old, neu);
            return;
        }
        if (neu.isNull()) {
            record(path, DiffKind.DELETE, old, neu);
            return;
        }
        if (schema == null) {
            // Not described by the schema: plain value comparison.
            record(path, DiffKind.UPDATE, old, neu);
            return;
        }

        switch (schema.kind()) {
            case SCALAR -> record(path, DiffKind.UPDATE, old, neu);
            case LIST -> {
                if (schema.isSingleton()) diffBlock(path, schema.elem(), old, neu);
                else lists.diff(path, schema, expect(ValueTree.ListValue.class, old, path),
                        expect(ValueTree.ListValue.class, neu, path));
            }
            case SET -> {
                if (schema.isSingleton()) diffBlock(path, schema.elem(), old, neu);
                else sets.diff(path, schema, expect(SetValue.class, old, path), expect(SetValue.class, neu, path));
            }
            case MAP -> maps.diff(path, schema, expect(ValueTree.MapValue.class, old, path),
                    expect(ValueTree.MapValue.class, neu, path));
            case BLOCK -> diffBlock(path, schema, old, neu);
        }
    }

    /** Field-by-field diff; a field missing on one side is Null there. */
    void diffBlock(PropertyPath path, SchemaNode block, ValueTree old, ValueTree neu) {
        var o = expect(ValueTree.ObjectValue.class, old, path);
        var n = expect(ValueTree.ObjectValue.class, neu, path);

        var names = new TreeSet<>(o.fields().keySet());
        names.addAll(n.fields().keySet());
        for (String name : names) {
            SchemaNode field = block.field(name);
            ValueTree ov = o.get(name);
            ValueTree nv = n.get(name);
            if (UnknownPropagator.leftToProvider(field, nv)) continue;
            diffNode(path.name(name), field, ov, nv);
        }
    }

    void record(PropertyPath path, DiffKind kind, ValueTree old, ValueTree neu) {
        out.add(DiffEntry.of(path, kind, old, neu));
    }

    private static <T extends ValueTree> T expect(Class<T> type, ValueTree v, PropertyPath path) {
        if (!type.isInstance(v)) throw DiffException.unexpectedType(path);
        return type.cast(v);
    }
}
