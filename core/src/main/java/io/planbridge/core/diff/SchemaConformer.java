// file: core/src/main/java/io/planbridge/core/diff/SchemaConformer.java
package io.planbridge.core.diff;

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
 * Shapes a wire-decoded value tree after its schema.
 * <p>
 * Wire formats only know arrays and objects. This pass turns arrays into ListValue or SetValue
 * and objects into MapValue or ObjectValue as the schema declares, and rejects shapes that
 * contradict it with {@link DiffException#unexpectedType}. Null and Unknown fit every schema.
 * Secret bits are preserved. Already-shaped trees pass through unchanged in meaning.
 * <p>
 * Singleton (max-items-one) nodes expect the collapsed form: an object, never a list.
 * Object fields the schema does not declare are kept as they are.
 */
public final class SchemaConformer {

    private SchemaConformer() {}

    /** Shape a whole resource object against its root block. */
    public static ValueTree conform(SchemaNode root, ValueTree value) {
        return conform(root, value, PropertyPath.root());
    }

    public static ValueTree conform(SchemaNode schema, ValueTree value, PropertyPath path) {
        if (value.isNull() || value.isUnknown()) return value;
        return switch (schema.kind()) {
            case SCALAR -> {
                if (!(value instanceof ValueTree.Scalar)) throw DiffException.unexpectedType(path);
                yield value;
            }
            case LIST, SET -> schema.isSingleton()
                    ? conformBlock(schema.elem(), value, path)
                    : conformCollection(schema, value, path);
            case MAP -> {
                Map<String, ValueTree> entries = Values.entriesOf(value);
                if (entries == null) throw DiffException.unexpectedType(path);
                var out = new LinkedHashMap<String, ValueTree>();
                entries.forEach((k, v) -> out.put(k, conform(schema.elem(), v, path.name(k))));
                yield new ValueTree.MapValue(out, value.secret());
            }
            case BLOCK -> conformBlock(schema, value, path);
        };
    }

    private static ValueTree conformCollection(SchemaNode schema, ValueTree value, PropertyPath path) {
        List<ValueTree> elements;
        if (value instanceof ValueTree.ListValue l) elements = l.elements();
        else if (value instanceof SetValue s) elements = s.elements();
        else throw DiffException.unexpectedType(path);

        var out = new ArrayList<ValueTree>(elements.size());
        boolean set = schema.kind() == SchemaNode.Kind.SET;
        for (int i = 0; i < elements.size(); i++) {
            ValueTree element = elements.get(i);
            if (set && element.isNull()) {
                throw new DiffException(DiffException.Kind.STRUCTURAL, path,
                        "set element at " + DiffException.describe(path.index(i)) + " has no content hash");
            }
            out.add(conform(schema.elem(), element, path.index(i)));
        }
        if (set) {
            return SetValue.of(out, value.secret());
        }
        return new ValueTree.ListValue(out, value.secret());
    }

    private static ValueTree conformBlock(SchemaNode block, ValueTree value, PropertyPath path) {
        Map<String, ValueTree> fields = Values.entriesOf(value);
        if (fields == null) throw DiffException.unexpectedType(path);
        var out = new LinkedHashMap<String, ValueTree>();
        fields.forEach((name, v) -> {
            SchemaNode field = block.field(name);
            out.put(name, field == null ? v : conform(field, v, path.name(name)));
        });
        return new ValueTree.ObjectValue(out, value.secret());
    }
}
