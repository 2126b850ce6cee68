// file: server/src/main/java/io/planbridge/server/codec/JsonValueCodec.java
package io.planbridge.server.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Jackson trees and {@link ValueTree} for the HTTP surface.
 * Same sentinel rules as {@link StructCodec}; numbers keep their exact decimal value.
 */
public final class JsonValueCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValueCodec() {}

    /** A missing node or JSON null is Null. */
    public static ValueTree decode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return ValueTree.nil();
        if (node.isBoolean()) return ValueTree.of(node.booleanValue());
        if (node.isNumber()) return ValueTree.of(node.decimalValue());
        if (node.isTextual()) {
            return Sentinels.UNKNOWN.equals(node.textValue()) ? ValueTree.unknown() : ValueTree.of(node.textValue());
        }
        if (node.isArray()) {
            var out = new ArrayList<ValueTree>(node.size());
            for (JsonNode e : node) out.add(decode(e));
            return ValueTree.list(out);
        }
        if (node.isObject()) {
            JsonNode sig = node.get(Sentinels.SIG_KEY);
            if (sig != null && Sentinels.SECRET_SIG.equals(sig.asText())) {
                return ValueTree.secret(decode(node.get(Sentinels.VALUE_KEY)));
            }
            var out = new LinkedHashMap<String, ValueTree>();
            node.fields().forEachRemaining(e -> out.put(e.getKey(), decode(e.getValue())));
            return new ValueTree.ObjectValue(out, false);
        }
        throw new IllegalArgumentException("unsupported JSON node " + node.getNodeType());
    }

    public static JsonNode encode(ValueTree v) {
        if (v.secret()) {
            ObjectNode wrapper = NODES.objectNode();
            wrapper.put(Sentinels.SIG_KEY, Sentinels.SECRET_SIG);
            wrapper.set(Sentinels.VALUE_KEY, encode(v.withSecret(false)));
            return wrapper;
        }
        if (v instanceof ValueTree.Null) return NODES.nullNode();
        if (v instanceof ValueTree.Unknown) return NODES.textNode(Sentinels.UNKNOWN);
        if (v instanceof ValueTree.Scalar s) {
            Object x = s.value();
            if (x instanceof String str) return NODES.textNode(str);
            if (x instanceof Boolean b) return NODES.booleanNode(b);
            return NODES.numberNode((BigDecimal) x);
        }
        if (v instanceof ValueTree.ListValue || v instanceof SetValue) {
            List<ValueTree> elements = v instanceof SetValue set ? set.elements() : ((ValueTree.ListValue) v).elements();
            ArrayNode array = NODES.arrayNode();
            for (ValueTree e : elements) array.add(encode(e));
            return array;
        }
        Map<String, ValueTree> entries = v instanceof ValueTree.MapValue m ? m.entries() : ((ValueTree.ObjectValue) v).fields();
        ObjectNode object = NODES.objectNode();
        entries.forEach((k, e) -> object.set(k, encode(e)));
        return object;
    }
}
