// file: server/src/main/java/io/planbridge/server/codec/StructCodec.java
package io.planbridge.server.codec;

import com.google.protobuf.ListValue;
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between protobuf {@code Struct} payloads and {@link ValueTree}.
 * <p>
 * Decoding yields only lists and objects; the schema conformer later decides which of them are
 * sets and maps. Secret and unknown sentinels are recognized in both directions (see
 * {@link Sentinels}). Numbers travel as doubles.
 */
public final class StructCodec {

    private StructCodec() {}

    /** Decode a resource object; a missing struct is Null. */
    public static ValueTree decode(Struct struct) {
        if (struct == null) return ValueTree.nil();
        return decodeFields(struct.getFieldsMap());
    }

    public static ValueTree decode(Value v) {
        return switch (v.getKindCase()) {
            case NULL_VALUE, KIND_NOT_SET -> ValueTree.nil();
            case BOOL_VALUE -> ValueTree.of(v.getBoolValue());
            case NUMBER_VALUE -> ValueTree.of(BigDecimal.valueOf(v.getNumberValue()));
            case STRING_VALUE -> Sentinels.UNKNOWN.equals(v.getStringValue())
                    ? ValueTree.unknown()
                    : ValueTree.of(v.getStringValue());
            case LIST_VALUE -> {
                var out = new ArrayList<ValueTree>(v.getListValue().getValuesCount());
                for (Value e : v.getListValue().getValuesList()) out.add(decode(e));
                yield ValueTree.list(out);
            }
            case STRUCT_VALUE -> decodeFields(v.getStructValue().getFieldsMap());
        };
    }

    private static ValueTree decodeFields(Map<String, Value> fields) {
        Value sig = fields.get(Sentinels.SIG_KEY);
        if (sig != null && Sentinels.SECRET_SIG.equals(sig.getStringValue())) {
            Value inner = fields.getOrDefault(Sentinels.VALUE_KEY, Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build());
            return ValueTree.secret(decode(inner));
        }
        var out = new LinkedHashMap<String, ValueTree>();
        fields.forEach((k, e) -> out.put(k, decode(e)));
        return new ValueTree.ObjectValue(out, false);
    }

    /** Encode a resource object; Null encodes as an empty struct. */
    public static Struct encodeStruct(ValueTree v) {
        Value encoded = encode(v);
        if (encoded.hasStructValue()) return encoded.getStructValue();
        if (v.isNull()) return Struct.getDefaultInstance();
        throw new IllegalArgumentException("resource properties must be an object, got " + v.typeName());
    }

    public static Value encode(ValueTree v) {
        if (v.secret()) {
            return Value.newBuilder().setStructValue(Struct.newBuilder()
                    .putFields(Sentinels.SIG_KEY, Value.newBuilder().setStringValue(Sentinels.SECRET_SIG).build())
                    .putFields(Sentinels.VALUE_KEY, encode(v.withSecret(false)))
            ).build();
        }
        if (v instanceof ValueTree.Null) return Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
        if (v instanceof ValueTree.Unknown) return Value.newBuilder().setStringValue(Sentinels.UNKNOWN).build();
        if (v instanceof ValueTree.Scalar s) {
            Object x = s.value();
            if (x instanceof String str) return Value.newBuilder().setStringValue(str).build();
            if (x instanceof Boolean b) return Value.newBuilder().setBoolValue(b).build();
            return Value.newBuilder().setNumberValue(((BigDecimal) x).doubleValue()).build();
        }
        if (v instanceof ValueTree.ListValue || v instanceof SetValue) {
            List<ValueTree> elements = v instanceof SetValue set ? set.elements() : ((ValueTree.ListValue) v).elements();
            var list = ListValue.newBuilder();
            for (ValueTree e : elements) list.addValues(encode(e));
            return Value.newBuilder().setListValue(list).build();
        }
        Map<String, ValueTree> entries = v instanceof ValueTree.MapValue m ? m.entries() : ((ValueTree.ObjectValue) v).fields();
        var struct = Struct.newBuilder();
        entries.forEach((k, e) -> struct.putFields(k, encode(e)));
        return Value.newBuilder().setStructValue(struct).build();
    }
}
