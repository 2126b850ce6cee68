// file: core/src/main/java/io/planbridge/core/render/DiffRenderer.java
package io.planbridge.core.render;

import io.planbridge.core.diff.DiffEntry;
import io.planbridge.core.diff.DiffKind;
import io.planbridge.core.diff.DiffResult;
import io.planbridge.core.path.PropertyPath;
import io.planbridge.core.value.SetValue;
import io.planbridge.core.value.ValueTree;
import io.planbridge.core.value.Values;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns diff results into the two forms consumers read.
 * <p>
 * Wire form: path text to {@link WireKind}, in path order.
 * <p>
 * Preview form, one block per changed resource:
 * <pre>
 * +- prov:index/test:Test res (replace)
 *     ~ tests: [
 *         +- [0]: "val1" =&gt; "val2"
 *       ]
 * </pre>
 * Entries are grouped by their common path prefixes and indented four spaces per level.
 * Secrets print as {@code [secret]} and unknowns as {@code (unknown)}. Output depends only on
 * the inputs.
 */
public final class DiffRenderer {

    private static final String INDENT = "    ";
    private static final String SECRET = "[secret]";
    private static final String UNKNOWN = "(unknown)";

    private DiffRenderer() {}

    // ---------- wire ----------

    public static Map<String, WireKind> toWire(DiffResult result) {
        var out = new LinkedHashMap<String, WireKind>();
        for (DiffEntry e : result.entries()) {
            out.put(e.path().toString(), WireKind.of(e.kind(), e.replace()));
        }
        return out;
    }

    // ---------- preview ----------

    /** Full preview: every changed resource sorted by name, then a summary of counts. */
    public static String preview(List<ResourceChange> changes, Colorization color) {
        var sorted = new ArrayList<>(changes);
        sorted.sort(Comparator.comparing(ResourceChange::name).thenComparing(ResourceChange::type));

        var sb = new StringBuilder();
        var counts = new EnumMap<ResourceChange.Operation, Integer>(ResourceChange.Operation.class);
        for (ResourceChange c : sorted) {
            counts.merge(c.op(), 1, Integer::sum);
            if (c.op() == ResourceChange.Operation.SAME) continue;
            sb.append(renderResource(c, color)).append('\n');
        }

        sb.append("Resources:\n");
        boolean any = false;
        for (ResourceChange.Operation op : ResourceChange.Operation.values()) {
            int n = counts.getOrDefault(op, 0);
            if (n == 0) continue;
            any = true;
            if (op == ResourceChange.Operation.SAME) {
                sb.append(INDENT).append(n).append(" unchanged\n");
            } else {
                sb.append(INDENT).append(paint(color, op.marker, op.marker + " " + n + " to " + op.label)).append('\n');
            }
        }
        if (!any) sb.append(INDENT).append("no changes\n");
        return sb.toString();
    }

    /** Header line plus the nested entry lines of one resource. */
    public static String renderResource(ResourceChange change, Colorization color) {
        var op = change.op();
        var sb = new StringBuilder();
        sb.append(paint(color, op.marker, op.marker + " " + change.type() + " " + change.name() + " (" + op.label + ")"))
                .append('\n');

        var root = new Node(PropertyPath.root());
        for (DiffEntry e : change.diff().entries()) root.insert(e);
        for (Node child : root.children.values()) render(sb, child, 1, color);
        return sb.toString();
    }

    private static void render(StringBuilder sb, Node node, int depth, Colorization color) {
        String indent = INDENT.repeat(depth);
        String label = label(node.path.last());

        if (node.entry != null) {
            String marker = marker(node.entry);
            sb.append(indent).append(paint(color, marker, marker + " " + label + ": " + describe(node.entry))).append('\n');
            for (Node child : node.children.values()) render(sb, child, depth + 1, color);
            return;
        }

        boolean indexed = node.children.firstKey().last() instanceof Integer;
        sb.append(indent).append(paint(color, "~", "~ " + label + ": " + (indexed ? "[" : "{"))).append('\n');
        for (Node child : node.children.values()) render(sb, child, depth + 1, color);
        sb.append(indent).append("  ").append(indexed ? "]" : "}").append('\n');
    }

    private static String marker(DiffEntry e) {
        if (e.replace()) return "+-";
        return switch (e.kind()) {
            case ADD -> "+";
            case DELETE -> "-";
            case UPDATE -> "~";
        };
    }

    private static String label(Object segment) {
        return segment instanceof Integer i ? "[" + i + "]" : PropertyPath.of(segment).toString();
    }

    private static String describe(DiffEntry e) {
        if (e.kind() == DiffKind.ADD) return e.secret() ? SECRET : format(e.newValue());
        if (e.kind() == DiffKind.DELETE) return e.secret() ? SECRET : format(e.oldValue());
        if (e.secret()) return SECRET + " => " + SECRET;
        return format(e.oldValue()) + " => " + format(e.newValue());
    }

    /** Compact JSON-like rendering; any secret node hides its whole subtree. */
    static String format(ValueTree v) {
        if (v.secret()) return SECRET;
        if (v instanceof ValueTree.Null) return "null";
        if (v instanceof ValueTree.Unknown) return UNKNOWN;
        if (v instanceof ValueTree.Scalar s) {
            Object x = s.value();
            if (x instanceof String str) return quote(str);
            if (x instanceof BigDecimal d) return d.toPlainString();
            return String.valueOf(x);
        }
        if (v instanceof ValueTree.ListValue || v instanceof SetValue) {
            var parts = new ArrayList<String>();
            for (ValueTree e : Values.children(v)) parts.add(format(e));
            return "[" + String.join(", ", parts) + "]";
        }
        var parts = new ArrayList<String>();
        Values.entriesOf(v).forEach((k, x) -> parts.add(quote(k) + ": " + format(x)));
        return "{" + String.join(", ", parts) + "}";
    }

    private static String quote(String s) {
        var sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static String paint(Colorization color, String marker, String text) {
        return switch (marker) {
            case "+" -> color.paint(Colorization.GREEN, text);
            case "-" -> color.paint(Colorization.RED, text);
            case "~" -> color.paint(Colorization.YELLOW, text);
            case "+-" -> color.paint(Colorization.MAGENTA, text);
            default -> text;
        };
    }

    /** Path trie node; children are kept in path order. */
    private static final class Node {
        final PropertyPath path;
        final TreeMap<PropertyPath, Node> children = new TreeMap<>();
        DiffEntry entry;

        Node(PropertyPath path) {
            this.path = path;
        }

        void insert(DiffEntry e) {
            Node cur = this;
            for (Object segment : e.path().segments()) {
                PropertyPath next = segment instanceof Integer i ? cur.path.index(i) : cur.path.name((String) segment);
                cur = cur.children.computeIfAbsent(next, Node::new);
            }
            cur.entry = e;
        }
    }
}
