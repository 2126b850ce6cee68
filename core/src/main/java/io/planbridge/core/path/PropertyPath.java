// file: core/src/main/java/io/planbridge/core/path/PropertyPath.java
package io.planbridge.core.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable address of a node inside a value tree, for example {@code rules[2].ports}.
 * <p>
 * A path is an ordered list of segments. Each segment is either:
 *  - a String (object field or map key), or
 *  - an Integer (list or set element index).
 * <p>
 * Text form:
 *  - identifier-like names are joined with '.', e.g. {@code a.b};
 *  - indices are written as {@code [n]};
 *  - any other name is quoted, e.g. {@code tags["team/owner"]}.
 * <p>
 * Paths order segment-wise: indices numerically, names lexicographically, indices before names.
 * Immutable; appending returns a new path.
 */
public final class PropertyPath implements Comparable<PropertyPath> {

    /** Wildcard segment accepted by {@link #parse(String)} for ignore-changes paths. */
    public static final String WILDCARD = "*";

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");
    private static final PropertyPath ROOT = new PropertyPath(List.of());

    private final List<Object> segments;

    private PropertyPath(List<Object> segments) {
        this.segments = segments;
    }

    /** The empty path: addresses the resource's top-level object itself. */
    public static PropertyPath root() { return ROOT; }

    public static PropertyPath of(Object... segments) {
        PropertyPath p = ROOT;
        for (Object s : segments) {
            if (s instanceof Integer i) p = p.index(i);
            else if (s instanceof String n) p = p.name(n);
            else throw new IllegalArgumentException("segment must be String or Integer: " + s);
        }
        return p;
    }

    public PropertyPath name(String name) {
        Objects.requireNonNull(name, "name");
        return append(name);
    }

    public PropertyPath index(int index) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        return append(index);
    }

    private PropertyPath append(Object segment) {
        var copy = new ArrayList<>(segments.size() + 1);
        copy.addAll(segments);
        copy.add(segment);
        return new PropertyPath(Collections.unmodifiableList(copy));
    }

    public List<Object> segments() { return segments; }

    public int size() { return segments.size(); }

    public boolean isRoot() { return segments.isEmpty(); }

    public Object last() {
        if (segments.isEmpty()) throw new IllegalStateException("root path has no last segment");
        return segments.get(segments.size() - 1);
    }

    public PropertyPath parent() {
        if (segments.isEmpty()) throw new IllegalStateException("root path has no parent");
        return new PropertyPath(segments.subList(0, segments.size() - 1));
    }

    /** Path with the first segment removed. */
    public PropertyPath tail() {
        if (segments.isEmpty()) throw new IllegalStateException("root path has no tail");
        return new PropertyPath(segments.subList(1, segments.size()));
    }

    /** Name of the top-level property this path lives under, or null for the root path. */
    public String topLevel() {
        if (segments.isEmpty()) return null;
        return String.valueOf(segments.get(0));
    }

    /**
     * Parse the text form back into a path.
     * Accepts {@code a.b[0]["quoted key"].*} and {@code [*]}.
     *
     * @throws IllegalArgumentException on malformed input
     */
    public static PropertyPath parse(String text) {
        Objects.requireNonNull(text, "text");
        var out = new ArrayList<Object>();
        int i = 0;
        int n = text.length();
        boolean expectName = true; // at start or right after '.'
        while (i < n) {
            char c = text.charAt(i);
            if (c == '[') {
                int close;
                if (i + 1 < n && text.charAt(i + 1) == '"') {
                    var sb = new StringBuilder();
                    int j = i + 2;
                    while (j < n && text.charAt(j) != '"') {
                        if (text.charAt(j) == '\\' && j + 1 < n) j++;
                        sb.append(text.charAt(j));
                        j++;
                    }
                    if (j + 1 >= n || text.charAt(j + 1) != ']') {
                        throw new IllegalArgumentException("unterminated quoted segment in path: " + text);
                    }
                    out.add(sb.toString());
                    close = j + 1;
                } else {
                    close = text.indexOf(']', i);
                    if (close < 0) throw new IllegalArgumentException("unterminated index in path: " + text);
                    String inner = text.substring(i + 1, close).trim();
                    if (WILDCARD.equals(inner)) {
                        out.add(WILDCARD);
                    } else {
                        try {
                            int idx = Integer.parseInt(inner);
                            if (idx < 0) throw new IllegalArgumentException("negative index in path: " + text);
                            out.add(idx);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("invalid index '" + inner + "' in path: " + text);
                        }
                    }
                }
                i = close + 1;
                expectName = false;
            } else if (c == '.') {
                if (expectName) throw new IllegalArgumentException("empty segment in path: " + text);
                i++;
                expectName = true;
            } else {
                int j = i;
                while (j < n && text.charAt(j) != '.' && text.charAt(j) != '[') j++;
                out.add(text.substring(i, j));
                i = j;
                expectName = false;
            }
        }
        if (expectName && !out.isEmpty()) throw new IllegalArgumentException("trailing '.' in path: " + text);
        return new PropertyPath(Collections.unmodifiableList(out));
    }

    @Override public String toString() {
        var sb = new StringBuilder();
        for (Object s : segments) {
            if (s instanceof Integer i) {
                sb.append('[').append(i).append(']');
            } else {
                String name = (String) s;
                if (IDENTIFIER.matcher(name).matches() || WILDCARD.equals(name)) {
                    if (sb.length() > 0) sb.append('.');
                    sb.append(name);
                } else {
                    sb.append("[\"").append(name.replace("\\", "\\\\").replace("\"", "\\\"")).append("\"]");
                }
            }
        }
        return sb.toString();
    }

    @Override public int compareTo(PropertyPath other) {
        int common = Math.min(size(), other.size());
        for (int k = 0; k < common; k++) {
            int c = compareSegments(segments.get(k), other.segments.get(k));
            if (c != 0) return c;
        }
        return Integer.compare(size(), other.size());
    }

    private static int compareSegments(Object a, Object b) {
        if (a instanceof Integer x && b instanceof Integer y) return Integer.compare(x, y);
        if (a instanceof Integer) return -1;
        if (b instanceof Integer) return 1;
        return ((String) a).compareTo((String) b);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyPath p)) return false;
        return segments.equals(p.segments);
    }

    @Override public int hashCode() { return segments.hashCode(); }
}
