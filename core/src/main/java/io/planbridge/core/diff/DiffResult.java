// file: core/src/main/java/io/planbridge/core/diff/DiffResult.java
package io.planbridge.core.diff;

import io.planbridge.core.path.PropertyPath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of one detailed diff: the changed paths and the resource-level replace decision.
 * <p>
 * Invariants:
 *  - each path appears at most once;
 *  - {@link #replace()} is the logical OR of every entry's replace bit.
 * Entries iterate in {@link PropertyPath} order.
 */
public final class DiffResult {

    private static final DiffResult EMPTY = new DiffResult(List.of());

    private final SortedMap<PropertyPath, DiffEntry> entries;
    private final boolean replace;

    public DiffResult(Collection<DiffEntry> entries) {
        var sorted = new TreeMap<PropertyPath, DiffEntry>();
        boolean anyReplace = false;
        for (DiffEntry e : entries) {
            if (sorted.put(e.path(), e) != null) {
                throw new IllegalArgumentException("duplicate diff path " + e.path());
            }
            anyReplace |= e.replace();
        }
        this.entries = Collections.unmodifiableSortedMap(sorted);
        this.replace = anyReplace;
    }

    public static DiffResult empty() { return EMPTY; }

    public List<DiffEntry> entries() { return List.copyOf(entries.values()); }

    public DiffEntry entry(PropertyPath path) { return entries.get(path); }

    public DiffEntry entry(String path) { return entries.get(PropertyPath.parse(path)); }

    public int size() { return entries.size(); }

    public boolean isEmpty() { return entries.isEmpty(); }

    public boolean hasChanges() { return !entries.isEmpty(); }

    public boolean replace() { return replace; }

    /** Sorted, de-duplicated top-level property names with at least one change. */
    public List<String> changedProperties() {
        var names = new TreeSet<String>();
        for (PropertyPath p : entries.keySet()) {
            if (!p.isRoot()) names.add(p.topLevel());
        }
        return new ArrayList<>(names);
    }

    /** Sorted, de-duplicated top-level property names whose change forces a replace. */
    public List<String> replacedProperties() {
        var names = new TreeSet<String>();
        for (DiffEntry e : entries.values()) {
            if (e.replace() && !e.path().isRoot()) names.add(e.path().topLevel());
        }
        return new ArrayList<>(names);
    }

    @Override public String toString() {
        return "DiffResult{replace=" + replace + ", entries=" + entries.values() + "}";
    }
}
