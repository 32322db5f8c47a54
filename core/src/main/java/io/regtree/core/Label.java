// file: src/main/java/io/regtree/core/Label.java
package io.regtree.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable hierarchical address of a node inside a regulation,
 * for example {@code ["1005", "2", "a"]}.
 * <p>
 * Design:
 *  - Empty segments are dropped on construction, so a label never contains "".
 *  - Value object: equals/hashCode are element-wise over the segments.
 *  - A label whose last segment is {@link #INTERP_MARK} addresses an
 *    interpretive-overlay node; that flag is computed once here so callers
 *    never compare strings themselves.
 */
public final class Label implements Iterable<String> {

    /** Trailing path segment marking an official interpretation. */
    public static final String INTERP_MARK = "Interp";

    public static final Label EMPTY = new Label(List.of());

    private final List<String> segments;
    private final boolean interp;
    private final String id;

    private Label(List<String> segments) {
        this.segments = List.copyOf(segments);
        this.interp = !this.segments.isEmpty()
                && INTERP_MARK.equals(this.segments.get(this.segments.size() - 1));
        this.id = String.join("-", this.segments);
    }

    public static Label of(String... segments) {
        return of(Arrays.asList(segments));
    }

    /**
     * Build a label from loosely typed segments (e.g. decoded JSON).
     *
     * @throws InvalidLabelException if any segment is null or not a String
     */
    public static Label of(List<?> segments) {
        if (segments == null) throw new InvalidLabelException("label must not be null");
        var kept = new ArrayList<String>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            Object s = segments.get(i);
            if (!(s instanceof String str)) {
                throw new InvalidLabelException(
                        "label segment %d must be a string, got %s".formatted(
                                i, s == null ? "null" : s.getClass().getSimpleName()));
            }
            if (!str.isEmpty()) kept.add(str);
        }
        return kept.isEmpty() ? EMPTY : new Label(kept);
    }

    /** Segments joined with '-', e.g. "1005-2-a". */
    public String id() { return id; }

    public List<String> segments() { return segments; }

    public int size() { return segments.size(); }

    public boolean isEmpty() { return segments.isEmpty(); }

    /** True if the last segment is {@link #INTERP_MARK}. */
    public boolean isInterp() { return interp; }

    /** Last segment, or null for the empty label. */
    public String last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    /** The first {@code n} segments (the whole label when it is shorter). */
    public Label prefix(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        if (n >= segments.size()) return this;
        return n == 0 ? EMPTY : new Label(segments.subList(0, n));
    }

    /** True if this label is at least as long as {@code other} and begins with its segments. */
    public boolean startsWith(Label other) {
        int n = other.segments.size();
        return segments.size() >= n && segments.subList(0, n).equals(other.segments);
    }

    @Override public Iterator<String> iterator() { return segments.iterator(); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Label other)) return false;
        return segments.equals(other.segments);
    }

    @Override public int hashCode() { return segments.hashCode(); }

    @Override public String toString() { return segments.toString(); }
}
