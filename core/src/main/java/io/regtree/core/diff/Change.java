package io.regtree.core.diff;

import java.util.List;

/**
 * Change record for one label id between two versions of a regulation.
 * <p>
 * Fields that did not change (or do not apply to the op) are null:
 *  - ADDED:    newText, newTitle.
 *  - DELETED:  oldText, oldTitle.
 *  - MODIFIED: old/new pairs for text and title only when they differ;
 *              childLabels (the new ordered child label ids) only when the
 *              child list changed; nodeType only when the kind changed.
 */
public record Change(
        Op op,
        String oldText,
        String newText,
        String oldTitle,
        String newTitle,
        List<String> childLabels,
        String nodeType
) {

    public enum Op { ADDED, DELETED, MODIFIED }

    public Change {
        if (op == null) throw new IllegalArgumentException("op");
        childLabels = childLabels == null ? null : List.copyOf(childLabels);
    }

    static Change added(String text, String title) {
        return new Change(Op.ADDED, null, text, null, title, null, null);
    }

    static Change deleted(String text, String title) {
        return new Change(Op.DELETED, text, null, title, null, null, null);
    }
}
