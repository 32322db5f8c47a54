// file: src/main/java/io/regtree/core/diff/StructuralDiffEngine.java
package io.regtree.core.diff;

import io.regtree.core.FrozenNode;
import io.regtree.core.Trees;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Label-keyed diff of two frozen trees.
 * <p>
 * Algorithm:
 *  - If the trees are structurally equal (cached hash, then equality),
 *    return an empty map without indexing anything.
 *  - Otherwise index both trees by label id (first pre-order occurrence
 *    wins, the same rule {@link Trees#find} uses).
 *  - Ids only on the left are DELETED, ids only on the right are ADDED,
 *    and ids on both sides are MODIFIED when the node's own fields or its
 *    ordered child labels differ.
 * <p>
 * The result is sorted by label id so repeated runs serialize identically.
 */
public final class StructuralDiffEngine implements DiffEngine {

    @Override
    public Map<String, Change> changesBetween(FrozenNode lhs, FrozenNode rhs) {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");

        var out = new TreeMap<String, Change>();

        // Quick exit: identical trees have nothing to report (covers self-diffs).
        if (lhs.equals(rhs)) {
            return out;
        }

        Map<String, FrozenNode> left = index(lhs);
        Map<String, FrozenNode> right = index(rhs);

        var ids = new TreeSet<String>(left.keySet());
        ids.addAll(right.keySet());

        for (String id : ids) {
            FrozenNode l = left.get(id);
            FrozenNode r = right.get(id);

            if (r == null) {
                out.put(id, Change.deleted(l.text(), l.title()));
            } else if (l == null) {
                out.put(id, Change.added(r.text(), r.title()));
            } else {
                Change c = modification(l, r);
                if (c != null) out.put(id, c);
            }
        }
        return out;
    }

    private static Map<String, FrozenNode> index(FrozenNode root) {
        var byId = new HashMap<String, FrozenNode>();
        Trees.walk(root, n -> {
            byId.putIfAbsent(n.labelId(), n);
            return null;
        });
        return byId;
    }

    /** Field-level change between two versions of one label, or null if none. */
    private static Change modification(FrozenNode l, FrozenNode r) {
        boolean textChanged = !l.text().equals(r.text());
        boolean titleChanged = !l.title().equals(r.title());
        boolean typeChanged = l.nodeType() != r.nodeType();

        List<String> leftKids = childLabels(l);
        List<String> rightKids = childLabels(r);
        boolean childrenChanged = !leftKids.equals(rightKids);

        if (!textChanged && !titleChanged && !typeChanged && !childrenChanged) {
            return null;
        }
        return new Change(
                Change.Op.MODIFIED,
                textChanged ? l.text() : null,
                textChanged ? r.text() : null,
                titleChanged ? l.title() : null,
                titleChanged ? r.title() : null,
                childrenChanged ? rightKids : null,
                typeChanged ? r.nodeType().wireName() : null
        );
    }

    private static List<String> childLabels(FrozenNode n) {
        return n.children().stream().map(FrozenNode::labelId).toList();
    }
}
