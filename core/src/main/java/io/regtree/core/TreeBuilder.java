// file: src/main/java/io/regtree/core/TreeBuilder.java
package io.regtree.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds the nested regulation tree implied by a flat list of labeled nodes.
 * <p>
 * The label path is the only structure the input carries: a node is a
 * descendant of every node whose label is a prefix of its own. The markup
 * parser may emit fragments out of document order, and may split one logical
 * node into several fragments carrying the same label, so reconstruction is
 * order-independent and merges duplicates.
 * <p>
 * Algorithm (for one group of nodes):
 *  - Roots are the nodes with the shortest label in the group.
 *  - Roots sharing a label are merged (see {@link #mergeDuplicates}).
 *  - For each root, its children are the group members whose label extends
 *    the root's label. An interpretive-overlay root ("...-Interp") matches
 *    on its label without the trailing mark, so the interpretation subtree
 *    adopts the nodes of the paragraph it interprets.
 *  - Each root's child group is rebuilt the same way and appended after the
 *    children the root already had.
 * <p>
 * The depth-first recursion is run on an explicit frame stack. Mutations
 * happen in the same order as the recursive formulation.
 */
public final class TreeBuilder {

    private static final Logger log = Logger.getLogger(TreeBuilder.class.getName());

    private TreeBuilder() {}

    /**
     * Collapse nodes with identical labels into one, concatenating children.
     * <p>
     * Each round scans every pair (i, j), i < j, and acts on the last
     * duplicate pair found in scan order: j's children are appended to i's,
     * then j is dropped. Rounds repeat until no duplicates remain.
     * <p>
     * Intended for lists whose labels all have the same length.
     *
     * @return a new list; the input list is not modified, but the surviving
     *         nodes' children are
     */
    public static List<Node> mergeDuplicates(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        var out = new ArrayList<>(nodes);

        while (true) {
            int lidx = -1, ridx = -1;
            for (int i = 0; i < out.size(); i++) {
                Label lhs = out.get(i).label();
                for (int j = i + 1; j < out.size(); j++) {
                    if (lhs.equals(out.get(j).label())) {
                        lidx = i;
                        ridx = j;
                    }
                }
            }
            if (lidx < 0) return out;

            Node keep = out.get(lidx);
            Node drop = out.remove(ridx);
            keep.children().addAll(drop.children());
            if (log.isLoggable(Level.FINE)) {
                log.fine("merged duplicate label " + keep.labelId()
                        + " (" + drop.children().size() + " children moved)");
            }
        }
    }

    /**
     * Convert a flat, unordered list of labeled nodes into the trees their labels imply.
     *
     * @return the root nodes (those with the shortest label), each holding its
     *         reconstructed subtree; empty for empty input
     */
    public static List<Node> treeify(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        if (nodes.isEmpty()) return new ArrayList<>();

        var top = new Frame(null, nodes);
        var frames = new ArrayDeque<Frame>();
        frames.push(top);

        while (!frames.isEmpty()) {
            Frame f = frames.peek();
            if (f.next < f.roots.size()) {
                Node root = f.roots.get(f.next++);
                List<Node> children = childrenOf(root, f.group);
                if (!children.isEmpty()) {
                    frames.push(new Frame(root, children));
                }
                continue;
            }
            frames.pop();
            if (f.owner != null) {
                f.owner.children().addAll(f.roots);
            }
        }
        return top.roots;
    }

    /** Members of {@code group} whose label places them below {@code root}. */
    private static List<Node> childrenOf(Node root, List<Node> group) {
        Label rootLabel = root.label();
        Label prefix = rootLabel.isInterp()
                ? rootLabel.prefix(rootLabel.size() - 1)
                : rootLabel;

        var out = new ArrayList<Node>();
        for (Node n : group) {
            if (!n.label().equals(rootLabel) && n.label().startsWith(prefix)) {
                out.add(n);
            }
        }
        return out;
    }

    /** Shortest-label members of {@code group}, in input order, with duplicates merged. */
    private static List<Node> rootsOf(List<Node> group) {
        int minLen = group.get(0).label().size();
        var withMin = new ArrayList<Node>();
        for (Node n : group) {
            int len = n.label().size();
            if (len == minLen) {
                withMin.add(n);
            } else if (len < minLen) {
                minLen = len;
                withMin.clear();
                withMin.add(n);
            }
        }
        return mergeDuplicates(withMin);
    }

    /** One pending call of the recursive formulation. */
    private static final class Frame {
        final Node owner;
        final List<Node> group;
        final List<Node> roots;
        int next;

        Frame(Node owner, List<Node> group) {
            this.owner = owner;
            this.group = group;
            this.roots = rootsOf(group);
        }
    }
}
