// file: src/main/java/io/regtree/core/Trees.java
package io.regtree.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Generic traversals over either tree form ({@link Node} or {@link FrozenNode}).
 * <p>
 * All traversals are pre-order (a node before its children, children
 * left-to-right) and use an explicit stack, so tree depth is not bounded
 * by the call stack.
 */
public final class Trees {

    private Trees() {}

    /**
     * Apply {@code visit} to every node in pre-order and collect the non-null results.
     * <p>
     * A node's children are read after {@code visit} returns, so a visitor
     * that edits the children of the node it is given sees the edit reflected
     * in the rest of the walk. The walk itself never mutates.
     *
     * @return results in visit order; nodes for which visit returned null contribute nothing
     */
    public static <N extends TreeNode<N>, R> List<R> walk(N root, Function<? super N, ? extends R> visit) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(visit, "visit");

        var results = new ArrayList<R>();
        var stack = new ArrayDeque<N>();
        stack.push(root);
        while (!stack.isEmpty()) {
            N node = stack.pop();
            R r = visit.apply(node);
            if (r != null) results.add(r);

            List<N> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return results;
    }

    /** First node in pre-order whose label id equals {@code labelId}. */
    public static <N extends TreeNode<N>> Optional<N> find(N root, String labelId) {
        Objects.requireNonNull(root, "root");
        var stack = new ArrayDeque<N>();
        stack.push(root);
        while (!stack.isEmpty()) {
            N node = stack.pop();
            if (node.labelId().equals(labelId)) return Optional.of(node);

            List<N> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return Optional.empty();
    }

    /** Text of {@code node} and all its descendants, concatenated in pre-order. */
    public static <N extends TreeNode<N>> String joinText(N node) {
        return String.join("", walk(node, TreeNode::text));
    }
}
