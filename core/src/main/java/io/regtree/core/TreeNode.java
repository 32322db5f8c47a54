package io.regtree.core;

import java.util.List;

/**
 * Read view shared by the mutable {@link Node} and the immutable {@link FrozenNode},
 * so traversal and diffing are written once for both tree forms.
 *
 * @param <N> the concrete node type of the tree
 */
public interface TreeNode<N extends TreeNode<N>> {

    String text();

    /** Children in document order. */
    List<N> children();

    Label label();

    /** The label rendered as a single string, segments joined by '-'. */
    default String labelId() { return label().id(); }
}
