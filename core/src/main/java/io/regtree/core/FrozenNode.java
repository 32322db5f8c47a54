// file: src/main/java/io/regtree/core/FrozenNode.java
package io.regtree.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a regulation node and its subtree.
 * <p>
 * One version of a regulation is frozen exactly once, after which the tree
 * is used for diffing and as a cache key. Two trees frozen from independently
 * built but field-identical Node trees are equal and hash identically.
 * <p>
 * Design:
 *  - Value object: equals/hashCode cover text, children, label, title and
 *    nodeType. taggedText is carried for rendering only.
 *  - The hash is combined bottom-up at construction from the children's
 *    cached hashes, so hashing a whole tree is O(1) after it is built.
 *  - Equality walks both trees with an explicit stack and stops at the first
 *    pair whose cached hashes differ.
 *  - Thread safe by construction (no internal mutation except the memoized
 *    label id, which is idempotent).
 */
public final class FrozenNode implements TreeNode<FrozenNode> {

    private final String text;
    private final List<FrozenNode> children;
    private final Label label;
    private final String title;
    private final NodeType nodeType;
    private final String taggedText;
    private final int hash;

    private String labelId;

    public FrozenNode(String text, List<FrozenNode> children, Label label) {
        this(text, children, label, "", NodeType.REGTEXT, "");
    }

    public FrozenNode(String text, List<FrozenNode> children, Label label, String title,
                      NodeType nodeType, String taggedText) {
        this.text = text == null ? "" : text;
        this.children = List.copyOf(Objects.requireNonNull(children, "children"));
        this.label = label == null ? Label.EMPTY : label;
        this.title = title == null ? "" : title;
        this.nodeType = nodeType == null ? NodeType.REGTEXT : nodeType;
        this.taggedText = taggedText == null ? "" : taggedText;
        this.hash = computeHash();
    }

    /**
     * Deep conversion of a mutable tree. Children are converted before their
     * parent is built; the walk uses an explicit stack rather than recursion.
     */
    public static FrozenNode from(Node root) {
        Objects.requireNonNull(root, "root");

        // Post-order: a frame is finished once all of its children are frozen.
        var frames = new ArrayDeque<Frame>();
        frames.push(new Frame(root));
        FrozenNode result = null;

        while (!frames.isEmpty()) {
            Frame top = frames.peek();
            if (top.next < top.source.children().size()) {
                frames.push(new Frame(top.source.children().get(top.next++)));
                continue;
            }
            frames.pop();
            Node n = top.source;
            var frozen = new FrozenNode(
                    n.text(),
                    top.frozenChildren,
                    n.label(),
                    n.title().orElse(""),
                    n.nodeType(),
                    n.taggedText().orElse(""));
            if (frames.isEmpty()) {
                result = frozen;
            } else {
                frames.peek().frozenChildren.add(frozen);
            }
        }
        return result;
    }

    private static final class Frame {
        final Node source;
        final List<FrozenNode> frozenChildren;
        int next;

        Frame(Node source) {
            this.source = source;
            this.frozenChildren = new ArrayList<>(source.children().size());
        }
    }

    @Override public String text() { return text; }

    @Override public List<FrozenNode> children() { return children; }

    @Override public Label label() { return label; }

    /** Title, "" when the node has none. */
    public String title() { return title; }

    public NodeType nodeType() { return nodeType; }

    public String taggedText() { return taggedText; }

    @Override public String labelId() {
        String id = labelId;
        if (id == null) {
            id = label.id();
            labelId = id;
        }
        return id;
    }

    private int computeHash() {
        // wireName rather than the enum itself keeps the hash stable across JVM runs.
        int h = Objects.hash(text, label, title, nodeType.wireName());
        for (FrozenNode child : children) {
            h = 31 * h + child.hash;
        }
        return 31 * h + children.size();
    }

    @Override public int hashCode() { return hash; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrozenNode other)) return false;

        var pending = new ArrayDeque<FrozenNode[]>();
        pending.push(new FrozenNode[] {this, other});
        while (!pending.isEmpty()) {
            FrozenNode[] pair = pending.pop();
            FrozenNode a = pair[0], b = pair[1];
            if (a == b) continue;
            if (a.hash != b.hash) return false;
            if (!a.sameFields(b)) return false;
            for (int i = 0; i < a.children.size(); i++) {
                pending.push(new FrozenNode[] {a.children.get(i), b.children.get(i)});
            }
        }
        return true;
    }

    private boolean sameFields(FrozenNode b) {
        return children.size() == b.children.size()
                && text.equals(b.text)
                && label.equals(b.label)
                && title.equals(b.title)
                && nodeType == b.nodeType;
    }

    @Override public String toString() {
        return "FrozenNode(text=" + text
                + ", children=" + children
                + ", label=" + label
                + ", title=" + title
                + ", node_type=" + nodeType.wireName() + ")";
    }
}
