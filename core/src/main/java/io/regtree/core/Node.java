// file: src/main/java/io/regtree/core/Node.java
package io.regtree.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable regulation node, built by the markup parser and by {@link TreeBuilder}.
 * <p>
 * Invariants:
 *  - text is never null ("" when absent).
 *  - children is an owned list: every constructor and {@link #setChildren}
 *    copy the supplied list, so two nodes never share one.
 *  - title is either absent or non-empty.
 *  - nodeType defaults to {@link NodeType#REGTEXT}.
 * <p>
 * sourceXml is an opaque back-reference to the originating markup. It is
 * not part of identity, never serialized and never compared.
 * <p>
 * equals/hashCode/compareTo are defined over the canonical textual form
 * ({@link #toString()}) and exist for deterministic ordering in tests.
 * A Node tree is owned by a single build and is not safe for concurrent mutation.
 */
public final class Node implements TreeNode<Node>, Comparable<Node> {

    private String text;
    private final List<Node> children;
    private Label label;
    private String title;
    private NodeType nodeType;
    private String taggedText;
    private Object sourceXml;

    public Node(String text) {
        this(text, List.of(), Label.EMPTY, null, NodeType.REGTEXT, null);
    }

    public Node(String text, List<Node> children, Label label) {
        this(text, children, label, null, NodeType.REGTEXT, null);
    }

    public Node(String text, List<Node> children, Label label, String title, NodeType nodeType) {
        this(text, children, label, title, nodeType, null);
    }

    public Node(String text, List<Node> children, Label label, String title,
                NodeType nodeType, Object sourceXml) {
        this.text = text == null ? "" : text;
        this.children = new ArrayList<>(Objects.requireNonNull(children, "children"));
        this.label = label == null ? Label.EMPTY : label;
        this.title = normalizeTitle(title);
        this.nodeType = nodeType == null ? NodeType.REGTEXT : nodeType;
        this.sourceXml = sourceXml;
    }

    @Override public String text() { return text; }

    public void setText(String text) { this.text = text == null ? "" : text; }

    /** Live, mutable list of children. */
    @Override public List<Node> children() { return children; }

    /** Replace all children with a copy of {@code newChildren}. */
    public void setChildren(List<Node> newChildren) {
        var copy = new ArrayList<>(Objects.requireNonNull(newChildren, "children"));
        children.clear();
        children.addAll(copy);
    }

    @Override public Label label() { return label; }

    public void setLabel(Label label) { this.label = label == null ? Label.EMPTY : label; }

    public Optional<String> title() { return Optional.ofNullable(title); }

    public void setTitle(String title) { this.title = normalizeTitle(title); }

    public NodeType nodeType() { return nodeType; }

    public void setNodeType(NodeType nodeType) {
        this.nodeType = nodeType == null ? NodeType.REGTEXT : nodeType;
    }

    /** Markup-preserving variant of the text, attached by layer steps; absent by default. */
    public Optional<String> taggedText() { return Optional.ofNullable(taggedText); }

    public void setTaggedText(String taggedText) {
        this.taggedText = taggedText == null || taggedText.isEmpty() ? null : taggedText;
    }

    public Object sourceXml() { return sourceXml; }

    public void setSourceXml(Object sourceXml) { this.sourceXml = sourceXml; }

    private static String normalizeTitle(String title) {
        return title == null || title.isEmpty() ? null : title;
    }

    @Override public int compareTo(Node other) {
        return toString().compareTo(other.toString());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return toString().equals(other.toString());
    }

    @Override public int hashCode() { return toString().hashCode(); }

    @Override public String toString() {
        var sb = new StringBuilder();
        render(this, sb);
        return sb.toString();
    }

    private static void render(Node n, StringBuilder sb) {
        sb.append("Node(text=").append(quote(n.text)).append(", children=[");
        for (int i = 0; i < n.children.size(); i++) {
            if (i > 0) sb.append(", ");
            render(n.children.get(i), sb);
        }
        sb.append("], label=").append(n.label)
          .append(", title=").append(n.title == null ? "None" : quote(n.title))
          .append(", node_type=").append(n.nodeType.wireName())
          .append(')');
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
