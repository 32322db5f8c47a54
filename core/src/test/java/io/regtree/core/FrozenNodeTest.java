package io.regtree.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of frozen snapshots:
 *  - independently built, field-identical trees are equal and hash the same,
 *  - a change to any identity field anywhere breaks both.
 */
class FrozenNodeTest {

    /** A fresh, independently allocated three-level tree. */
    private static Node build() {
        var a = new Node("(a) First.", List.of(), Label.of("1005", "2", "a"));
        var b = new Node("(b) Second.", List.of(), Label.of("1005", "2", "b"));
        var sec = new Node("", List.of(a, b), Label.of("1005", "2"), "§ 1005.2 Definitions.", NodeType.REGTEXT);
        var app = new Node("Appendix text", List.of(), Label.of("1005", "A"), "Appendix A", NodeType.APPENDIX);
        return new Node("Part text", List.of(sec, app), Label.of("1005"), "PART 1005", NodeType.REGTEXT);
    }

    private static void assertChangeDetected(Consumer<Node> edit) {
        FrozenNode original = FrozenNode.from(build());
        Node changed = build();
        edit.accept(changed);
        FrozenNode other = FrozenNode.from(changed);

        assertNotEquals(original, other);
        assertNotEquals(original.hashCode(), other.hashCode());
    }

    @Test
    void independent_identical_trees_are_equal_and_hash_identically() {
        FrozenNode t1 = FrozenNode.from(build());
        FrozenNode t2 = FrozenNode.from(build());

        assertNotSame(t1, t2);
        assertEquals(t1, t2);
        assertEquals(t1.hashCode(), t2.hashCode());

        var cache = new HashMap<FrozenNode, String>();
        cache.put(t1, "v1");
        assertEquals("v1", cache.get(t2));
    }

    @Test
    void any_field_change_breaks_equality_and_hash() {
        assertChangeDetected(root -> root.setText("Part text!"));
        assertChangeDetected(root -> root.children().get(0).children().get(1).setText("(b) Changed."));
        assertChangeDetected(root -> root.children().get(0).children().get(0)
                .setLabel(Label.of("1005", "2", "c")));
        assertChangeDetected(root -> root.children().get(1).setTitle("Appendix B"));
        assertChangeDetected(root -> root.children().get(0).children().remove(1));
        assertChangeDetected(root -> root.children().get(1).setNodeType(NodeType.INTERP));
    }

    @Test
    void tagged_text_and_source_xml_are_not_part_of_identity() {
        Node tagged = build();
        tagged.setTaggedText("<E T=\"03\">Part</E> text");
        tagged.setSourceXml(new Object());

        FrozenNode plain = FrozenNode.from(build());
        FrozenNode withTags = FrozenNode.from(tagged);

        assertEquals(plain, withTags);
        assertEquals(plain.hashCode(), withTags.hashCode());
        assertEquals("<E T=\"03\">Part</E> text", withTags.taggedText());
        assertEquals("", plain.taggedText());
    }

    @Test
    void from_copies_fields_and_preserves_child_order() {
        FrozenNode root = FrozenNode.from(build());

        assertEquals("Part text", root.text());
        assertEquals("PART 1005", root.title());
        assertEquals(NodeType.REGTEXT, root.nodeType());
        assertEquals(List.of("1005-2", "1005-A"),
                root.children().stream().map(FrozenNode::labelId).toList());

        FrozenNode sec = root.children().get(0);
        assertEquals(List.of("(a) First.", "(b) Second."),
                sec.children().stream().map(FrozenNode::text).toList());
        assertEquals("", sec.children().get(0).title());
        assertEquals(NodeType.APPENDIX, root.children().get(1).nodeType());
    }

    @Test
    void frozen_tree_is_detached_from_the_mutable_tree() {
        Node source = build();
        FrozenNode frozen = FrozenNode.from(source);
        FrozenNode before = FrozenNode.from(build());

        source.setText("edited after freezing");
        source.children().clear();

        assertEquals(before, frozen);
        assertThrows(UnsupportedOperationException.class,
                () -> frozen.children().add(new FrozenNode("x", List.of(), Label.EMPTY)));
    }

    @Test
    void constructor_defaults_and_label_id() {
        var n = new FrozenNode(null, List.of(), Label.of("1005", "Interp"), null, null, null);
        assertEquals("", n.text());
        assertEquals("", n.title());
        assertEquals("", n.taggedText());
        assertEquals(NodeType.REGTEXT, n.nodeType());
        assertEquals("1005-Interp", n.labelId());
        assertSame(n.labelId(), n.labelId());
    }

    @Test
    void usable_as_set_members() {
        var set = new HashSet<FrozenNode>();
        set.add(FrozenNode.from(build()));
        set.add(FrozenNode.from(build()));
        assertEquals(1, set.size());
        assertFalse(FrozenNode.from(build()).equals("not a node"));
    }
}
