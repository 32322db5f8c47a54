// file: src/main/java/io/regtree/core/NodeType.java
package io.regtree.core;

/**
 * Kind of a regulation node.
 * <p>
 * Interpretation:
 *  - REGTEXT:   body text of the regulation (the default).
 *  - APPENDIX:  appendix content.
 *  - INTERP:    official interpretation (supplement) content.
 *  - SUBPART:   a subpart grouping sections.
 *  - EMPTYPART: a grouping that exists only to hold sections without a subpart.
 */
public enum NodeType {
    REGTEXT("regtext"),
    APPENDIX("appendix"),
    INTERP("interp"),
    SUBPART("subpart"),
    EMPTYPART("emptypart");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in the JSON form ("regtext", "appendix", ...). */
    public String wireName() { return wireName; }

    public static NodeType fromWire(String name) {
        for (NodeType t : values()) {
            if (t.wireName.equals(name)) return t;
        }
        throw new IllegalArgumentException("unknown node_type: " + name);
    }
}
