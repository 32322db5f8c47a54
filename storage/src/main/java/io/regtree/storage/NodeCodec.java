// file: src/main/java/io/regtree/storage/NodeCodec.java
package io.regtree.storage;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.regtree.core.InvalidLabelException;
import io.regtree.core.Label;
import io.regtree.core.Node;
import io.regtree.core.NodeType;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical JSON form of {@link Node}.
 * <p>
 * Encoded shape:
 * <pre>
 *   {
 *     "text": "...",
 *     "children": [ ...same shape... ],
 *     "label": ["1005", "2", "a"],
 *     "node_type": "regtext",
 *     "title": "..."            (only when the node has a title)
 *   }
 * </pre>
 * sourceXml and taggedText are never written.
 * <p>
 * Decoding is bottom-up over a whole document. Every object carrying at least
 * text, children, label and node_type is rebuilt as a Node; any other object
 * stays a plain {@code Map<String, Object>}. This lets node-shaped and
 * non-node-shaped objects live in one document (e.g. a layer keyed by label).
 * <p>
 * Each tree level costs two JSON nesting levels (object + children array), so
 * the mapper's nesting limits are raised to {@link #MAX_NESTING_DEPTH}. Both
 * directions walk the tree with an explicit stack.
 */
public final class NodeCodec {

    static final Set<String> REQUIRED_KEYS = Set.of("text", "children", "label", "node_type");

    /** JSON nesting limit for reads and writes; roughly half of it in tree depth. */
    public static final int MAX_NESTING_DEPTH = 100_000;

    private final ObjectMapper mapper;

    public NodeCodec() {
        this(false);
    }

    public NodeCodec(boolean pretty) {
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH).build())
                .streamWriteConstraints(StreamWriteConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH).build())
                .build();
        this.mapper = new ObjectMapper(factory).registerModule(module());
        if (pretty) mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Jackson module that writes {@link Node} values in the canonical shape. */
    public static SimpleModule module() {
        var m = new SimpleModule("regtree-node");
        m.addSerializer(Node.class, new NodeSerializer());
        return m;
    }

    /** Mapper with {@link #module()} registered, for callers encoding larger documents. */
    public ObjectMapper mapper() { return mapper; }

    /** Encode a node, or any document (maps, lists, records) containing nodes. */
    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new NodeCodecException("failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decode a whole document. Node-shaped objects come back as {@link Node},
     * other objects as maps, arrays as lists, scalars as their Java values.
     */
    public Object decode(String json) {
        return convert(readTree(json));
    }

    /** Decode a document whose top-level value must be node-shaped. */
    public Node decodeNode(String json) {
        JsonNode tree = readTree(json);
        return tryNode(tree).orElseThrow(() ->
                new NodeCodecException("document is not node-shaped; missing one of " + REQUIRED_KEYS));
    }

    /**
     * Decode fragments for reconstruction: either one node object or an array of them.
     */
    public List<Node> decodeFragments(String json) {
        JsonNode tree = readTree(json);
        if (tree.isObject()) return new ArrayList<>(List.of(decodeNodeValue(tree, "$")));
        if (!tree.isArray()) throw new NodeCodecException("expected a node object or an array of nodes");

        var out = new ArrayList<Node>(tree.size());
        for (int i = 0; i < tree.size(); i++) {
            out.add(decodeNodeValue(tree.get(i), "$[" + i + "]"));
        }
        return out;
    }

    /**
     * The fallible parse step: a Node when {@code obj} carries every required
     * key, empty when it does not.
     *
     * @throws NodeCodecException when the object is node-shaped but malformed
     */
    public Optional<Node> tryNode(JsonNode obj) {
        if (!isNodeShaped(obj)) return Optional.empty();

        // Post-order: a node is built once all of its children are.
        var frames = new ArrayDeque<DecodeFrame>();
        frames.push(new DecodeFrame(obj));
        Node result = null;

        while (!frames.isEmpty()) {
            DecodeFrame top = frames.peek();
            if (top.next < top.childrenJson.size()) {
                int i = top.next++;
                JsonNode child = top.childrenJson.get(i);
                if (!isNodeShaped(child)) throw new NodeCodecException("children[" + i + "] is not node-shaped");
                frames.push(new DecodeFrame(child));
                continue;
            }
            frames.pop();
            Node built = buildNode(top.obj, top.children);
            if (frames.isEmpty()) {
                result = built;
            } else {
                frames.peek().children.add(built);
            }
        }
        return Optional.of(result);
    }

    private static boolean isNodeShaped(JsonNode obj) {
        if (obj == null || !obj.isObject()) return false;
        for (String key : REQUIRED_KEYS) {
            if (!obj.has(key)) return false;
        }
        return true;
    }

    private static final class DecodeFrame {
        final JsonNode obj;
        final JsonNode childrenJson;
        final List<Node> children;
        int next;

        DecodeFrame(JsonNode obj) {
            this.obj = obj;
            this.childrenJson = obj.get("children");
            if (!childrenJson.isArray()) throw new NodeCodecException("children must be an array");
            this.children = new ArrayList<>(childrenJson.size());
        }
    }

    private static Node buildNode(JsonNode obj, List<Node> children) {
        Label label;
        try {
            label = Label.of(labelSegments(obj.get("label")));
        } catch (InvalidLabelException e) {
            throw new NodeCodecException("invalid label " + obj.get("label"), e);
        }

        NodeType type;
        try {
            type = NodeType.fromWire(obj.get("node_type").asText());
        } catch (IllegalArgumentException e) {
            throw new NodeCodecException(e.getMessage(), e);
        }

        JsonNode title = obj.get("title");
        return new Node(
                textOf(obj.get("text")),
                children,
                label,
                title == null || title.isNull() ? null : title.asText(),
                type);
    }

    private Node decodeNodeValue(JsonNode value, String where) {
        return tryNode(value).orElseThrow(() ->
                new NodeCodecException(where + " is not node-shaped"));
    }

    private Object convert(JsonNode n) {
        if (n.isObject()) {
            Optional<Node> node = tryNode(n);
            if (node.isPresent()) return node.get();

            var map = new LinkedHashMap<String, Object>();
            Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
            while (fields.hasNext()) {
                var e = fields.next();
                map.put(e.getKey(), convert(e.getValue()));
            }
            return map;
        }
        if (n.isArray()) {
            var list = new ArrayList<Object>(n.size());
            for (JsonNode item : n) list.add(convert(item));
            return list;
        }
        if (n.isNull() || n.isMissingNode()) return null;
        if (n.isTextual()) return n.textValue();
        if (n.isBoolean()) return n.booleanValue();
        if (n.isNumber()) return n.numberValue();
        return n.asText();
    }

    private static List<Object> labelSegments(JsonNode label) {
        if (!label.isArray()) throw new InvalidLabelException("label must be an array");
        var out = new ArrayList<Object>(label.size());
        for (JsonNode seg : label) {
            // Non-string segments are passed through so Label rejects them.
            out.add(seg.isTextual() ? seg.textValue() : seg);
        }
        return out;
    }

    private static String textOf(JsonNode text) {
        return text.isNull() ? "" : text.asText();
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new NodeCodecException("malformed JSON", e);
        }
    }

    /** Writes the canonical shape, depth first with an explicit stack. */
    static final class NodeSerializer extends StdSerializer<Node> {

        NodeSerializer() {
            super(Node.class);
        }

        @Override
        public void serialize(Node root, JsonGenerator gen, SerializerProvider provider) throws IOException {
            var frames = new ArrayDeque<EncodeFrame>();
            frames.push(open(root, gen));

            while (!frames.isEmpty()) {
                EncodeFrame top = frames.peek();
                if (top.next < top.node.children().size()) {
                    frames.push(open(top.node.children().get(top.next++), gen));
                    continue;
                }
                frames.pop();
                close(top.node, gen);
            }
        }

        private static EncodeFrame open(Node node, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("text", node.text());
            gen.writeArrayFieldStart("children");
            return new EncodeFrame(node);
        }

        private static void close(Node node, JsonGenerator gen) throws IOException {
            gen.writeEndArray();
            gen.writeArrayFieldStart("label");
            for (String seg : node.label()) {
                gen.writeString(seg);
            }
            gen.writeEndArray();
            gen.writeStringField("node_type", node.nodeType().wireName());
            if (node.title().isPresent()) {
                gen.writeStringField("title", node.title().get());
            }
            gen.writeEndObject();
        }
    }

    private static final class EncodeFrame {
        final Node node;
        int next;

        EncodeFrame(Node node) {
            this.node = node;
        }
    }
}
