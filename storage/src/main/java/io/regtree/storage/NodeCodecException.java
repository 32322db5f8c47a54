package io.regtree.storage;

/** Malformed JSON, or a node-shaped object that cannot be rebuilt as a Node. */
public class NodeCodecException extends RuntimeException {
    public NodeCodecException(String message) {
        super(message);
    }

    public NodeCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
