package io.regtree.core;

/**
 * Raised when label input cannot be turned into a {@link Label}
 * (null or non-string segments). Never retried.
 */
public class InvalidLabelException extends IllegalArgumentException {
    public InvalidLabelException(String message) {
        super(message);
    }
}
