// file: src/main/java/io/regtree/storage/Checkpointer.java
package io.regtree.storage;

import java.util.function.Supplier;

/**
 * Wraps expensive steps of a build (tree construction, a diff between two
 * versions) so they can be skipped when their result is already known.
 * <p>
 * Contract:
 *  - On a hit, {@code compute} is not invoked and the stored value is returned.
 *  - On a miss, {@code compute} runs and its result is stored under {@code key}.
 * <p>
 * Keys are chosen by the caller, typically from a content digest and version
 * ids (e.g. "init-tree-&lt;sha256&gt;", "diff-&lt;lhs&gt;-&lt;rhs&gt;"). Trees are
 * safe to use as cached values because frozen trees are immutable values.
 */
public interface Checkpointer {

    <T> T checkpoint(String key, Supplier<T> compute);
}
