// file: src/main/java/io/regtree/storage/MemoryCheckpointer.java
package io.regtree.storage;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * In-process checkpointer backed by a concurrent map.
 * <p>
 * Behavior:
 *  - The effective key is {@code key + suffix}. The suffix starts empty and
 *    is set once a build knows which regulation/version it is working on,
 *    so later keys cannot collide across regulations.
 *  - A stored null counts as a hit.
 *  - Under a race two callers may both compute on a miss; last store wins.
 *    This is harmless because computations are pure.
 */
public final class MemoryCheckpointer implements Checkpointer {
    private static final Logger log = Logger.getLogger(MemoryCheckpointer.class.getName());

    // ConcurrentHashMap cannot hold null values.
    private static final Object NULL = new Object();

    private final Map<String, Object> store = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private volatile String suffix = "";

    public void setSuffix(String suffix) {
        this.suffix = suffix == null ? "" : suffix;
    }

    public String suffix() { return suffix; }

    @Override
    public <T> T checkpoint(String key, Supplier<T> compute) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(compute, "compute");

        String fullKey = key + suffix;
        Object cached = store.get(fullKey);
        if (cached != null) {
            hits.incrementAndGet();
            log.fine(() -> "checkpoint hit: " + fullKey);
            if (cached == NULL) return null;
            return unbox(cached);
        }

        misses.incrementAndGet();
        log.fine(() -> "checkpoint miss: " + fullKey);
        T value = compute.get();
        store.put(fullKey, value == null ? NULL : value);
        return value;
    }

    // Values under a key are only ever stored by a checkpoint call expecting the same T.
    @SuppressWarnings("unchecked")
    private static <T> T unbox(Object stored) {
        return (T) stored;
    }

    /** Drop every stored value whose effective key starts with {@code prefix}. */
    public void invalidate(String prefix) {
        store.keySet().removeIf(k -> k.startsWith(prefix));
    }

    public long hits() { return hits.get(); }

    public long misses() { return misses.get(); }

    public int size() { return store.size(); }
}
