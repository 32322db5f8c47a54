package io.regtree.storage;

import io.regtree.core.FrozenNode;
import io.regtree.core.Label;
import io.regtree.core.Node;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hit/miss behavior of the checkpoint contract.
 */
class CheckpointerTest {

    @Test
    void memory_checkpointer_skips_compute_on_hit() {
        var cp = new MemoryCheckpointer();
        var calls = new AtomicInteger();

        String first = cp.checkpoint("doc-number-abc", () -> "2011-31725-" + calls.incrementAndGet());
        String second = cp.checkpoint("doc-number-abc", () -> "2011-31725-" + calls.incrementAndGet());

        assertEquals("2011-31725-1", first);
        assertEquals("2011-31725-1", second);
        assertEquals(1, calls.get());
        assertEquals(1, cp.hits());
        assertEquals(1, cp.misses());
    }

    @Test
    void stored_null_is_a_hit() {
        var cp = new MemoryCheckpointer();
        var calls = new AtomicInteger();

        assertNull(cp.checkpoint("k", () -> { calls.incrementAndGet(); return null; }));
        assertNull(cp.checkpoint("k", () -> { calls.incrementAndGet(); return "late"; }));
        assertEquals(1, calls.get());
    }

    @Test
    void suffix_separates_keys() {
        var cp = new MemoryCheckpointer();
        cp.checkpoint("diff-a-b", () -> "before");

        cp.setSuffix(":1005:12:2011-31725");
        assertEquals("after", cp.checkpoint("diff-a-b", () -> "after"));
        assertEquals(2, cp.size());

        cp.setSuffix(null);
        assertEquals("before", cp.checkpoint("diff-a-b", () -> "ignored"));
    }

    @Test
    void invalidate_drops_matching_keys() {
        var cp = new MemoryCheckpointer();
        cp.checkpoint("diff-a-b", () -> 1);
        cp.checkpoint("diff-b-a", () -> 2);
        cp.checkpoint("init-tree-x", () -> 3);

        cp.invalidate("diff-");

        assertEquals(1, cp.size());
        Integer recomputed = cp.checkpoint("diff-a-b", () -> 4);
        assertEquals(4, recomputed);
    }

    @Test
    void frozen_trees_work_as_cached_values() {
        var cp = new MemoryCheckpointer();
        var tree = FrozenNode.from(new Node("x", List.of(), Label.of("1005")));

        FrozenNode cached = cp.checkpoint("init-tree-1", () -> tree);
        FrozenNode again = cp.checkpoint("init-tree-1",
                () -> FrozenNode.from(new Node("other", List.of(), Label.of("1005"))));

        assertSame(cached, again);
    }

    @Test
    void null_checkpointer_always_computes() {
        var cp = new NullCheckpointer();
        var calls = new AtomicInteger();

        cp.checkpoint("k", calls::incrementAndGet);
        cp.checkpoint("k", calls::incrementAndGet);

        assertEquals(2, calls.get());
    }
}
