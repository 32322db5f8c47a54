package io.regtree.core.diff;

import io.regtree.core.FrozenNode;

import java.util.Map;

/**
 * Compares two frozen versions of one regulation.
 * <p>
 * Implementations must be pure: the same pair of trees always yields the
 * same map, which is what lets callers checkpoint diffs by version pair.
 * Comparing a tree against itself is well defined and yields an empty map.
 */
public interface DiffEngine {

    /**
     * @param lhs older (or left) version
     * @param rhs newer (or right) version
     * @return label id -> change, for every label whose node differs
     */
    Map<String, Change> changesBetween(FrozenNode lhs, FrozenNode rhs);
}
