package org.philochain.graph;

import java.util.BitSet;

/**
 * A memory-efficient set of node ids visited by one traversal.
 * <p>
 * Wraps a {@link java.util.BitSet}: O(1) membership at roughly one bit per node, which keeps
 * a full-graph seen set for millions of articles under a megabyte.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe. One instance belongs to one traversal.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;
    private int count;

    /**
     * @param initialCapacity expected node count, to avoid resizing during the traversal.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
    }

    /**
     * Marks a node as visited if it hasn't been visited already.
     *
     * @return {@code true} if the node was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        count++;
        return true;
    }

    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }

    /**
     * Number of distinct nodes marked so far.
     */
    public int size() {
        return count;
    }

    public void clear() {
        visited.clear();
        count = 0;
    }
}
