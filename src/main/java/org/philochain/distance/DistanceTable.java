package org.philochain.distance;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.philochain.graph.EdgeStore;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable hop counts from every discovered node to the target.
 *
 * <p>A node without an entry does not reach the target: its walk dead-ends or loops without
 * passing through it. The target records the length of the loop back through itself when it
 * lies on one, and 0 otherwise.</p>
 *
 * <p>A table produced by a cancelled computation is valid but incomplete: every entry it
 * holds is final, further nodes may be missing.</p>
 */
public final class DistanceTable {
    /** Marker for nodes without an entry. */
    public static final int NOT_REACHED = -1;

    private final EdgeStore edgeStore;
    @Getter
    @Accessors(fluent = true)
    private final int targetId;
    private final int[] distances;
    private final int[] layerSizes;
    @Getter
    @Accessors(fluent = true)
    private final boolean complete;
    @Getter
    @Accessors(fluent = true)
    private final int size;
    @Getter
    @Accessors(fluent = true)
    private final int reachedDeclaredCount;
    @Getter
    @Accessors(fluent = true)
    private final int maxDistance;

    DistanceTable(EdgeStore edgeStore, int targetId, int[] distances, int[] layerSizes, boolean complete) {
        this.edgeStore = Objects.requireNonNull(edgeStore, "edgeStore");
        this.targetId = targetId;
        this.distances = distances;
        this.layerSizes = layerSizes;
        this.complete = complete;

        int entries = 0;
        int declaredEntries = 0;
        int max = 0;
        for (int nodeId = 0; nodeId < distances.length; nodeId++) {
            int distance = distances[nodeId];
            if (distance == NOT_REACHED) {
                continue;
            }
            entries++;
            if (edgeStore.isDeclared(nodeId)) {
                declaredEntries++;
            }
            if (distance > max) {
                max = distance;
            }
        }
        this.size = entries;
        this.reachedDeclaredCount = declaredEntries;
        this.maxDistance = max;
    }

    /**
     * Returns the hop count of a node or {@link #NOT_REACHED}.
     */
    public int distance(int nodeId) {
        if (nodeId < 0 || nodeId >= distances.length) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
        return distances[nodeId];
    }

    /**
     * Returns the hop count of an article, empty when it is unknown or does not reach the target.
     */
    public OptionalInt distance(String title) {
        int nodeId = edgeStore.idOf(title);
        if (nodeId == EdgeStore.NO_NODE || distances[nodeId] == NOT_REACHED) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(distances[nodeId]);
    }

    public boolean reaches(int nodeId) {
        return distance(nodeId) != NOT_REACHED;
    }

    public boolean contains(String title) {
        return distance(title).isPresent();
    }

    /**
     * Fraction of edge store articles that reach the target.
     */
    public double coverageRatio() {
        int total = edgeStore.size();
        return total == 0 ? 0.0d : (double) reachedDeclaredCount / total;
    }

    /**
     * Number of BFS layers expanded, the target's layer included.
     */
    public int layerCount() {
        return layerSizes.length;
    }

    /**
     * Number of nodes first discovered at one layer.
     */
    public int layerSize(int layer) {
        if (layer < 0 || layer >= layerSizes.length) {
            throw new IndexOutOfBoundsException("layer out of bounds: " + layer);
        }
        return layerSizes[layer];
    }

    public int nodeCount() {
        return distances.length;
    }

    public String targetTitle() {
        return edgeStore.title(targetId);
    }

    EdgeStore edgeStore() {
        return edgeStore;
    }

    @Override
    public String toString() {
        return "DistanceTable{target=" + targetTitle()
                + ", entries=" + size
                + ", coverage=" + String.format(Locale.ROOT, "%.4f", coverageRatio())
                + ", layers=" + Arrays.toString(layerSizes)
                + ", complete=" + complete + '}';
    }
}
