package org.philochain.distance;

import org.philochain.graph.EdgeStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Inverted distance index: distance -> articles at exactly that distance.
 *
 * <p>CSR layout like the reverse index: {@code offsets[d]..offsets[d + 1]} delimits the
 * bucket for distance {@code d} inside {@code nodes}, in ascending node id order. Built once
 * per distance table so repeated sampling costs O(1) per draw.</p>
 */
public final class DistanceBuckets {
    private final EdgeStore edgeStore;
    private final int[] offsets;
    private final int[] nodes;

    private DistanceBuckets(EdgeStore edgeStore, int[] offsets, int[] nodes) {
        this.edgeStore = edgeStore;
        this.offsets = offsets;
        this.nodes = nodes;
    }

    /**
     * Builds buckets for every entry of a distance table.
     */
    public static DistanceBuckets build(DistanceTable table) {
        Objects.requireNonNull(table, "table");
        int bucketCount = table.maxDistance() + 1;
        int[] counts = new int[bucketCount];
        int nodeCount = table.nodeCount();
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            int distance = table.distance(nodeId);
            if (distance != DistanceTable.NOT_REACHED) {
                counts[distance]++;
            }
        }

        int[] offsets = new int[bucketCount + 1];
        for (int d = 0; d < bucketCount; d++) {
            offsets[d + 1] = offsets[d] + counts[d];
        }
        int[] cursor = new int[bucketCount];
        System.arraycopy(offsets, 0, cursor, 0, bucketCount);
        int[] nodes = new int[offsets[bucketCount]];
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            int distance = table.distance(nodeId);
            if (distance != DistanceTable.NOT_REACHED) {
                nodes[cursor[distance]++] = nodeId;
            }
        }
        return new DistanceBuckets(table.edgeStore(), offsets, nodes);
    }

    /**
     * Number of articles at exactly {@code distance}; 0 for negative or out of range distances.
     */
    public int bucketSize(int distance) {
        if (distance < 0 || distance >= offsets.length - 1) {
            return 0;
        }
        return offsets[distance + 1] - offsets[distance];
    }

    /**
     * Titles at exactly {@code distance}, in node id order.
     */
    public List<String> nodesAt(int distance) {
        int size = bucketSize(distance);
        if (size == 0) {
            return Collections.emptyList();
        }
        List<String> titles = new ArrayList<>(size);
        for (int pos = offsets[distance], end = offsets[distance + 1]; pos < end; pos++) {
            titles.add(edgeStore.title(nodes[pos]));
        }
        return titles;
    }

    /**
     * Draws one article uniformly from the bucket at {@code distance}.
     *
     * @return {@link SampleResult.Status#EMPTY_BUCKET} when no article lies at that distance.
     */
    public SampleResult sample(int distance, RandomGenerator random) {
        Objects.requireNonNull(random, "random");
        int size = bucketSize(distance);
        if (size == 0) {
            return SampleResult.emptyBucket(distance);
        }
        int nodeId = nodes[offsets[distance] + random.nextInt(size)];
        return SampleResult.sampled(distance, edgeStore.title(nodeId), size);
    }

    /**
     * Largest distance with a bucket, or -1 when there are none.
     */
    public int maxDistance() {
        return offsets.length - 2;
    }
}
