package org.philochain.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntConsumer;

/**
 * Immutable predecessor index: for every node, the nodes whose first link points at it.
 *
 * <p>Backed by CSR-style arrays where each node maps to a contiguous range inside
 * {@code predecessors}, sorted by ascending node id. {@code p} is listed under {@code n}
 * exactly when {@code successorOf(p) == n}; unresolved edges contribute nothing.</p>
 */
public final class ReverseIndex {
    private static final Logger log = LogManager.getLogger(ReverseIndex.class);

    private final int nodeCount;
    private final int[] firstPredecessorByNode;
    private final int[] predecessors;

    private ReverseIndex(int nodeCount, int[] firstPredecessorByNode, int[] predecessors) {
        this.nodeCount = nodeCount;
        this.firstPredecessorByNode = firstPredecessorByNode;
        this.predecessors = predecessors;
    }

    /**
     * Builds the index in one pass over the edge store.
     */
    public static ReverseIndex build(EdgeStore edgeStore) {
        Objects.requireNonNull(edgeStore, "edgeStore");
        long started = System.nanoTime();
        int nodeCount = edgeStore.nodeCount();
        int edgeCount = edgeStore.resolvedEdgeCount();

        int[] incomingDegree = new int[nodeCount];
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            int successor = edgeStore.successorOf(nodeId);
            if (successor != EdgeStore.UNRESOLVED) {
                incomingDegree[successor]++;
            }
        }

        int[] firstPredecessor = new int[nodeCount + 1];
        int cursor = 0;
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            firstPredecessor[nodeId] = cursor;
            cursor += incomingDegree[nodeId];
        }
        firstPredecessor[nodeCount] = edgeCount;

        int[] fillCursor = Arrays.copyOf(firstPredecessor, firstPredecessor.length);
        int[] predecessors = new int[edgeCount];
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            int successor = edgeStore.successorOf(nodeId);
            if (successor != EdgeStore.UNRESOLVED) {
                predecessors[fillCursor[successor]++] = nodeId;
            }
        }
        log.info("Built reverse index over {} nodes / {} edges in {} ms",
                nodeCount, edgeCount, (System.nanoTime() - started) / 1_000_000L);
        return new ReverseIndex(nodeCount, firstPredecessor, predecessors);
    }

    /**
     * Builds the index by partitioning the node id range across {@code executor}.
     * <p>
     * Each partition counts the in-degrees of its own slice; counts are merged into offsets and
     * per-partition write cursors, then every partition fills a disjoint set of slots. The
     * result is identical to {@link #build(EdgeStore)}.
     *
     * @param edgeStore source edges.
     * @param partitions requested partition count, clamped to [1, nodeCount].
     * @param executor executor running the partition tasks; not shut down by this method.
     */
    public static ReverseIndex buildParallel(EdgeStore edgeStore, int partitions, ExecutorService executor) {
        Objects.requireNonNull(edgeStore, "edgeStore");
        Objects.requireNonNull(executor, "executor");
        if (partitions <= 0) {
            throw new IllegalArgumentException("partitions must be > 0");
        }
        int nodeCount = edgeStore.nodeCount();
        int effective = Math.max(1, Math.min(partitions, nodeCount));
        if (effective == 1) {
            return build(edgeStore);
        }
        long started = System.nanoTime();
        int edgeCount = edgeStore.resolvedEdgeCount();
        int sliceSize = (nodeCount + effective - 1) / effective;

        int[][] partitionCounts = new int[effective][];
        List<Callable<Void>> countTasks = new ArrayList<>(effective);
        for (int p = 0; p < effective; p++) {
            int partition = p;
            int from = Math.min(nodeCount, p * sliceSize);
            int to = Math.min(nodeCount, from + sliceSize);
            countTasks.add(() -> {
                int[] counts = new int[nodeCount];
                for (int nodeId = from; nodeId < to; nodeId++) {
                    int successor = edgeStore.successorOf(nodeId);
                    if (successor != EdgeStore.UNRESOLVED) {
                        counts[successor]++;
                    }
                }
                partitionCounts[partition] = counts;
                return null;
            });
        }
        runAll(executor, countTasks);

        // Turn per-partition counts into per-partition write cursors.
        int[] firstPredecessor = new int[nodeCount + 1];
        int running = 0;
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            firstPredecessor[nodeId] = running;
            for (int p = 0; p < effective; p++) {
                int count = partitionCounts[p][nodeId];
                partitionCounts[p][nodeId] = running;
                running += count;
            }
        }
        firstPredecessor[nodeCount] = edgeCount;

        int[] predecessors = new int[edgeCount];
        List<Callable<Void>> fillTasks = new ArrayList<>(effective);
        for (int p = 0; p < effective; p++) {
            int[] cursors = partitionCounts[p];
            int from = Math.min(nodeCount, p * sliceSize);
            int to = Math.min(nodeCount, from + sliceSize);
            fillTasks.add(() -> {
                for (int nodeId = from; nodeId < to; nodeId++) {
                    int successor = edgeStore.successorOf(nodeId);
                    if (successor != EdgeStore.UNRESOLVED) {
                        predecessors[cursors[successor]++] = nodeId;
                    }
                }
                return null;
            });
        }
        runAll(executor, fillTasks);

        log.info("Built reverse index over {} nodes / {} edges with {} partitions in {} ms",
                nodeCount, edgeCount, effective, (System.nanoTime() - started) / 1_000_000L);
        return new ReverseIndex(nodeCount, firstPredecessor, predecessors);
    }

    private static void runAll(ExecutorService executor, List<Callable<Void>> tasks) {
        try {
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("reverse index build interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("reverse index partition failed", e.getCause());
        }
    }

    /**
     * Returns start index (inclusive) in the predecessor array for one node.
     */
    public int start(int nodeId) {
        validateNode(nodeId);
        return firstPredecessorByNode[nodeId];
    }

    /**
     * Returns end index (exclusive) in the predecessor array for one node.
     */
    public int end(int nodeId) {
        validateNode(nodeId);
        return firstPredecessorByNode[nodeId + 1];
    }

    /**
     * Returns the predecessor stored at one position of the predecessor array.
     */
    public int predecessorAtPosition(int position) {
        return predecessors[position];
    }

    public int predecessorCount(int nodeId) {
        return end(nodeId) - start(nodeId);
    }

    /**
     * Returns the {@code index}-th predecessor of a node, in ascending id order.
     */
    public int predecessor(int nodeId, int index) {
        int start = start(nodeId);
        int count = firstPredecessorByNode[nodeId + 1] - start;
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("predecessor index " + index + " out of [0," + count + ")");
        }
        return predecessors[start + index];
    }

    public void forEachPredecessor(int nodeId, IntConsumer action) {
        int end = end(nodeId);
        for (int pos = firstPredecessorByNode[nodeId]; pos < end; pos++) {
            action.accept(predecessors[pos]);
        }
    }

    /**
     * Returns a copy of the predecessors of one node.
     */
    public int[] predecessors(int nodeId) {
        return Arrays.copyOfRange(predecessors, start(nodeId), end(nodeId));
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int edgeCount() {
        return predecessors.length;
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }
}
