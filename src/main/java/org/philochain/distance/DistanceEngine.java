package org.philochain.distance;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.philochain.graph.EdgeStore;
import org.philochain.graph.ReverseIndex;
import org.philochain.graph.VisitedSet;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Layered breadth-first expansion from the target over the reverse index.
 *
 * <p>Layer 0 is the target. Layer {@code k + 1} is every predecessor of a layer {@code k} node
 * not already in the global seen set; each gets distance {@code k + 1}. A whole layer is
 * expanded before the next one starts, and expansion halts at the first empty layer.</p>
 *
 * <p>The seen set is private to one computation and the reverse index is only read, so the
 * same index keeps serving navigation and later computations. Each distance slot is written
 * at most once. The target's own slot stays empty until it is rediscovered as a predecessor
 * (it then records the length of its loop) and falls back to 0 when it never is.</p>
 */
public final class DistanceEngine {
    private static final Logger log = LogManager.getLogger(DistanceEngine.class);

    private final EdgeStore edgeStore;
    private final ReverseIndex reverseIndex;

    public DistanceEngine(EdgeStore edgeStore, ReverseIndex reverseIndex) {
        this.edgeStore = Objects.requireNonNull(edgeStore, "edgeStore");
        this.reverseIndex = Objects.requireNonNull(reverseIndex, "reverseIndex");
        if (reverseIndex.nodeCount() != edgeStore.nodeCount()) {
            throw new IllegalArgumentException(
                    "reverse index node count " + reverseIndex.nodeCount()
                            + " != edge store node count " + edgeStore.nodeCount()
            );
        }
    }

    /**
     * Computes the full distance table for a target without cancellation or progress reporting.
     */
    public DistanceTable compute(int targetId) {
        return compute(targetId, CancellationToken.create(), LayerListener.NONE);
    }

    /**
     * Computes the distance table for a target.
     *
     * @param targetId target node id.
     * @param cancellation polled before each layer; a cancelled run returns an incomplete table.
     * @param listener invoked after each expanded layer.
     * @return immutable distance table.
     */
    public DistanceTable compute(int targetId, CancellationToken cancellation, LayerListener listener) {
        Objects.requireNonNull(cancellation, "cancellation");
        Objects.requireNonNull(listener, "listener");
        int nodeCount = edgeStore.nodeCount();
        if (targetId < 0 || targetId >= nodeCount) {
            throw new IndexOutOfBoundsException("targetId out of bounds: " + targetId);
        }

        long started = System.nanoTime();
        int[] distances = new int[nodeCount];
        Arrays.fill(distances, DistanceTable.NOT_REACHED);
        VisitedSet seen = new VisitedSet(nodeCount);
        seen.markVisited(targetId);

        IntArrayList layerSizes = new IntArrayList();
        IntArrayList frontier = new IntArrayList();
        frontier.add(targetId);
        layerSizes.add(1);

        boolean complete = true;
        int layer = 0;
        while (!frontier.isEmpty()) {
            if (cancellation.isCancelled()) {
                complete = false;
                log.warn("Distance computation to '{}' cancelled after {} layers ({} nodes seen)",
                        edgeStore.title(targetId), layer, seen.size());
                break;
            }
            long layerStarted = System.nanoTime();
            int nextDistance = layer + 1;
            IntArrayList next = new IntArrayList();
            for (int i = 0, n = frontier.size(); i < n; i++) {
                int nodeId = frontier.getInt(i);
                int end = reverseIndex.end(nodeId);
                for (int pos = reverseIndex.start(nodeId); pos < end; pos++) {
                    int predecessor = reverseIndex.predecessorAtPosition(pos);
                    if (seen.markVisited(predecessor)) {
                        distances[predecessor] = nextDistance;
                        next.add(predecessor);
                    } else if (predecessor == targetId && distances[targetId] == DistanceTable.NOT_REACHED) {
                        distances[targetId] = nextDistance;
                    }
                }
            }
            long elapsed = System.nanoTime() - layerStarted;
            listener.onLayer(layer, frontier.size(), next.size(), elapsed);
            log.debug("Layer {} ({} nodes) discovered {} nodes in {} us",
                    layer, frontier.size(), next.size(), elapsed / 1_000L);
            if (!next.isEmpty()) {
                layerSizes.add(next.size());
            }
            frontier = next;
            layer++;
        }
        if (distances[targetId] == DistanceTable.NOT_REACHED) {
            distances[targetId] = 0;
        }

        DistanceTable table = new DistanceTable(edgeStore, targetId, distances, layerSizes.toIntArray(), complete);
        log.info("Distances to '{}': {} of {} articles reach it ({}%), {} layers, {} ms",
                edgeStore.title(targetId), table.reachedDeclaredCount(), edgeStore.size(),
                String.format(Locale.ROOT, "%.4f", table.coverageRatio() * 100.0d), table.layerCount(),
                (System.nanoTime() - started) / 1_000_000L);
        return table;
    }
}
