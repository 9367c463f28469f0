package org.philochain.stats;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.philochain.graph.EdgeStore;
import org.philochain.graph.ReverseIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes {@link GraphStatistics} in linear time.
 *
 * <p>Nodes nobody links to are peeled off first, pushing their heat plus one onto their
 * successor; a successor whose last predecessor has been peeled is peeled in turn. In a graph
 * with one outgoing edge per node, whatever survives the peeling lies on a cycle. Each
 * surviving cycle is then walked once and its members receive the basin total.</p>
 */
@UtilityClass
public class GraphStatisticsAnalyzer {
    private static final Logger log = LogManager.getLogger(GraphStatisticsAnalyzer.class);

    public static GraphStatistics analyze(EdgeStore edgeStore, ReverseIndex reverseIndex) {
        Objects.requireNonNull(edgeStore, "edgeStore");
        Objects.requireNonNull(reverseIndex, "reverseIndex");
        long started = System.nanoTime();
        int nodeCount = edgeStore.nodeCount();

        int[] remaining = new int[nodeCount];
        IntArrayList queue = new IntArrayList();
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            remaining[nodeId] = reverseIndex.predecessorCount(nodeId);
            if (remaining[nodeId] == 0) {
                queue.add(nodeId);
            }
        }

        int[] heat = new int[nodeCount];
        for (int head = 0; head < queue.size(); head++) {
            int nodeId = queue.getInt(head);
            int successor = edgeStore.successorOf(nodeId);
            if (successor == EdgeStore.UNRESOLVED) {
                continue;
            }
            heat[successor] += heat[nodeId] + 1;
            if (--remaining[successor] == 0) {
                queue.add(successor);
            }
        }

        List<int[]> cycles = new ArrayList<>();
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            if (remaining[nodeId] == 0) {
                continue;
            }
            IntArrayList members = new IntArrayList();
            int basin = 0;
            int current = nodeId;
            do {
                members.add(current);
                basin += heat[current] + 1;
                remaining[current] = 0;
                current = edgeStore.successorOf(current);
            } while (current != nodeId);
            for (int i = 0; i < members.size(); i++) {
                heat[members.getInt(i)] = basin - 1;
            }
            cycles.add(members.toIntArray());
        }

        int declaredDeadEnds = 0;
        int implicitNodes = 0;
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            if (!edgeStore.isDeclared(nodeId)) {
                implicitNodes++;
            } else if (edgeStore.successorOf(nodeId) == EdgeStore.UNRESOLVED) {
                declaredDeadEnds++;
            }
        }

        GraphStatistics statistics = new GraphStatistics(edgeStore, heat, cycles, declaredDeadEnds, implicitNodes);
        log.info("Graph statistics: {} cycles covering {} nodes, {} dead ends, {} implicit nodes in {} ms",
                statistics.cycleCount(), statistics.nodesOnCycles(), declaredDeadEnds, implicitNodes,
                (System.nanoTime() - started) / 1_000_000L);
        return statistics;
    }
}
