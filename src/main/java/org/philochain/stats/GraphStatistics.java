package org.philochain.stats;

import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.philochain.graph.EdgeStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Whole-graph shape summary: every cycle, and the heat of every article.
 *
 * <p>Heat is the number of distinct other articles whose first-link walk eventually passes
 * through an article. Every member of a cycle shares the heat {@code basinSize - 1}, since the
 * whole basin draining into the cycle reaches each of its members.</p>
 */
public final class GraphStatistics {
    private final EdgeStore edgeStore;
    private final int[] heat;
    private final List<int[]> cycles;
    @Getter
    @Accessors(fluent = true)
    private final int nodesOnCycles;
    @Getter
    @Accessors(fluent = true)
    private final int declaredDeadEnds;
    @Getter
    @Accessors(fluent = true)
    private final int implicitNodes;

    GraphStatistics(EdgeStore edgeStore, int[] heat, List<int[]> cycles, int declaredDeadEnds, int implicitNodes) {
        this.edgeStore = edgeStore;
        this.heat = heat;
        this.cycles = cycles;
        int onCycles = 0;
        for (int[] cycle : cycles) {
            onCycles += cycle.length;
        }
        this.nodesOnCycles = onCycles;
        this.declaredDeadEnds = declaredDeadEnds;
        this.implicitNodes = implicitNodes;
    }

    public int cycleCount() {
        return cycles.size();
    }

    /**
     * Every cycle as titles in link order, starting at the member with the lowest node id.
     * Cycles are ordered by that starting node id.
     */
    public List<List<String>> cycles() {
        List<List<String>> titles = new ArrayList<>(cycles.size());
        for (int[] cycle : cycles) {
            List<String> members = new ArrayList<>(cycle.length);
            for (int nodeId : cycle) {
                members.add(edgeStore.title(nodeId));
            }
            titles.add(Collections.unmodifiableList(members));
        }
        return Collections.unmodifiableList(titles);
    }

    /**
     * Heat of an article; empty for unknown titles.
     */
    public OptionalInt heat(String title) {
        int nodeId = edgeStore.idOf(title);
        return nodeId == EdgeStore.NO_NODE ? OptionalInt.empty() : OptionalInt.of(heat[nodeId]);
    }

    public int heat(int nodeId) {
        if (nodeId < 0 || nodeId >= heat.length) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
        return heat[nodeId];
    }

    /**
     * The {@code limit} hottest articles, hottest first, ties broken by title.
     */
    public List<HeatEntry> hottest(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        int[] order = new int[heat.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        IntArrays.quickSort(order, (a, b) -> {
            int byHeat = Integer.compare(heat[b], heat[a]);
            return byHeat != 0 ? byHeat : edgeStore.title(a).compareTo(edgeStore.title(b));
        });
        int count = Math.min(limit, order.length);
        List<HeatEntry> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            entries.add(new HeatEntry(edgeStore.title(order[i]), heat[order[i]]));
        }
        return entries;
    }

    /**
     * One ranked article.
     */
    public record HeatEntry(String title, int heat) {
    }
}
