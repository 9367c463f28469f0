package org.philochain.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.philochain.graph.EdgeStore;
import org.philochain.graph.ReverseIndex;
import org.philochain.testutil.GraphFixtures;
import org.philochain.walk.PathFollower;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Statistics Analyzer Tests")
class GraphStatisticsAnalyzerTest {

    private static GraphStatistics analyze(EdgeStore store) {
        return GraphStatisticsAnalyzer.analyze(store, ReverseIndex.build(store));
    }

    @Test
    @DisplayName("Cycles and counts of the mixed graph")
    void testMixedGraphShape() {
        GraphStatistics stats = analyze(GraphFixtures.mixed());

        assertEquals(2, stats.cycleCount());
        assertEquals(List.of(
                List.of(GraphFixtures.TARGET, "Reason"),
                List.of("Loop1", "Loop2", "Loop3")
        ), stats.cycles());
        assertEquals(5, stats.nodesOnCycles());
        assertEquals(1, stats.declaredDeadEnds());
        assertEquals(1, stats.implicitNodes());
    }

    @Test
    @DisplayName("Cycle members share the basin heat")
    void testHeat() {
        GraphStatistics stats = analyze(GraphFixtures.mixed());

        assertEquals(OptionalInt.of(6), stats.heat(GraphFixtures.TARGET));
        assertEquals(OptionalInt.of(6), stats.heat("Reason"));
        assertEquals(OptionalInt.of(3), stats.heat("Loop1"));
        assertEquals(OptionalInt.of(3), stats.heat("Loop3"));
        assertEquals(OptionalInt.of(4), stats.heat("Society"));
        assertEquals(OptionalInt.of(3), stats.heat("Culture"));
        assertEquals(OptionalInt.of(1), stats.heat("Art"));
        assertEquals(OptionalInt.of(1), stats.heat("Missing"));
        assertEquals(OptionalInt.of(0), stats.heat("Music"));
        assertEquals(OptionalInt.of(0), stats.heat("Stub"));
        assertEquals(OptionalInt.empty(), stats.heat("Atlantis"));
    }

    @Test
    @DisplayName("Hottest ranking breaks ties by title")
    void testHottest() {
        GraphStatistics stats = analyze(GraphFixtures.mixed());

        assertEquals(List.of(
                new GraphStatistics.HeatEntry(GraphFixtures.TARGET, 6),
                new GraphStatistics.HeatEntry("Reason", 6),
                new GraphStatistics.HeatEntry("Society", 4),
                new GraphStatistics.HeatEntry("Culture", 3),
                new GraphStatistics.HeatEntry("Loop1", 3)
        ), stats.hottest(5));
        assertEquals(14, stats.hottest(100).size());
        assertTrue(stats.hottest(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> stats.hottest(-1));
    }

    @Test
    @DisplayName("Self-loop is a cycle of one")
    void testSelfLoop() {
        GraphStatistics stats = analyze(GraphFixtures.store("A", "A", "B", "A"));

        assertEquals(List.of(List.of("A")), stats.cycles());
        assertEquals(OptionalInt.of(1), stats.heat("A"));
        assertEquals(OptionalInt.of(0), stats.heat("B"));
    }

    @Test
    @DisplayName("Heat matches a brute-force count over every walk")
    void testHeatMatchesBruteForce() {
        EdgeStore store = GraphFixtures.random(600, 13L, 15);
        GraphStatistics stats = analyze(store);
        PathFollower follower = new PathFollower(store, EdgeStore.NO_NODE);

        int[] expected = new int[store.nodeCount()];
        for (int start = 0; start < store.nodeCount(); start++) {
            Set<String> visited = new HashSet<>(follower.follow(start).getPath());
            visited.remove(store.title(start));
            for (String title : visited) {
                expected[store.idOf(title)]++;
            }
        }
        for (int nodeId = 0; nodeId < store.nodeCount(); nodeId++) {
            assertEquals(expected[nodeId], stats.heat(nodeId), store.title(nodeId));
        }
    }

    @Test
    @DisplayName("Empty store has no cycles")
    void testEmptyStore() {
        GraphStatistics stats = analyze(EdgeStore.builder().build());

        assertEquals(0, stats.cycleCount());
        assertTrue(stats.hottest(10).isEmpty());
    }
}
