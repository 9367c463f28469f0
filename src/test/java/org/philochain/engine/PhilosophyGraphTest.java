package org.philochain.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.philochain.distance.CancellationToken;
import org.philochain.distance.DistanceTable;
import org.philochain.distance.LayerListener;
import org.philochain.distance.SampleResult;
import org.philochain.distance.StepDirection;
import org.philochain.distance.StepResult;
import org.philochain.graph.EdgeStore;
import org.philochain.race.RaceResult;
import org.philochain.testutil.GraphFixtures;
import org.philochain.walk.WalkTermination;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Philosophy Graph Tests")
class PhilosophyGraphTest {

    private PhilosophyGraph graph;

    @BeforeEach
    void setUp() {
        graph = PhilosophyGraph.create(GraphFixtures.mixed());
    }

    @Test
    @DisplayName("Unknown target is rejected with a reason code")
    void testUnknownTarget() {
        GraphEngineConfig config = GraphEngineConfig.builder().targetTitle("Metaphysics").build();

        GraphQueryException e = assertThrows(GraphQueryException.class,
                () -> PhilosophyGraph.create(GraphFixtures.mixed(), config));
        assertEquals(PhilosophyGraph.REASON_UNKNOWN_TARGET, e.getReasonCode());
        assertTrue(e.getMessage().startsWith("[UNKNOWN_TARGET]"));
    }

    @Test
    @DisplayName("Invalid configuration is rejected with a reason code")
    void testInvalidConfig() {
        GraphEngineConfig noPartitions = GraphEngineConfig.builder().reverseIndexPartitions(0).build();
        GraphEngineConfig blankTarget = GraphEngineConfig.builder().targetTitle("").build();

        assertEquals(PhilosophyGraph.REASON_INVALID_CONFIG, assertThrows(GraphQueryException.class,
                () -> PhilosophyGraph.create(GraphFixtures.mixed(), noPartitions)).getReasonCode());
        assertEquals(PhilosophyGraph.REASON_INVALID_CONFIG, assertThrows(GraphQueryException.class,
                () -> PhilosophyGraph.create(GraphFixtures.mixed(), blankTarget)).getReasonCode());
    }

    @Test
    @DisplayName("Implicit target is accepted")
    void testImplicitTarget() {
        EdgeStore store = GraphFixtures.store("A", GraphFixtures.TARGET, "B", "A");
        PhilosophyGraph implicit = PhilosophyGraph.create(store);

        assertEquals(OptionalInt.of(2), implicit.distanceOf("B"));
        assertEquals(1.0d, implicit.computeDistances().coverageRatio(), 1e-12);
    }

    @Test
    @DisplayName("Path queries")
    void testFollowPath() {
        assertEquals(WalkTermination.REACHED_TARGET, graph.followPath("Film").getTermination());
        assertEquals(WalkTermination.CYCLE, graph.followPath("Tail").getTermination());
        assertTrue(graph.followPath("Atlantis").isUnknownStart());
    }

    @Test
    @DisplayName("Distance table is computed once and cached")
    void testDistanceCaching() {
        DistanceTable first = graph.computeDistances();

        assertSame(first, graph.computeDistances());
        assertEquals(OptionalInt.of(4), graph.distanceOf("Music"));
        assertEquals(OptionalInt.empty(), graph.distanceOf("Loop1"));
        assertEquals(OptionalInt.empty(), graph.distanceOf("Atlantis"));
    }

    @Test
    @DisplayName("Cancelled table is returned but not cached")
    void testCancelledNotCached() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        DistanceTable partial = graph.computeDistances(token, LayerListener.NONE);
        DistanceTable full = graph.computeDistances();

        assertFalse(partial.complete());
        assertTrue(full.complete());
        assertNotSame(partial, full);
    }

    @Test
    @DisplayName("Concurrent first queries share one table")
    void testConcurrentDistanceQueries() throws Exception {
        PhilosophyGraph large = PhilosophyGraph.create(GraphFixtures.random(20_000, 5L, 25));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<DistanceTable>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(large::computeDistances);
            }
            DistanceTable expected = null;
            for (Future<DistanceTable> future : executor.invokeAll(tasks)) {
                DistanceTable table = future.get();
                if (expected == null) {
                    expected = table;
                }
                assertSame(expected, table);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Sampling and bucket listing")
    void testSampling() {
        Random random = new Random(2L);
        SampleResult sample = graph.sampleAtDistance(3, random);

        assertTrue(sample.isSampled());
        assertTrue(List.of("Art", "Film").contains(sample.getNode()));
        assertEquals(List.of("Art", "Film"), graph.articlesAtDistance(3));
        assertEquals(SampleResult.Status.EMPTY_BUCKET, graph.sampleAtDistance(9, random).getStatus());
    }

    @Test
    @DisplayName("Steps are annotated once distances exist")
    void testStepping() {
        StepResult before = graph.step("Art", StepDirection.TOWARD_TARGET, new Random(1L));
        assertEquals(DistanceTable.NOT_REACHED, before.getDistance());

        graph.computeDistances();
        StepResult after = graph.step("Art", StepDirection.TOWARD_TARGET, new Random(1L));
        assertEquals("Culture", after.getNode());
        assertEquals(2, after.getDistance());

        assertEquals("Film", graph.stepAway("Culture", "Film").getNode());
        assertEquals(List.of("Art", "Film"), graph.predecessors("Culture"));
    }

    @Test
    @DisplayName("Race runs against the configured target")
    void testRace() {
        RaceResult result = graph.race(List.of("Music", "Society", "Tail"));

        assertEquals(RaceResult.Outcome.WON, result.getOutcome());
        assertEquals(List.of("Society"), result.getWinners());
    }

    @Test
    @DisplayName("Configured round limit reaches the race")
    void testRaceRoundLimit() {
        PhilosophyGraph limited = PhilosophyGraph.create(GraphFixtures.mixed(),
                GraphEngineConfig.builder().maxRaceRounds(2).build());

        assertEquals(RaceResult.Outcome.ROUND_LIMIT, limited.race(List.of("Music")).getOutcome());
    }

    @Test
    @DisplayName("Alternative target")
    void testAlternativeTarget() {
        PhilosophyGraph loops = PhilosophyGraph.create(GraphFixtures.mixed(),
                GraphEngineConfig.builder().targetTitle("Loop1").build());

        assertEquals("Loop1", loops.targetTitle());
        assertEquals(OptionalInt.of(3), loops.distanceOf("Tail"));
        assertEquals(OptionalInt.empty(), loops.distanceOf("Art"));
    }

    @Test
    @DisplayName("Partitioned reverse index gives identical answers")
    void testPartitionedReverseIndex() {
        EdgeStore store = GraphFixtures.random(3_000, 8L, 10);
        PhilosophyGraph sequential = PhilosophyGraph.create(store);
        PhilosophyGraph partitioned = PhilosophyGraph.create(store,
                GraphEngineConfig.builder().reverseIndexPartitions(4).build());

        DistanceTable a = sequential.computeDistances();
        DistanceTable b = partitioned.computeDistances();
        for (int node = 0; node < store.nodeCount(); node++) {
            assertEquals(a.distance(node), b.distance(node));
        }
    }

    @Test
    @DisplayName("Partition count beyond the processor count does not grow the pool")
    void testPoolSizeClamped() {
        assertEquals(4, PhilosophyGraph.poolSize(10_000, 4));
        assertEquals(3, PhilosophyGraph.poolSize(3, 16));
        assertEquals(1, PhilosophyGraph.poolSize(2, 0));
    }

    @Test
    @DisplayName("Huge partition count still builds a correct index")
    void testHugePartitionCount() {
        EdgeStore store = GraphFixtures.mixed();
        PhilosophyGraph partitioned = PhilosophyGraph.create(store,
                GraphEngineConfig.builder().reverseIndexPartitions(100_000).build());

        assertEquals(List.of("Art", "Film"), partitioned.predecessors("Culture"));
        assertEquals(OptionalInt.of(4), partitioned.distanceOf("Music"));
    }

    @Test
    @DisplayName("Statistics are computed once")
    void testStatisticsCached() {
        assertSame(graph.statistics(), graph.statistics());
        assertEquals(2, graph.statistics().cycleCount());
    }
}
