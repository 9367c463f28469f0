package org.philochain.race;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.philochain.graph.EdgeStore;
import org.philochain.testutil.GraphFixtures;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Race Simulator Tests")
class RaceSimulatorTest {

    private static final String T = GraphFixtures.TARGET;

    private static RaceSimulator simulator(EdgeStore store) {
        return new RaceSimulator(store, store.idOf(T));
    }

    @Test
    @DisplayName("Shorter chain wins after one round")
    void testSingleWinner() {
        EdgeStore store = GraphFixtures.store("P1", T, "P2", "Q", "Q", T, T, null);

        RaceResult result = simulator(store).race(List.of("P1", "P2"));

        assertEquals(RaceResult.Outcome.WON, result.getOutcome());
        assertEquals(List.of("P1"), result.getWinners());
        assertEquals(1, result.getRounds());
        assertEquals(2, result.getTrace().size());
        assertEquals(List.of("P1", "P2"), result.getTrace().get(0).positions());
        assertEquals(List.of(T, "Q"), result.finalRound().positions());
        assertFalse(result.isTie());
    }

    @Test
    @DisplayName("Simultaneous arrivals are all winners")
    void testTie() {
        EdgeStore store = GraphFixtures.store("P1", T, "P2", T, "P3", "Q", "Q", T, T, null);

        RaceResult result = simulator(store).race(List.of("P1", "P2", "P3"));

        assertEquals(List.of("P1", "P2"), result.getWinners());
        assertTrue(result.isTie());
        assertEquals(1, result.getRounds());
    }

    @Test
    @DisplayName("Start on the target wins at round 0")
    void testStartOnTarget() {
        EdgeStore store = GraphFixtures.store("P1", T, T, "P1");

        RaceResult result = simulator(store).race(List.of("P1", T));

        assertEquals(RaceResult.Outcome.WON, result.getOutcome());
        assertEquals(List.of(T), result.getWinners());
        assertEquals(0, result.getRounds());
        assertEquals(1, result.getTrace().size());
    }

    @Test
    @DisplayName("Everybody looping ends with no winner")
    void testAllLooping() {
        EdgeStore store = GraphFixtures.store("A", "B", "B", "A", "C", "C", T, null);

        RaceResult result = simulator(store).race(List.of("A", "C"));

        assertEquals(RaceResult.Outcome.NO_WINNER, result.getOutcome());
        assertTrue(result.getWinners().isEmpty());
        assertEquals(2, result.getRounds());
        RaceRound last = result.finalRound();
        assertEquals(RacerStatus.LOOPING, last.getRacers().get(0).getStatus());
        assertEquals(RacerStatus.LOOPING, last.getRacers().get(1).getStatus());
        assertEquals(1, last.getRacers().get(1).getSteps());
    }

    @Test
    @DisplayName("Dead ends and unknown starts are eliminated while others race on")
    void testEliminations() {
        EdgeStore store = GraphFixtures.store("Stub", null, "Far", "Mid", "Mid", "Near", "Near", T, T, null);

        RaceResult result = simulator(store).race(List.of("Stub", "Atlantis", "Far"));

        assertEquals(List.of("Far"), result.getWinners());
        assertEquals(3, result.getRounds());
        List<RaceRound.Racer> racers = result.finalRound().getRacers();
        assertEquals(RacerStatus.DEAD_END, racers.get(0).getStatus());
        assertEquals(RacerStatus.UNKNOWN_NODE, racers.get(1).getStatus());
        assertEquals("Atlantis", racers.get(1).getPosition());
        assertEquals(RacerStatus.ARRIVED, racers.get(2).getStatus());
        assertTrue(racers.get(0).getStatus().isEliminated());
        assertFalse(racers.get(2).getStatus().isEliminated());
    }

    @Test
    @DisplayName("Only unknown starts finish immediately with no winner")
    void testOnlyUnknownStarts() {
        RaceResult result = simulator(GraphFixtures.mixed()).race(List.of("Atlantis", "Lemuria"));

        assertEquals(RaceResult.Outcome.NO_WINNER, result.getOutcome());
        assertEquals(0, result.getRounds());
    }

    @Test
    @DisplayName("Configured round limit stops an undecided race")
    void testRoundLimit() {
        EdgeStore store = GraphFixtures.store("P2", "Q", "Q", T, T, null);

        RaceResult result = new RaceSimulator(store, store.idOf(T), 1).race(List.of("P2"));

        assertEquals(RaceResult.Outcome.ROUND_LIMIT, result.getOutcome());
        assertEquals(1, result.getRounds());
        assertEquals(List.of("Q"), result.finalRound().positions());
    }

    @Test
    @DisplayName("Long loops are detected within node-count rounds")
    void testLongLoop() {
        EdgeStore store = GraphFixtures.random(2_000, 31L, 0);
        RaceResult result = simulator(store).race(List.of("N0", "N1", "N2", "N3"));

        assertNotEquals(RaceResult.Outcome.ROUND_LIMIT, result.getOutcome());
        assertTrue(result.getRounds() <= store.nodeCount());
    }

    @Test
    @DisplayName("Invalid start lists are rejected")
    void testValidation() {
        RaceSimulator simulator = simulator(GraphFixtures.mixed());

        assertThrows(IllegalArgumentException.class, () -> simulator.race(List.of()));
        assertThrows(IllegalArgumentException.class, () -> simulator.race(List.of("Art", "Art")));
        assertThrows(IllegalArgumentException.class, () -> simulator.race(Arrays.asList("Art", null)));
        assertThrows(NullPointerException.class, () -> simulator.race(null));
    }
}
