package org.philochain.race;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.philochain.graph.EdgeStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Advances a cohort of first-link walks in lock-step until one reaches the target.
 *
 * <p>Every round moves each running participant one edge. Participants on the target after a
 * round win together. A participant landing on a node from its own history is looping and
 * drops out; so does one stuck on an article without a first link. The race ends with no
 * winner once nobody is running. Since each surviving move adds a new node to the mover's
 * history, no race needs more than {@code nodeCount()} rounds.</p>
 *
 * <p>Stateless between invocations; safe to share.</p>
 */
public final class RaceSimulator {
    private static final Logger log = LogManager.getLogger(RaceSimulator.class);

    private final EdgeStore edgeStore;
    private final int targetId;
    private final int maxRounds;

    /**
     * @param maxRounds round limit; values {@code <= 0} use the node-count bound.
     */
    public RaceSimulator(EdgeStore edgeStore, int targetId, int maxRounds) {
        this.edgeStore = Objects.requireNonNull(edgeStore, "edgeStore");
        if (targetId < 0 || targetId >= edgeStore.nodeCount()) {
            throw new IndexOutOfBoundsException("targetId out of bounds: " + targetId);
        }
        this.targetId = targetId;
        this.maxRounds = maxRounds <= 0 ? edgeStore.nodeCount() + 1 : maxRounds;
    }

    public RaceSimulator(EdgeStore edgeStore, int targetId) {
        this(edgeStore, targetId, 0);
    }

    /**
     * Races the given start titles.
     *
     * @param starts distinct, non-null titles; at least one.
     * @throws IllegalArgumentException for an empty list, null entries or duplicates.
     */
    public RaceResult race(List<String> starts) {
        validateStarts(starts);
        List<Participant> participants = new ArrayList<>(starts.size());
        for (String start : starts) {
            participants.add(new Participant(start, edgeStore.idOf(start)));
        }

        RaceResult.RaceResultBuilder result = RaceResult.builder();
        result.round(snapshot(0, participants));
        if (collectWinners(participants, result)) {
            return result.outcome(RaceResult.Outcome.WON).rounds(0).build();
        }

        int round = 0;
        while (hasRunning(participants)) {
            if (round >= maxRounds) {
                log.debug("Race stopped at round limit {}", maxRounds);
                return result.outcome(RaceResult.Outcome.ROUND_LIMIT).rounds(round).build();
            }
            round++;
            for (Participant participant : participants) {
                if (participant.status == RacerStatus.RUNNING) {
                    advance(participant);
                }
            }
            RaceRound snapshot = snapshot(round, participants);
            result.round(snapshot);
            log.debug("Round {}: {}", round, snapshot.positions());
            if (collectWinners(participants, result)) {
                return result.outcome(RaceResult.Outcome.WON).rounds(round).build();
            }
        }
        return result.outcome(RaceResult.Outcome.NO_WINNER).rounds(round).build();
    }

    private void advance(Participant participant) {
        int next = edgeStore.successorOf(participant.current);
        if (next == EdgeStore.UNRESOLVED) {
            participant.status = RacerStatus.DEAD_END;
            return;
        }
        participant.current = next;
        participant.steps++;
        if (next == targetId) {
            participant.status = RacerStatus.ARRIVED;
        } else if (!participant.history.add(next)) {
            participant.status = RacerStatus.LOOPING;
        }
    }

    private static boolean collectWinners(List<Participant> participants, RaceResult.RaceResultBuilder result) {
        boolean any = false;
        for (Participant participant : participants) {
            if (participant.status == RacerStatus.ARRIVED) {
                result.winner(participant.start);
                any = true;
            }
        }
        return any;
    }

    private static boolean hasRunning(List<Participant> participants) {
        for (Participant participant : participants) {
            if (participant.status == RacerStatus.RUNNING) {
                return true;
            }
        }
        return false;
    }

    private RaceRound snapshot(int round, List<Participant> participants) {
        List<RaceRound.Racer> racers = new ArrayList<>(participants.size());
        for (Participant participant : participants) {
            String position = participant.current == EdgeStore.NO_NODE
                    ? participant.start
                    : edgeStore.title(participant.current);
            racers.add(new RaceRound.Racer(participant.start, position, participant.steps, participant.status));
        }
        return new RaceRound(round, List.copyOf(racers));
    }

    private static void validateStarts(List<String> starts) {
        Objects.requireNonNull(starts, "starts");
        if (starts.isEmpty()) {
            throw new IllegalArgumentException("at least one start article is required");
        }
        Set<String> distinct = new HashSet<>();
        for (String start : starts) {
            if (start == null) {
                throw new IllegalArgumentException("start articles must be non-null");
            }
            if (!distinct.add(start)) {
                throw new IllegalArgumentException("duplicate start article: " + start);
            }
        }
    }

    private final class Participant {
        private final String start;
        private final IntOpenHashSet history = new IntOpenHashSet();
        private int current;
        private int steps;
        private RacerStatus status;

        private Participant(String start, int startId) {
            this.start = start;
            this.current = startId;
            if (startId == EdgeStore.NO_NODE) {
                this.status = RacerStatus.UNKNOWN_NODE;
            } else if (startId == targetId) {
                this.status = RacerStatus.ARRIVED;
            } else {
                this.status = RacerStatus.RUNNING;
                history.add(startId);
            }
        }
    }
}
