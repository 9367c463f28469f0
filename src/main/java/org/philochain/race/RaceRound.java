package org.philochain.race;

import lombok.Value;

import java.util.List;

/**
 * Positions of every participant after one round. Round 0 is the starting line-up.
 */
@Value
public class RaceRound {
    int round;
    /** One entry per participant, in start-list order. */
    List<Racer> racers;

    /**
     * Snapshot of one participant.
     */
    @Value
    public static class Racer {
        /** Start title identifying the participant. */
        String start;
        /** Current title. */
        String position;
        /** Edges followed so far. */
        int steps;
        RacerStatus status;
    }

    /**
     * Current positions in start-list order.
     */
    public List<String> positions() {
        return racers.stream().map(Racer::getPosition).toList();
    }
}
