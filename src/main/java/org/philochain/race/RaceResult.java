package org.philochain.race;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a first-link race.
 *
 * <p>Winners are start titles. Several participants arriving in the same round are all
 * winners; there is never an arbitrary single pick among them.</p>
 */
@Value
@Builder
public class RaceResult {
    /**
     * Race outcome tag.
     */
    public enum Outcome {
        /** At least one participant reached the target. */
        WON,
        /** Every participant looped, dead-ended or was unknown. */
        NO_WINNER,
        /** A configured round limit stopped the race before it resolved. */
        ROUND_LIMIT
    }

    Outcome outcome;
    /** Start titles of the winners in start-list order; empty unless {@link Outcome#WON}. */
    @Singular
    List<String> winners;
    /** Number of rounds executed. */
    int rounds;
    /** Round-by-round positions, starting with round 0. */
    @Singular("round")
    List<RaceRound> trace;

    public boolean isTie() {
        return winners.size() > 1;
    }

    /**
     * Final round snapshot.
     */
    public RaceRound finalRound() {
        return trace.get(trace.size() - 1);
    }
}
