package org.philochain.distance;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one navigation step.
 *
 * <p>Only {@link Status#MOVED} carries a destination; every other status leaves the caller
 * where it was.</p>
 */
@Value
@Builder
public class StepResult {
    /**
     * Step outcome tag.
     */
    public enum Status {
        MOVED,
        /** The starting title is not known to the edge store. */
        UNKNOWN_NODE,
        /** Toward-target step from an article without a first link. */
        UNRESOLVED_SUCCESSOR,
        /** Away-from-target step from an article no other article links to. */
        NO_PREDECESSORS,
        /** The requested predecessor does not link to the starting article. */
        NOT_A_PREDECESSOR
    }

    Status status;
    StepDirection direction;
    /** Starting title. */
    String from;
    /** Destination title; {@code null} unless moved. */
    String node;
    /** Destination distance to the target, or {@link DistanceTable#NOT_REACHED}. */
    @Builder.Default
    int distance = DistanceTable.NOT_REACHED;
    /** Number of articles linking to the starting article (away-from-target steps only). */
    int predecessorCount;

    public boolean moved() {
        return status == Status.MOVED;
    }
}
