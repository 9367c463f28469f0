package org.philochain.race;

/**
 * State of one race participant.
 */
public enum RacerStatus {
    /** Still advancing. */
    RUNNING,
    /** Standing on the target. */
    ARRIVED,
    /** Landed on an article it already visited; can no longer win. */
    LOOPING,
    /** Stuck on an article without a first link; can no longer win. */
    DEAD_END,
    /** Start title unknown to the edge store; never moves. */
    UNKNOWN_NODE;

    /**
     * Whether the participant is out of the race without having won.
     */
    public boolean isEliminated() {
        return this == LOOPING || this == DEAD_END || this == UNKNOWN_NODE;
    }
}
