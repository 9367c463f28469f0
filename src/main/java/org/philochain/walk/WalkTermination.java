package org.philochain.walk;

/**
 * How a first-link walk ended.
 */
public enum WalkTermination {
    /** The walk arrived at the target article. */
    REACHED_TARGET,
    /** The walk revisited an article it had already passed through. */
    CYCLE,
    /** The walk stopped at an article with no known successor. */
    DEAD_END
}
