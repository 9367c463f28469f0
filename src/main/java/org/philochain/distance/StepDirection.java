package org.philochain.distance;

/**
 * Direction of a single navigation step relative to the target.
 */
public enum StepDirection {
    /** Follow the article's own first link. */
    TOWARD_TARGET,
    /** Move to an article whose first link is the current article. */
    AWAY_FROM_TARGET
}
