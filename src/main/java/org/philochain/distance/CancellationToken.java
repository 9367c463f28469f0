package org.philochain.distance;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag polled by the distance engine between BFS layers.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Returns a fresh, not yet cancelled token.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
