package org.philochain.walk;

import org.philochain.graph.EdgeStore;
import org.philochain.graph.VisitedSet;

import java.util.Objects;

/**
 * Follows first links from a start article until the target, a repeat or a dead end.
 * <p>
 * Each step either marks a new node as seen or terminates, so a walk never exceeds
 * {@code nodeCount() + 1} elements. Read-only over the edge store; safe to share.
 */
public final class PathFollower {
    private final EdgeStore edgeStore;
    private final int targetId;

    /**
     * @param edgeStore graph to walk.
     * @param targetId target node id, or {@link EdgeStore#NO_NODE} when the target is unknown.
     */
    public PathFollower(EdgeStore edgeStore, int targetId) {
        this.edgeStore = Objects.requireNonNull(edgeStore, "edgeStore");
        if (targetId != EdgeStore.NO_NODE && (targetId < 0 || targetId >= edgeStore.nodeCount())) {
            throw new IndexOutOfBoundsException("targetId out of bounds: " + targetId);
        }
        this.targetId = targetId;
    }

    /**
     * Walks from an article title. An unknown title is reported as a one-element dead end.
     */
    public WalkResult follow(String start) {
        Objects.requireNonNull(start, "start");
        int startId = edgeStore.idOf(start);
        if (startId == EdgeStore.NO_NODE) {
            return WalkResult.builder()
                    .termination(WalkTermination.DEAD_END)
                    .pathNode(start)
                    .unknownStart(true)
                    .build();
        }
        return follow(startId);
    }

    /**
     * Walks from a node id.
     */
    public WalkResult follow(int startId) {
        if (startId < 0 || startId >= edgeStore.nodeCount()) {
            throw new IndexOutOfBoundsException("startId out of bounds: " + startId);
        }
        VisitedSet seen = new VisitedSet(edgeStore.nodeCount());
        WalkResult.WalkResultBuilder result = WalkResult.builder();
        int current = startId;
        while (true) {
            boolean firstVisit = seen.markVisited(current);
            result.pathNode(edgeStore.title(current));
            if (current == targetId) {
                return result.termination(WalkTermination.REACHED_TARGET).build();
            }
            if (!firstVisit) {
                return result.termination(WalkTermination.CYCLE)
                        .repeatedNode(edgeStore.title(current))
                        .build();
            }
            int next = edgeStore.successorOf(current);
            if (next == EdgeStore.UNRESOLVED) {
                return result.termination(WalkTermination.DEAD_END).build();
            }
            current = next;
        }
    }

    public int targetId() {
        return targetId;
    }
}
