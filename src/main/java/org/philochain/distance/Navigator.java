package org.philochain.distance;

import org.philochain.graph.EdgeStore;
import org.philochain.graph.ReverseIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Single-step movement along first links in either direction.
 * <p>
 * Toward the target is the edge store successor; away from the target is a member of the
 * reverse index entry. Neither direction mutates the graph structures, so any number of
 * steps can be taken back and forth. When a distance table is attached each destination is
 * annotated with its distance.
 */
public final class Navigator {
    private final EdgeStore edgeStore;
    private final ReverseIndex reverseIndex;
    private final DistanceTable distanceTable;

    /**
     * @param distanceTable optional table used to annotate destinations; may be {@code null}.
     */
    public Navigator(EdgeStore edgeStore, ReverseIndex reverseIndex, DistanceTable distanceTable) {
        this.edgeStore = Objects.requireNonNull(edgeStore, "edgeStore");
        this.reverseIndex = Objects.requireNonNull(reverseIndex, "reverseIndex");
        this.distanceTable = distanceTable;
    }

    /**
     * Steps in {@code direction}; away-from-target steps pick a predecessor with {@code random}.
     */
    public StepResult step(String node, StepDirection direction, RandomGenerator random) {
        Objects.requireNonNull(direction, "direction");
        return switch (direction) {
            case TOWARD_TARGET -> towardTarget(node);
            case AWAY_FROM_TARGET -> awayFromTarget(node, random);
        };
    }

    /**
     * Follows the first link of {@code node}.
     */
    public StepResult towardTarget(String node) {
        Objects.requireNonNull(node, "node");
        StepResult.StepResultBuilder result = StepResult.builder()
                .direction(StepDirection.TOWARD_TARGET)
                .from(node);
        int nodeId = edgeStore.idOf(node);
        if (nodeId == EdgeStore.NO_NODE) {
            return result.status(StepResult.Status.UNKNOWN_NODE).build();
        }
        int successor = edgeStore.successorOf(nodeId);
        if (successor == EdgeStore.UNRESOLVED) {
            return result.status(StepResult.Status.UNRESOLVED_SUCCESSOR).build();
        }
        return moveTo(result, successor);
    }

    /**
     * Moves to a uniformly chosen article linking to {@code node}.
     */
    public StepResult awayFromTarget(String node, RandomGenerator random) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(random, "random");
        StepResult.StepResultBuilder result = StepResult.builder()
                .direction(StepDirection.AWAY_FROM_TARGET)
                .from(node);
        int nodeId = edgeStore.idOf(node);
        if (nodeId == EdgeStore.NO_NODE) {
            return result.status(StepResult.Status.UNKNOWN_NODE).build();
        }
        int count = reverseIndex.predecessorCount(nodeId);
        result.predecessorCount(count);
        if (count == 0) {
            return result.status(StepResult.Status.NO_PREDECESSORS).build();
        }
        return moveTo(result, reverseIndex.predecessor(nodeId, random.nextInt(count)));
    }

    /**
     * Moves to a specific article linking to {@code node}.
     */
    public StepResult awayFromTarget(String node, String predecessor) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(predecessor, "predecessor");
        StepResult.StepResultBuilder result = StepResult.builder()
                .direction(StepDirection.AWAY_FROM_TARGET)
                .from(node);
        int nodeId = edgeStore.idOf(node);
        if (nodeId == EdgeStore.NO_NODE) {
            return result.status(StepResult.Status.UNKNOWN_NODE).build();
        }
        int count = reverseIndex.predecessorCount(nodeId);
        result.predecessorCount(count);
        if (count == 0) {
            return result.status(StepResult.Status.NO_PREDECESSORS).build();
        }
        int predecessorId = edgeStore.idOf(predecessor);
        if (predecessorId == EdgeStore.NO_NODE || edgeStore.successorOf(predecessorId) != nodeId) {
            return result.status(StepResult.Status.NOT_A_PREDECESSOR).build();
        }
        return moveTo(result, predecessorId);
    }

    /**
     * Titles of every article whose first link is {@code node}; empty for unknown titles.
     */
    public List<String> predecessors(String node) {
        Objects.requireNonNull(node, "node");
        int nodeId = edgeStore.idOf(node);
        if (nodeId == EdgeStore.NO_NODE) {
            return Collections.emptyList();
        }
        List<String> titles = new ArrayList<>(reverseIndex.predecessorCount(nodeId));
        reverseIndex.forEachPredecessor(nodeId, predecessorId -> titles.add(edgeStore.title(predecessorId)));
        return titles;
    }

    private StepResult moveTo(StepResult.StepResultBuilder result, int destination) {
        int distance = distanceTable == null ? DistanceTable.NOT_REACHED : distanceTable.distance(destination);
        return result.status(StepResult.Status.MOVED)
                .node(edgeStore.title(destination))
                .distance(distance)
                .build();
    }
}
