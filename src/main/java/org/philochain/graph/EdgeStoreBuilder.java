package org.philochain.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.philochain.core.id.FastUtilIDMapper;

import java.util.BitSet;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable accumulator for an {@link EdgeStore}.
 * <p>
 * Supports incremental merge from shards. Re-declaring a title with the same successor is a
 * no-op; re-declaring it with a different successor violates the one-edge-per-node invariant
 * and is rejected.
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe.
 */
public final class EdgeStoreBuilder {
    private final Object2IntOpenHashMap<String> ids = new Object2IntOpenHashMap<>();
    private final IntArrayList successors = new IntArrayList();
    private final BitSet declared = new BitSet();

    EdgeStoreBuilder() {
        ids.defaultReturnValue(EdgeStore.NO_NODE);
    }

    /**
     * Declares {@code title} with the given outgoing edge.
     *
     * @return this builder.
     * @throws IllegalArgumentException if {@code title} was already declared with another successor.
     */
    public EdgeStoreBuilder put(String title, Successor successor) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(successor, "successor");

        int nodeId = idFor(title);
        if (declared.get(nodeId)) {
            int existing = successors.getInt(nodeId);
            if (!sameSuccessor(existing, successor)) {
                throw new IllegalArgumentException(
                        "conflicting successors for '" + title + "': "
                                + describe(existing) + " vs " + successor
                );
            }
            return this;
        }
        // Only a put that is accepted may register the successor title.
        int successorId = successor.isResolved() ? idFor(successor.title()) : EdgeStore.UNRESOLVED;
        declared.set(nodeId);
        successors.set(nodeId, successorId);
        return this;
    }

    private boolean sameSuccessor(int existing, Successor successor) {
        if (!successor.isResolved()) {
            return existing == EdgeStore.UNRESOLVED;
        }
        int successorId = ids.getInt(successor.title());
        return successorId != EdgeStore.NO_NODE && successorId == existing;
    }

    /**
     * Declares {@code title} with a resolved successor.
     */
    public EdgeStoreBuilder link(String title, String successorTitle) {
        return put(title, Successor.resolved(successorTitle));
    }

    /**
     * Declares {@code title} with no outgoing edge.
     */
    public EdgeStoreBuilder deadEnd(String title) {
        return put(title, Successor.unresolved());
    }

    /**
     * Merges one raw title -> successor mapping. A {@code null} or empty successor is unresolved.
     *
     * @return this builder.
     */
    public EdgeStoreBuilder merge(Map<String, String> shard) {
        Objects.requireNonNull(shard, "shard");
        for (Map.Entry<String, String> entry : shard.entrySet()) {
            String value = entry.getValue();
            put(entry.getKey(), value == null || value.isEmpty() ? Successor.unresolved() : Successor.resolved(value));
        }
        return this;
    }

    /**
     * Number of titles declared so far.
     */
    public int declaredCount() {
        return declared.cardinality();
    }

    /**
     * Builds an immutable store snapshot. The builder stays usable afterwards.
     */
    public EdgeStore build() {
        return new EdgeStore(
                new FastUtilIDMapper(ids),
                successors.toIntArray(),
                (BitSet) declared.clone()
        );
    }

    private int idFor(String title) {
        int nodeId = ids.getInt(title);
        if (nodeId == EdgeStore.NO_NODE) {
            nodeId = successors.size();
            ids.put(title, nodeId);
            successors.add(EdgeStore.UNRESOLVED);
        }
        return nodeId;
    }

    private String describe(int successorId) {
        if (successorId == EdgeStore.UNRESOLVED) {
            return "Unresolved";
        }
        for (Object2IntMap.Entry<String> entry : ids.object2IntEntrySet()) {
            if (entry.getIntValue() == successorId) {
                return "Resolved(" + entry.getKey() + ")";
            }
        }
        return "Resolved(#" + successorId + ")";
    }
}
