package org.philochain.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.philochain.core.id.IDMapper;

import java.util.BitSet;
import java.util.Objects;

/**
 * Immutable functional graph of first links.
 * <p>
 * Every article title known to the store has a dense node id. Titles that were keys of the
 * loaded mapping are <em>declared</em>; titles only seen as a link target are <em>implicit</em>
 * and have no known successor. Successors are held in a flat {@code int[]} indexed by node id,
 * with {@link #UNRESOLVED} marking a missing edge.
 * <p>
 * <strong>Thread Safety:</strong> immutable after construction; safe for any number of readers.
 */
public final class EdgeStore {
    /** Internal marker for "no outgoing edge". */
    public static final int UNRESOLVED = -1;
    /** Returned by {@link #idOf(String)} for titles unknown to the store. */
    public static final int NO_NODE = -1;

    @Getter
    @Accessors(fluent = true)
    private final IDMapper mapper;
    private final int[] successors;
    private final BitSet declared;
    private final int declaredCount;
    @Getter
    @Accessors(fluent = true)
    private final int resolvedEdgeCount;

    EdgeStore(IDMapper mapper, int[] successors, BitSet declared) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.successors = Objects.requireNonNull(successors, "successors");
        this.declared = Objects.requireNonNull(declared, "declared");
        if (successors.length != mapper.size()) {
            throw new IllegalArgumentException(
                    "successor table size " + successors.length + " != mapper size " + mapper.size()
            );
        }
        int resolved = 0;
        for (int nodeId = 0; nodeId < successors.length; nodeId++) {
            int successor = successors[nodeId];
            if (successor == UNRESOLVED) {
                continue;
            }
            if (successor < 0 || successor >= successors.length) {
                throw new IllegalArgumentException("successor of node " + nodeId + " out of bounds: " + successor);
            }
            if (!declared.get(nodeId)) {
                throw new IllegalArgumentException("implicit node " + nodeId + " cannot carry a successor");
            }
            resolved++;
        }
        this.resolvedEdgeCount = resolved;
        this.declaredCount = declared.cardinality();
    }

    /**
     * Creates an empty builder.
     */
    public static EdgeStoreBuilder builder() {
        return new EdgeStoreBuilder();
    }

    /**
     * Number of declared nodes, i.e. keys of the loaded mapping.
     */
    public int size() {
        return declaredCount;
    }

    /**
     * Number of node ids, declared and implicit.
     */
    public int nodeCount() {
        return successors.length;
    }

    /**
     * Returns the node id for a title, or {@link #NO_NODE} when the title is unknown.
     */
    public int idOf(String title) {
        return mapper.toInternalOrDefault(title, NO_NODE);
    }

    /**
     * Returns the title for a node id.
     */
    public String title(int nodeId) {
        return mapper.toExternal(nodeId);
    }

    /**
     * Whether the title is known to the store, either declared or implicit.
     */
    public boolean contains(String title) {
        return mapper.containsExternal(title);
    }

    /**
     * Whether the node was a key of the loaded mapping.
     */
    public boolean isDeclared(int nodeId) {
        validateNode(nodeId);
        return declared.get(nodeId);
    }

    /**
     * Returns the successor node id or {@link #UNRESOLVED}.
     * UNCHECKED for performance; callers pass ids obtained from this store.
     */
    public int successorOf(int nodeId) {
        assert nodeId >= 0 && nodeId < successors.length : "Node " + nodeId + " out of bounds";
        return successors[nodeId];
    }

    /**
     * Looks up the successor of a title. Unknown and implicit titles have no known successor.
     */
    public Successor successor(String title) {
        int nodeId = idOf(title);
        if (nodeId == NO_NODE) {
            return Successor.unresolved();
        }
        int successor = successors[nodeId];
        return successor == UNRESOLVED ? Successor.unresolved() : Successor.resolved(title(successor));
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= successors.length) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }
}
