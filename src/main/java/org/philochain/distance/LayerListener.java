package org.philochain.distance;

/**
 * Progress callback invoked after each BFS layer has been expanded.
 */
@FunctionalInterface
public interface LayerListener {
    LayerListener NONE = (layer, expandedNodes, discoveredNodes, elapsedNanos) -> { };

    /**
     * @param layer hop count of the expanded layer.
     * @param expandedNodes nodes in the expanded layer.
     * @param discoveredNodes nodes newly assigned distance {@code layer + 1}.
     * @param elapsedNanos wall time spent on this layer.
     */
    void onLayer(int layer, int expandedNodes, int discoveredNodes, long elapsedNanos);
}
