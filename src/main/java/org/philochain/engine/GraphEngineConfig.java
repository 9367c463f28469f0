package org.philochain.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Engine configuration.
 */
@Value
@Builder(toBuilder = true)
public class GraphEngineConfig {
    public static final String DEFAULT_TARGET = "Philosophy";

    static final String PROP_TARGET = "philochain.target";
    static final String PROP_REVERSE_INDEX_PARTITIONS = "philochain.reverseIndex.partitions";
    static final String PROP_MAX_RACE_ROUNDS = "philochain.race.maxRounds";

    /**
     * Title every path, distance and race is measured against.
     */
    @Builder.Default
    String targetTitle = DEFAULT_TARGET;

    /**
     * Partitions for the reverse index build. 1 builds on the calling thread.
     */
    @Builder.Default
    int reverseIndexPartitions = 1;

    /**
     * Race round limit. Values {@code <= 0} use the node-count bound.
     */
    @Builder.Default
    int maxRaceRounds = 0;

    /**
     * Default configuration.
     */
    public static GraphEngineConfig defaults() {
        return GraphEngineConfig.builder().build();
    }

    /**
     * Reads overrides from system properties. Missing or malformed values keep the defaults.
     */
    public static GraphEngineConfig fromSystemProperties() {
        GraphEngineConfig defaults = defaults();
        String target = System.getProperty(PROP_TARGET);
        return GraphEngineConfig.builder()
                .targetTitle(target == null || target.isBlank() ? defaults.getTargetTitle() : target)
                .reverseIndexPartitions(readInt(PROP_REVERSE_INDEX_PARTITIONS, defaults.getReverseIndexPartitions()))
                .maxRaceRounds(readInt(PROP_MAX_RACE_ROUNDS, defaults.getMaxRaceRounds()))
                .build();
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
