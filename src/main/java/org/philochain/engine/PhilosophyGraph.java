package org.philochain.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.philochain.distance.CancellationToken;
import org.philochain.distance.DistanceBuckets;
import org.philochain.distance.DistanceEngine;
import org.philochain.distance.DistanceTable;
import org.philochain.distance.LayerListener;
import org.philochain.distance.Navigator;
import org.philochain.distance.SampleResult;
import org.philochain.distance.StepDirection;
import org.philochain.distance.StepResult;
import org.philochain.graph.EdgeStore;
import org.philochain.graph.ReverseIndex;
import org.philochain.race.RaceResult;
import org.philochain.race.RaceSimulator;
import org.philochain.stats.GraphStatistics;
import org.philochain.stats.GraphStatisticsAnalyzer;
import org.philochain.walk.PathFollower;
import org.philochain.walk.WalkResult;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.random.RandomGenerator;

/**
 * Query context over one loaded first-link graph.
 *
 * <p>The caller constructs it explicitly and passes it around; nothing is held in static
 * state, so independent graphs (test fixtures, alternative targets) can coexist. Flow:</p>
 * <ul>
 * <li>Construction resolves the target and builds the reverse index once.</li>
 * <li>Path and race queries read the edge store directly.</li>
 * <li>The first distance, sampling or statistics query computes its table and caches it; a
 * cached table never changes afterwards.</li>
 * </ul>
 * <p>Expected conditions (unknown titles, dead ends, empty buckets, missing predecessors) come
 * back as result variants. Only broken contracts throw.</p>
 */
public final class PhilosophyGraph {
    private static final Logger log = LogManager.getLogger(PhilosophyGraph.class);

    public static final String REASON_UNKNOWN_TARGET = "UNKNOWN_TARGET";
    public static final String REASON_INVALID_CONFIG = "INVALID_CONFIG";

    private final EdgeStore edgeStore;
    private final ReverseIndex reverseIndex;
    private final GraphEngineConfig config;
    private final int targetId;

    private final PathFollower pathFollower;
    private final DistanceEngine distanceEngine;
    private final RaceSimulator raceSimulator;

    private final Object distanceLock = new Object();
    private final AtomicReference<DistanceSnapshot> distances = new AtomicReference<>();
    private final AtomicReference<GraphStatistics> statistics = new AtomicReference<>();

    private PhilosophyGraph(EdgeStore edgeStore, GraphEngineConfig config) {
        this.edgeStore = Objects.requireNonNull(edgeStore, "edgeStore");
        this.config = Objects.requireNonNull(config, "config");
        String targetTitle = config.getTargetTitle();
        if (targetTitle == null || targetTitle.isEmpty()) {
            throw new GraphQueryException(REASON_INVALID_CONFIG, "targetTitle must be non-empty");
        }
        if (config.getReverseIndexPartitions() <= 0) {
            throw new GraphQueryException(REASON_INVALID_CONFIG,
                    "reverseIndexPartitions must be > 0, got " + config.getReverseIndexPartitions());
        }
        this.targetId = edgeStore.idOf(targetTitle);
        if (targetId == EdgeStore.NO_NODE) {
            throw new GraphQueryException(REASON_UNKNOWN_TARGET,
                    "target '" + targetTitle + "' is not an article of the edge store");
        }

        this.reverseIndex = buildReverseIndex(edgeStore, config.getReverseIndexPartitions());
        this.pathFollower = new PathFollower(edgeStore, targetId);
        this.distanceEngine = new DistanceEngine(edgeStore, reverseIndex);
        this.raceSimulator = new RaceSimulator(edgeStore, targetId, config.getMaxRaceRounds());
        log.info("Graph ready: {} articles, {} links, target '{}' ({} direct predecessors)",
                edgeStore.size(), edgeStore.resolvedEdgeCount(), targetTitle, reverseIndex.predecessorCount(targetId));
    }

    /**
     * Creates a context with the default configuration.
     */
    public static PhilosophyGraph create(EdgeStore edgeStore) {
        return new PhilosophyGraph(edgeStore, GraphEngineConfig.defaults());
    }

    /**
     * Creates a context.
     *
     * @throws GraphQueryException when the target is unknown or the configuration is invalid.
     */
    public static PhilosophyGraph create(EdgeStore edgeStore, GraphEngineConfig config) {
        return new PhilosophyGraph(edgeStore, config);
    }

    private static ReverseIndex buildReverseIndex(EdgeStore edgeStore, int partitions) {
        if (partitions == 1) {
            return ReverseIndex.build(edgeStore);
        }
        ExecutorService executor = Executors.newFixedThreadPool(
                poolSize(partitions, Runtime.getRuntime().availableProcessors()));
        try {
            return ReverseIndex.buildParallel(edgeStore, partitions, executor);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Worker threads for a partitioned build: one per partition, at most one per processor.
     * Partitions beyond the pool size queue on the executor.
     */
    static int poolSize(int partitions, int processors) {
        return Math.max(1, Math.min(partitions, processors));
    }

    /**
     * Follows first links from {@code start}.
     */
    public WalkResult followPath(String start) {
        return pathFollower.follow(start);
    }

    /**
     * Returns the cached distance table, computing it on first use.
     */
    public DistanceTable computeDistances() {
        return computeDistances(CancellationToken.create(), LayerListener.NONE);
    }

    /**
     * Returns the cached distance table, computing it on first use.
     * <p>
     * Only a complete table is cached. A cancelled computation returns its partial table and
     * the next call starts over.
     */
    public DistanceTable computeDistances(CancellationToken cancellation, LayerListener listener) {
        DistanceSnapshot cached = distances.get();
        if (cached != null) {
            return cached.table();
        }
        synchronized (distanceLock) {
            cached = distances.get();
            if (cached != null) {
                return cached.table();
            }
            DistanceTable table = distanceEngine.compute(targetId, cancellation, listener);
            if (table.complete()) {
                distances.set(new DistanceSnapshot(table, DistanceBuckets.build(table)));
            }
            return table;
        }
    }

    /**
     * Distance of an article to the target; empty when it is unknown or never arrives.
     */
    public OptionalInt distanceOf(String title) {
        Objects.requireNonNull(title, "title");
        return computeDistances().distance(title);
    }

    /**
     * Takes one step from {@code node}. Away-from-target steps choose a predecessor with {@code random}.
     */
    public StepResult step(String node, StepDirection direction, RandomGenerator random) {
        return navigator().step(node, direction, random);
    }

    /**
     * Steps away from the target onto a specific predecessor of {@code node}.
     */
    public StepResult stepAway(String node, String predecessor) {
        return navigator().awayFromTarget(node, predecessor);
    }

    /**
     * Titles of every article whose first link is {@code node}.
     */
    public List<String> predecessors(String node) {
        return navigator().predecessors(node);
    }

    /**
     * Draws a uniformly random article at exactly {@code distance} hops from the target.
     */
    public SampleResult sampleAtDistance(int distance, RandomGenerator random) {
        return snapshot().buckets().sample(distance, random);
    }

    /**
     * Articles at exactly {@code distance} hops from the target.
     */
    public List<String> articlesAtDistance(int distance) {
        return snapshot().buckets().nodesAt(distance);
    }

    /**
     * Races first-link walks from the given distinct start titles.
     */
    public RaceResult race(List<String> starts) {
        return raceSimulator.race(starts);
    }

    /**
     * Returns cycle and heat statistics, computing them on first use.
     */
    public GraphStatistics statistics() {
        GraphStatistics cached = statistics.get();
        if (cached != null) {
            return cached;
        }
        GraphStatistics computed = GraphStatisticsAnalyzer.analyze(edgeStore, reverseIndex);
        return statistics.compareAndSet(null, computed) ? computed : statistics.get();
    }

    public EdgeStore edgeStore() {
        return edgeStore;
    }

    public ReverseIndex reverseIndex() {
        return reverseIndex;
    }

    public GraphEngineConfig config() {
        return config;
    }

    public int targetId() {
        return targetId;
    }

    public String targetTitle() {
        return edgeStore.title(targetId);
    }

    private Navigator navigator() {
        DistanceSnapshot cached = distances.get();
        return new Navigator(edgeStore, reverseIndex, cached == null ? null : cached.table());
    }

    private DistanceSnapshot snapshot() {
        computeDistances();
        return distances.get();
    }

    private record DistanceSnapshot(DistanceTable table, DistanceBuckets buckets) {
    }
}
