package org.philochain.app;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.philochain.distance.DistanceTable;
import org.philochain.engine.GraphEngineConfig;
import org.philochain.engine.PhilosophyGraph;
import org.philochain.graph.EdgeStore;
import org.philochain.io.EdgeShardLoader;
import org.philochain.stats.GraphStatistics;
import org.philochain.walk.WalkResult;

import java.nio.file.Path;

/**
 * Non-interactive smoke run: loads an edge cache, computes distances and logs a summary.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * @param args edge cache directory, followed by optional article titles to walk.
     */
    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        if (args.length == 0) {
            log.error("Usage: Main <edge-cache-dir> [article ...]");
            return 2;
        }
        EdgeStore store = new EdgeShardLoader().loadDirectory(Path.of(args[0]));
        PhilosophyGraph graph = PhilosophyGraph.create(store, GraphEngineConfig.fromSystemProperties());

        DistanceTable distances = graph.computeDistances();
        log.info("{} is reached from {} articles, farthest at {} hops",
                graph.targetTitle(), distances.reachedDeclaredCount(), distances.maxDistance());

        GraphStatistics statistics = graph.statistics();
        for (GraphStatistics.HeatEntry entry : statistics.hottest(10)) {
            log.info("  {} <- {} articles", entry.title(), entry.heat());
        }

        for (int i = 1; i < args.length; i++) {
            WalkResult walk = graph.followPath(args[i]);
            log.info("{}: {} after {} hops: {}", args[i], walk.getTermination(), walk.hops(),
                    String.join(" -> ", walk.getPath()));
        }
        return 0;
    }
}
