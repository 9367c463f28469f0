package org.philochain.io;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.philochain.graph.EdgeStore;
import org.philochain.graph.EdgeStoreBuilder;
import org.philochain.graph.Successor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles an {@link EdgeStore} from JSON edge shards.
 * <p>
 * Each shard is a single JSON object mapping article title to first-link title. An empty
 * string or {@code null} value marks an article without a usable link. Shards are streamed
 * token by token so a multi-million entry shard never materializes as an intermediate map.
 * Any unreadable or malformed shard aborts the whole load with {@link GraphLoadException}.
 */
public final class EdgeShardLoader {
    private static final Logger log = LogManager.getLogger(EdgeShardLoader.class);

    private final JsonFactory jsonFactory;

    public EdgeShardLoader() {
        this(new ObjectMapper());
    }

    /**
     * @param objectMapper source of parser settings; its factory is copied, not modified.
     */
    public EdgeShardLoader(ObjectMapper objectMapper) {
        this.jsonFactory = shardFactory(Objects.requireNonNull(objectMapper, "objectMapper").getFactory());
    }

    // Shard keys are unique titles; interning or canonicalizing them only fills the symbol table.
    static JsonFactory shardFactory(JsonFactory base) {
        return base.copy()
                .disable(JsonFactory.Feature.INTERN_FIELD_NAMES)
                .disable(JsonFactory.Feature.CANONICALIZE_FIELD_NAMES);
    }

    JsonFactory jsonFactory() {
        return jsonFactory;
    }

    /**
     * Loads every shard of a cache directory ({@code edges_a.json} ... {@code edges_other.json}).
     *
     * @throws GraphLoadException when a shard is missing, unreadable or malformed.
     */
    public EdgeStore loadDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new GraphLoadException(directory, "edge cache directory does not exist");
        }
        List<Path> shards = new ArrayList<>(ShardKey.ALL.size());
        for (String key : ShardKey.ALL) {
            shards.add(ShardKey.fileFor(directory, key));
        }
        return loadFiles(shards);
    }

    /**
     * Loads and merges the given shard files in order.
     *
     * @throws GraphLoadException when a file is missing, unreadable or malformed.
     */
    public EdgeStore loadFiles(List<Path> files) {
        Objects.requireNonNull(files, "files");
        long started = System.nanoTime();
        EdgeStoreBuilder builder = EdgeStore.builder();
        for (Path file : files) {
            int entries = mergeShard(file, builder);
            log.debug("Merged {} entries from {}", entries, file.getFileName());
        }
        EdgeStore store = builder.build();
        log.info("Loaded {} articles ({} linked, {} known titles) from {} shards in {} ms",
                store.size(), store.resolvedEdgeCount(), store.nodeCount(), files.size(),
                (System.nanoTime() - started) / 1_000_000L);
        return store;
    }

    /**
     * Streams one shard into {@code builder}.
     *
     * @return number of entries merged.
     * @throws GraphLoadException when the file is missing, unreadable or malformed.
     */
    public int mergeShard(Path file, EdgeStoreBuilder builder) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(builder, "builder");
        if (!Files.isRegularFile(file)) {
            throw new GraphLoadException(file, "edge shard not found");
        }
        String expectedKey = shardKeyOf(file);
        int entries = 0;
        int misplaced = 0;
        try (InputStream in = Files.newInputStream(file);
             JsonParser parser = jsonFactory.createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new GraphLoadException(file, "edge shard must be a JSON object");
            }
            JsonToken token;
            while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
                String title = parser.getCurrentName();
                JsonToken valueToken = parser.nextToken();
                Successor successor;
                if (valueToken == JsonToken.VALUE_NULL) {
                    successor = Successor.unresolved();
                } else if (valueToken == JsonToken.VALUE_STRING) {
                    String linked = parser.getText();
                    successor = linked.isEmpty() ? Successor.unresolved() : Successor.resolved(linked);
                } else {
                    throw new GraphLoadException(file,
                            "successor of '" + title + "' must be a string or null, got " + valueToken);
                }
                try {
                    builder.put(title, successor);
                } catch (IllegalArgumentException e) {
                    throw new GraphLoadException(file, e.getMessage(), e);
                }
                if (expectedKey != null && !expectedKey.equals(ShardKey.of(title))) {
                    misplaced++;
                }
                entries++;
            }
            if (token != JsonToken.END_OBJECT) {
                throw new GraphLoadException(file, "unexpected token " + token + " in edge shard");
            }
        } catch (IOException e) {
            throw new GraphLoadException(file, "failed to read edge shard: " + e.getMessage(), e);
        }
        if (misplaced > 0) {
            log.warn("{} of {} entries in {} belong to another shard", misplaced, entries, file.getFileName());
        }
        return entries;
    }

    private static String shardKeyOf(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return null;
        }
        String name = fileName.toString();
        if (!name.startsWith(ShardKey.FILE_PREFIX) || !name.endsWith(ShardKey.FILE_SUFFIX)) {
            return null;
        }
        String key = name.substring(ShardKey.FILE_PREFIX.length(), name.length() - ShardKey.FILE_SUFFIX.length());
        return ShardKey.ALL.contains(key) ? key : null;
    }
}
