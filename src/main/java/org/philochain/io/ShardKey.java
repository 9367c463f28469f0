package org.philochain.io;

import lombok.experimental.UtilityClass;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Shard naming used by the on-disk edge cache: one file per initial letter, plus
 * {@code num} for titles starting with a digit and {@code other} for everything else.
 */
@UtilityClass
public class ShardKey {
    public static final String NUMERIC = "num";
    public static final String OTHER = "other";
    public static final String FILE_PREFIX = "edges_";
    public static final String FILE_SUFFIX = ".json";

    /** All shard keys in load order. */
    public static final List<String> ALL = buildAll();

    private static List<String> buildAll() {
        List<String> keys = new ArrayList<>(28);
        for (char c = 'a'; c <= 'z'; c++) {
            keys.add(String.valueOf(c));
        }
        keys.add(NUMERIC);
        keys.add(OTHER);
        return Collections.unmodifiableList(keys);
    }

    /**
     * Returns the shard key a title belongs to.
     */
    public static String of(String title) {
        Objects.requireNonNull(title, "title");
        if (title.isEmpty()) {
            return OTHER;
        }
        char first = title.charAt(0);
        if (first >= 'A' && first <= 'Z') {
            return String.valueOf((char) (first + ('a' - 'A')));
        }
        if (first >= 'a' && first <= 'z') {
            return String.valueOf(first);
        }
        if (first >= '0' && first <= '9') {
            return NUMERIC;
        }
        return OTHER;
    }

    /**
     * Resolves the shard file for a key inside a cache directory.
     */
    public static Path fileFor(Path directory, String key) {
        return directory.resolve(FILE_PREFIX + key + FILE_SUFFIX);
    }
}
