package org.philochain.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Title translation layer backed by fastutil.
 * <p>
 * Titles are hashed once into an open-addressing map; the reverse direction is a plain
 * array indexed by node id. Immutable and safe for concurrent reads.
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    // title -> id
    private final Object2IntOpenHashMap<String> forward;
    // id -> title
    private final String[] reverse;

    /**
     * Copies title -> id pairs from a primitive fastutil map.
     * Validates that the ids are dense and 0-indexed.
     */
    public FastUtilIDMapper(Object2IntMap<String> mappings) {
        if (mappings == null) {
            throw new IllegalArgumentException("Mappings cannot be null");
        }
        int size = mappings.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (Object2IntMap.Entry<String> entry : mappings.object2IntEntrySet()) {
            String key = entry.getKey();
            if (key == null) {
                throw new IllegalArgumentException("Title cannot be null");
            }
            int value = checkedIndex(entry.getIntValue(), size, this.reverse);
            this.forward.put(key, value);
            this.reverse[value] = key;
        }
        this.forward.trim();
    }

    private static int checkedIndex(int value, int size, String[] reverse) {
        if (value < 0 || value >= size) {
            throw new IllegalArgumentException(
                    "Input indices must be dense and 0-indexed. Found out of bounds: " + value
            );
        }
        if (reverse[value] != null) {
            throw new IllegalArgumentException(
                    "Duplicate internal index detected in input map: " + value
            );
        }
        return value;
    }

    @Override
    public int toInternalOrDefault(String title, int missingValue) {
        if (title == null) {
            return missingValue;
        }
        int id = forward.getInt(title);
        return id == MISSING ? missingValue : id;
    }

    @Override
    public String toExternal(int nodeId) {
        try {
            return reverse[nodeId];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Node id out of bounds: " + nodeId);
        }
    }

    @Override
    public boolean containsExternal(String title) {
        return title != null && forward.containsKey(title);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
