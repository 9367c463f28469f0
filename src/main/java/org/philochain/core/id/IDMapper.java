package org.philochain.core.id;

/**
 * Bidirectional mapping contract between article titles and dense internal node ids.
 */
public interface IDMapper {

    /**
     * Converts an internal node id back to its article title.
     * @param nodeId The internal node id.
     * @return The article title.
     * @throws IndexOutOfBoundsException If the node id is invalid.
     */
    String toExternal(int nodeId);

    /**
     * Returns the internal id for a title, or {@code missingValue} when unmapped.
     * Titles match exactly, case and whitespace included.
     *
     * @param title article title; {@code null} is treated as unmapped.
     * @param missingValue value returned for unknown titles.
     * @return internal node id or {@code missingValue}.
     */
    int toInternalOrDefault(String title, int missingValue);

    /**
     * Checks whether an article title has a mapped internal id.
     *
     * @param title title to test.
     * @return true when the title is present.
     */
    boolean containsExternal(String title);

    /**
     * Number of mapped titles; ids run from 0 to {@code size() - 1}.
     */
    int size();
}
