package org.philochain.walk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of following first links from one start article.
 *
 * <p>For {@link WalkTermination#CYCLE} the last path element repeats an earlier one and is
 * reported as {@code repeatedNode}. For {@link WalkTermination#REACHED_TARGET} the last element
 * is the target.</p>
 */
@Value
@Builder
public class WalkResult {
    /** How the walk ended. */
    WalkTermination termination;
    /** Titles in visiting order, starting with the start article. */
    @Singular("pathNode")
    List<String> path;
    /** Node that closed the loop; {@code null} unless the walk ended in a cycle. */
    String repeatedNode;
    /** True when the start title is not known to the edge store at all. */
    boolean unknownStart;

    /**
     * Number of edges followed.
     */
    public int hops() {
        return path.size() - 1;
    }

    /**
     * Length of the loop that ended the walk, or 0 when the walk did not cycle.
     */
    public int cycleLength() {
        if (termination != WalkTermination.CYCLE) {
            return 0;
        }
        return path.size() - 1 - path.indexOf(repeatedNode);
    }

    public String lastNode() {
        return path.get(path.size() - 1);
    }

    public boolean reachedTarget() {
        return termination == WalkTermination.REACHED_TARGET;
    }
}
