package org.philochain.graph;

import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * Outgoing edge of one article: either a resolved first-link target or unresolved.
 *
 * <p>Unresolved means the upstream parser found no qualifying link. It is distinct
 * from a self-loop, which is a resolved successor equal to the article itself.</p>
 */
@EqualsAndHashCode
public final class Successor {
    /**
     * Successor variant tag.
     */
    public enum Kind {
        RESOLVED,
        UNRESOLVED
    }

    private static final Successor UNRESOLVED = new Successor(Kind.UNRESOLVED, null);

    private final Kind kind;
    private final String title;

    private Successor(Kind kind, String title) {
        this.kind = kind;
        this.title = title;
    }

    /**
     * Creates a resolved successor pointing at {@code title}.
     */
    public static Successor resolved(String title) {
        return new Successor(Kind.RESOLVED, Objects.requireNonNull(title, "title"));
    }

    /**
     * Returns the shared unresolved successor.
     */
    public static Successor unresolved() {
        return UNRESOLVED;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isResolved() {
        return kind == Kind.RESOLVED;
    }

    /**
     * Returns the successor title.
     *
     * @throws IllegalStateException when this successor is unresolved.
     */
    public String title() {
        if (kind != Kind.RESOLVED) {
            throw new IllegalStateException("unresolved successor has no title");
        }
        return title;
    }

    @Override
    public String toString() {
        return kind == Kind.RESOLVED ? "Resolved(" + title + ")" : "Unresolved";
    }
}
