package org.philochain.io;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Fatal failure while assembling the edge store from external data.
 * <p>
 * Raised once at load time; an engine is never constructed from partially read input.
 */
@Getter
public final class GraphLoadException extends RuntimeException {
    /** Shard or file that failed, or {@code null} when the failure is not tied to one file. */
    private final Path source;

    public GraphLoadException(Path source, String message) {
        super(format(source, message));
        this.source = source;
    }

    public GraphLoadException(Path source, String message, Throwable cause) {
        super(format(source, message), cause);
        this.source = source;
    }

    private static String format(Path source, String message) {
        return source == null ? message : message + " [" + source + "]";
    }
}
