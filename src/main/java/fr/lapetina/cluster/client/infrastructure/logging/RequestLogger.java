package fr.lapetina.cluster.client.infrastructure.logging;

/**
 * Destination for the client's request log, trace and error output.
 *
 * Anything that can write a formatted line qualifies. Implementations must be
 * safe for concurrent use: request threads and background tasks log at the same time.
 */
@FunctionalInterface
public interface RequestLogger {

    /**
     * Writes one line.
     *
     * @param format {@link java.util.Formatter} pattern
     * @param args   pattern arguments
     */
    void printf(String format, Object... args);
}
