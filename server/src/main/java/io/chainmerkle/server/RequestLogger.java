// file: server/src/main/java/io/chainmerkle/server/RequestLogger.java
package io.chainmerkle.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request served by {@link WebServer}.
 * <p>
 * Line shape: {@code POST /merkle/build 200 in 12ms (tree 9ms)}.
 * Server faults go out at WARNING with their stack trace; client errors
 * (4xx) and successes at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {}

    /**
     * @param treeMillis time spent in tree build/verify work, negative when the
     *                   request never reached it (routing errors, bad bodies)
     * @param error      failure behind a non-200 status, or null
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long treeMillis,
            Throwable error
    ) {
        StringBuilder line = new StringBuilder()
                .append(method).append(' ').append(path).append(' ').append(status)
                .append(" in ").append(totalMillis).append("ms");
        if (treeMillis >= 0) {
            line.append(" (tree ").append(treeMillis).append("ms)");
        }

        if (status >= 500) {
            log.log(Level.WARNING, line.toString(), error);
        } else {
            log.info(line::toString);
        }
    }
}
