package io.anchorbase.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per completed replica request.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request. 5xx responses go out at WARNING with their cause.
     *
     * @param storageMillis time spent in the store, or -1 when the request never reached it
     * @param error         failure behind the response, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storageMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                storageMillis >= 0 ? ", store=" + storageMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
