package io.plaice.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the admin HTTP surface.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency of the whole request
     * @param error       exception behind a 5xx, or null
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 400) {
            log.log(Level.INFO, msg);
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
