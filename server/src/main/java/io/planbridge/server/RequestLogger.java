// file: server/src/main/java/io/planbridge/server/RequestLogger.java
package io.planbridge.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal hook for request-level logging.
 *
 * Responsibilities:
 *  - Central place to log the operation, its target, status and latency.
 *  - Can later be swapped for a metrics backend.
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
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception, null if none
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);
        write(status >= 500, msg, error);
    }

    /**
     * Log a completed gRPC call.
     *
     * @param method      RPC name (Check, Diff, ...)
     * @param urn         resource urn as received
     * @param status      gRPC status code name
     * @param totalMillis wall-clock latency
     * @param error       optional exception, null if none
     */
    public static void logRpc(String method, String urn, String status, long totalMillis, Throwable error) {
        String msg = String.format("RPC %s %s -> %s (total=%dms)", method, urn, status, totalMillis);
        write(!"OK".equals(status), msg, error);
    }

    private static void write(boolean failed, String msg, Throwable error) {
        if (failed && error != null) {
            log.log(Level.WARNING, msg, error);
        } else if (failed) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
