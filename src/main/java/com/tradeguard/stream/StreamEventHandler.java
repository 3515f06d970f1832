package com.tradeguard.stream;

/**
 * Business logic for one consuming service, looked up by {@link #serviceName()}
 * when the event stream manager starts.
 *
 * <p>A handler that throws leaves its whole batch unacknowledged, so the entries
 * are redelivered through the pending-reclaim path.
 */
public interface StreamEventHandler {

    String serviceName();

    void handle(StreamEntry entry) throws Exception;

    /**
     * Periodic work run when the bound stream has gone quiet. Defaults to nothing.
     */
    default void runFallback() throws Exception {}
}
