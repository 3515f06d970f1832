package com.tradeguard.stream.handler;

import com.tradeguard.stream.StreamEntry;
import com.tradeguard.stream.StreamEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records events for services whose business logic lives outside this module
 * (trade execution, risk, portfolio and balance sync). Acknowledges everything it
 * sees so those streams keep draining.
 */
public class LoggingEventHandler implements StreamEventHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventHandler.class);

    private final String serviceName;
    private final boolean verbose;

    /**
     * @param verbose log each event at INFO instead of DEBUG
     */
    public LoggingEventHandler(String serviceName, boolean verbose) {
        this.serviceName = serviceName;
        this.verbose = verbose;
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    @Override
    public void handle(StreamEntry entry) {
        if (verbose) {
            log.info("{} received {} {} from {}", serviceName, entry.eventType(), entry.id(), entry.stream());
        } else {
            log.debug("{} received {} {} from {}: {}",
                    serviceName, entry.eventType(), entry.id(), entry.stream(), entry.fields());
        }
    }

    @Override
    public void runFallback() {
        log.debug("{} fallback: no events within the activity window", serviceName);
    }
}
