package com.tradeguard.stream;

import java.time.Duration;

/**
 * Static description of one consuming service.
 *
 * @param fallbackInterval base interval of the adaptive fallback loop, before resource scaling
 * @param batchTimeout upper bound for processing one batch; a slower batch is left unacknowledged
 */
public record ServiceConsumerConfig(
        String serviceName,
        String stream,
        StreamPriority priority,
        Duration fallbackInterval,
        int batchSize,
        Duration batchTimeout) {}
