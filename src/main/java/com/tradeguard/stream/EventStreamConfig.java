package com.tradeguard.stream;

import java.time.Duration;

/** Static description of one stream: its size cap, retention, consumer group and tier. */
public record EventStreamConfig(
        String streamName, long maxLength, Duration retention, String consumerGroup, StreamPriority priority) {}
