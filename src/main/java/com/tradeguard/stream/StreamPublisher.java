package com.tradeguard.stream;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends typed events to their streams.
 *
 * <p>Every entry carries {@code event_type} and a millisecond {@code timestamp};
 * these overwrite payload fields of the same name. Payload values are stored as
 * strings and null values are dropped.
 */
public class StreamPublisher {

    private static final Logger log = LoggerFactory.getLogger(StreamPublisher.class);

    public static final String FIELD_EVENT_TYPE = "event_type";
    public static final String FIELD_TIMESTAMP = "timestamp";

    /** Cap for streams published to by override that are not in the catalog. */
    static final long UNCATALOGED_MAX_LENGTH = 10_000;

    private final StreamBroker broker;
    private final Clock clock;
    private final AtomicLong published = new AtomicLong();

    public StreamPublisher(StreamBroker broker, Clock clock) {
        this.broker = broker;
        this.clock = clock;
    }

    public StreamEntryId publish(EventType eventType, Map<String, ?> data) {
        return publish(eventType, data, null);
    }

    /**
     * @param streamOverride target stream, or null for the event type's default stream
     * @throws com.tradeguard.exception.StreamBrokerException if the broker rejects the append
     */
    public StreamEntryId publish(EventType eventType, Map<String, ?> data, String streamOverride) {
        String stream = streamOverride != null ? streamOverride : eventType.getDefaultStream();
        long maxLength = EventStreamCatalog.stream(stream)
                .map(EventStreamConfig::maxLength)
                .orElseGet(() -> {
                    log.warn("Publishing {} to uncataloged stream {}, capping at {}",
                            eventType, stream, UNCATALOGED_MAX_LENGTH);
                    return UNCATALOGED_MAX_LENGTH;
                });

        Map<String, String> fields = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            if (value != null) {
                fields.put(key, String.valueOf(value));
            }
        });
        fields.put(FIELD_EVENT_TYPE, eventType.name());
        fields.put(FIELD_TIMESTAMP, String.valueOf(clock.millis()));

        StreamEntryId id = broker.append(stream, fields, maxLength);
        published.incrementAndGet();
        log.debug("Published {} to {} as {}", eventType, stream, id);
        return id;
    }

    public long getPublishedCount() {
        return published.get();
    }
}
