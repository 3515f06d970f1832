package com.tradeguard.stream;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trims streams by age first, then by length.
 *
 * <p>The age pass removes only entries whose id timestamp is older than the
 * stream's retention, so it never touches a younger entry. The length pass is
 * the hard memory bound: if the stream is still longer than its cap after the
 * age pass, the oldest entries go regardless of age.
 */
public class StreamTrimmer {

    private static final Logger log = LoggerFactory.getLogger(StreamTrimmer.class);

    private final StreamBroker broker;
    private final Clock clock;

    public StreamTrimmer(StreamBroker broker, Clock clock) {
        this.broker = broker;
        this.clock = clock;
    }

    public TrimResult trim(EventStreamConfig config) {
        StreamEntryId minId = StreamEntryId.minimumAt(clock.instant().minus(config.retention()));
        long byAge = broker.trimByMinId(config.streamName(), minId);
        long byLength = broker.trimByMaxLength(config.streamName(), config.maxLength());
        if (byAge > 0 || byLength > 0) {
            log.info("Trimmed stream {}: byAge={} byLength={} minId={}", config.streamName(), byAge, byLength, minId);
        }
        return new TrimResult(config.streamName(), byAge, byLength);
    }

    /** Trims every catalog stream. A failure on one stream does not stop the others. */
    public List<TrimResult> trimAll() {
        List<TrimResult> results = new ArrayList<>();
        for (EventStreamConfig config : EventStreamCatalog.streams()) {
            try {
                results.add(trim(config));
            } catch (RuntimeException e) {
                log.warn("Trimming stream {} failed: {}", config.streamName(), e.getMessage());
            }
        }
        return results;
    }

    public record TrimResult(String stream, long removedByAge, long removedByLength) {}
}
