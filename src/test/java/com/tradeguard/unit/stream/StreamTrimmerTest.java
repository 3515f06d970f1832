package com.tradeguard.unit.stream;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeguard.stream.EventStreamCatalog;
import com.tradeguard.stream.EventStreamConfig;
import com.tradeguard.stream.EventType;
import com.tradeguard.stream.InMemoryStreamBroker;
import com.tradeguard.stream.StreamEntryId;
import com.tradeguard.stream.StreamPriority;
import com.tradeguard.stream.StreamPublisher;
import com.tradeguard.stream.StreamTrimmer;
import com.tradeguard.unit.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for StreamTrimmer. The age pass must never remove an entry younger than
 * the stream's retention; the length pass bounds the stream regardless of age.
 */
class StreamTrimmerTest {

    private MutableClock clock;
    private InMemoryStreamBroker broker;
    private StreamPublisher publisher;
    private StreamTrimmer trimmer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        broker = new InMemoryStreamBroker(clock);
        publisher = new StreamPublisher(broker, clock);
        trimmer = new StreamTrimmer(broker, clock);
    }

    @Test
    @DisplayName("150,000 price updates converge to at most 100,000 entries within the retention window")
    void highVolumeConvergesWithinCapAndRetention() {
        EventStreamConfig config = EventStreamCatalog.stream(EventStreamCatalog.MARKET_UPDATES).orElseThrow();
        assertThat(config.maxLength()).isEqualTo(100_000);

        for (int i = 0; i < 150_000; i++) {
            publisher.publish(EventType.PRICE_UPDATE, Map.of("symbol", "BTCUSDT", "price", "65000." + i));
            clock.advance(Duration.ofMillis(50));
        }
        assertThat(broker.info(config.streamName()).length()).isLessThanOrEqualTo(100_000);

        StreamTrimmer.TrimResult result = trimmer.trim(config);

        Instant cutoff = clock.instant().minus(config.retention());
        StreamEntryId oldest = broker.firstEntryId(config.streamName());
        assertThat(oldest.timestamp()).isAfterOrEqualTo(cutoff);
        assertThat(result.removedByAge()).isPositive();
        // 50ms spacing over a one hour retention
        assertThat(broker.info(config.streamName()).length()).isEqualTo(72_000);
    }

    @Test
    @DisplayName("Age pass keeps every entry younger than the retention")
    void agePassKeepsYoungEntries() {
        EventStreamConfig config = new EventStreamConfig(
                "system_events", 1_000, Duration.ofMinutes(10), "system_services", StreamPriority.BACKGROUND);
        for (int i = 0; i < 20; i++) {
            broker.append(config.streamName(), Map.of("n", String.valueOf(i)), 0);
            clock.advance(Duration.ofMinutes(1));
        }

        StreamTrimmer.TrimResult result = trimmer.trim(config);

        // entries at minutes 0..9 are older than 10 minutes, 10..19 remain
        assertThat(result.removedByAge()).isEqualTo(10);
        assertThat(result.removedByLength()).isZero();
        assertThat(broker.info(config.streamName()).length()).isEqualTo(10);
        assertThat(broker.firstEntryId(config.streamName()).timestamp())
                .isEqualTo(Instant.parse("2026-03-02T09:10:00Z"));
    }

    @Test
    @DisplayName("Length pass removes the oldest entries once the age pass is not enough")
    void lengthPassBoundsYoungBursts() {
        EventStreamConfig config = new EventStreamConfig(
                "system_events", 5, Duration.ofHours(1), "system_services", StreamPriority.BACKGROUND);
        for (int i = 0; i < 8; i++) {
            broker.append(config.streamName(), Map.of("n", String.valueOf(i)), 0);
        }

        StreamTrimmer.TrimResult result = trimmer.trim(config);

        assertThat(result.removedByAge()).isZero();
        assertThat(result.removedByLength()).isEqualTo(3);
        assertThat(broker.info(config.streamName()).length()).isEqualTo(5);
    }

    @Test
    @DisplayName("trimAll covers every catalog stream, including ones never written")
    void trimAllCoversCatalog() {
        List<StreamTrimmer.TrimResult> results = trimmer.trimAll();

        assertThat(results).extracting(StreamTrimmer.TrimResult::stream)
                .containsExactlyElementsOf(EventStreamCatalog.streams().stream()
                        .map(EventStreamConfig::streamName)
                        .toList());
    }
}
