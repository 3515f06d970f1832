package com.tradeguard.unit.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeguard.store.InMemoryKeyValueStore;
import com.tradeguard.unit.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        store = new InMemoryKeyValueStore(clock);
    }

    @Test
    @DisplayName("Serves an entry until its TTL elapses on the injected clock")
    void expiresOnClock() {
        store.set("tg:price:BTCUSDT", "{}", Duration.ofSeconds(5));

        clock.advance(Duration.ofMillis(4_999));
        assertThat(store.get("tg:price:BTCUSDT")).contains("{}");

        clock.advance(Duration.ofMillis(1));
        assertThat(store.get("tg:price:BTCUSDT")).isEmpty();
    }

    @Test
    @DisplayName("Overwriting an entry restarts its TTL")
    void overwriteRestartsTtl() {
        store.set("key", "a", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(4));
        store.set("key", "b", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(4));

        assertThat(store.get("key")).contains("b");
    }

    @Test
    @DisplayName("Delete removes the entry and the store is process-local")
    void deleteAndLocality() {
        store.set("key", "a", Duration.ofSeconds(5));
        store.delete("key");

        assertThat(store.get("key")).isEmpty();
        assertThat(store.isShared()).isFalse();
    }
}
