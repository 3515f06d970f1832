package com.tradeguard.unit.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.concurrent.TaskSupervisor;
import com.tradeguard.exception.ConfigurationException;
import com.tradeguard.market.MarketDataPoint;
import com.tradeguard.market.feed.BinanceFeed;
import com.tradeguard.market.feed.ExchangeConnectionConfig;
import com.tradeguard.market.feed.ExchangeConnectionState;
import com.tradeguard.market.feed.ExchangeConnectionSupervisor;
import com.tradeguard.market.feed.WebSocketChannel;
import com.tradeguard.market.feed.WebSocketConnector;
import com.tradeguard.unit.support.MutableClock;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExchangeConnectionSupervisorTest {

    private static final String TICKER = "{\"e\":\"24hrTicker\",\"s\":\"BTCUSDT\",\"c\":\"65000.10\"}";

    private MutableClock clock;
    private ScriptedConnector connector;
    private List<MarketDataPoint> received;
    private TaskSupervisor tasks;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        connector = new ScriptedConnector();
        received = new CopyOnWriteArrayList<>();
        tasks = new TaskSupervisor("test-ws");
    }

    @AfterEach
    void tearDown() {
        tasks.shutdown(Duration.ofSeconds(1));
    }

    private ExchangeConnectionSupervisor supervisor(int maxRetries) {
        ExchangeConnectionConfig config = ExchangeConnectionConfig.builder()
                .reconnectDelay(Duration.ofMillis(1))
                .maxReconnectDelay(Duration.ofMillis(4))
                .maxRetries(maxRetries)
                .symbolsPerConnection(100)
                .closePollInterval(Duration.ofMillis(5))
                .build();
        return new ExchangeConnectionSupervisor(new BinanceFeed(new ObjectMapper(), "wss://stream.binance.com:9443"),
                config, connector, List.of("BTCUSDT"), received::add, clock);
    }

    @Test
    @DisplayName("Marks the exchange unhealthy after maxRetries consecutive failures")
    void unhealthyAfterRetries() {
        connector.failNext(5);
        ExchangeConnectionSupervisor supervisor = supervisor(3);

        supervisor.run(tasks);

        assertThat(supervisor.getState()).isEqualTo(ExchangeConnectionState.UNHEALTHY);
        assertThat(supervisor.getStatus().getConnectAttempts()).isEqualTo(3);
        assertThat(supervisor.getStatus().getConsecutiveFailures()).isEqualTo(3);
        assertThat(supervisor.getStatus().getLastError()).contains("ConnectException");
    }

    @Test
    @DisplayName("A received ticker resets the failure count")
    void tickerResetsFailures() {
        connector.failNext(2);
        connector.thenStreamAndClose(TICKER);
        connector.failNext(5);
        ExchangeConnectionSupervisor supervisor = supervisor(3);

        supervisor.run(tasks);

        // two failures, a session that delivered data and closed, then two more failures
        assertThat(supervisor.getStatus().getConnectAttempts()).isEqualTo(5);
        assertThat(supervisor.getState()).isEqualTo(ExchangeConnectionState.UNHEALTHY);
        assertThat(received).extracting(MarketDataPoint::getSymbol).containsExactly("BTCUSDT");
        assertThat(received.get(0).getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Malformed frames are counted and dropped without ending the session")
    void malformedFramesDropped() {
        connector.thenStreamAndClose("{\"e\":\"24hrTicker\",\"s\":\"BTCUSDT\"}", "garbage", TICKER);
        connector.failNext(5);
        ExchangeConnectionSupervisor supervisor = supervisor(2);

        supervisor.run(tasks);

        assertThat(supervisor.getStatus().getMalformedMessages()).isEqualTo(2);
        assertThat(supervisor.getStatus().getMessagesReceived()).isEqualTo(1);
        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Reconnect delay doubles from the base and stops at the cap")
    void reconnectDelayDoubles() {
        ExchangeConnectionConfig config = ExchangeConnectionConfig.builder()
                .reconnectDelay(Duration.ofSeconds(5))
                .maxReconnectDelay(Duration.ofSeconds(30))
                .maxRetries(10)
                .symbolsPerConnection(100)
                .build();
        ExchangeConnectionSupervisor supervisor = new ExchangeConnectionSupervisor(
                new BinanceFeed(new ObjectMapper(), "wss://x"), config, connector, List.of("BTCUSDT"), point -> {},
                clock);

        assertThat(supervisor.reconnectDelay(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(supervisor.reconnectDelay(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(supervisor.reconnectDelay(3)).isEqualTo(Duration.ofSeconds(20));
        assertThat(supervisor.reconnectDelay(4)).isEqualTo(Duration.ofSeconds(30));
        assertThat(supervisor.reconnectDelay(40)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Returns STOPPED when cancelled while streaming")
    void stopsOnCancellation() throws InterruptedException {
        connector.thenStreamForever();
        ExchangeConnectionSupervisor supervisor = supervisor(3);
        Thread runner = new Thread(() -> supervisor.run(tasks));
        runner.start();

        long deadline = System.currentTimeMillis() + 5_000;
        while (supervisor.getState() != ExchangeConnectionState.STREAMING && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(supervisor.getState()).isEqualTo(ExchangeConnectionState.STREAMING);

        tasks.shutdown(Duration.ofSeconds(1));
        runner.join(5_000);

        assertThat(supervisor.getState()).isEqualTo(ExchangeConnectionState.STOPPED);
        assertThat(connector.closedChannels).isEqualTo(1);
    }

    @Test
    @DisplayName("Rejects a max reconnect delay below the base delay")
    void rejectsInvalidConfig() {
        assertThatThrownBy(() -> ExchangeConnectionConfig.builder()
                        .reconnectDelay(Duration.ofSeconds(10))
                        .maxReconnectDelay(Duration.ofSeconds(5))
                        .maxRetries(3)
                        .symbolsPerConnection(10)
                        .build())
                .isInstanceOf(ConfigurationException.class);
    }

    /** Plays back a script of connection outcomes; failures once the script runs out. */
    private static final class ScriptedConnector implements WebSocketConnector {

        private final Deque<Step> script = new ArrayDeque<>();
        private volatile int closedChannels;

        void failNext(int times) {
            for (int i = 0; i < times; i++) {
                script.add(new Step(false, List.of(), false));
            }
        }

        void thenStreamAndClose(String... frames) {
            script.add(new Step(true, List.of(frames), false));
        }

        void thenStreamForever() {
            script.add(new Step(true, List.of(), true));
        }

        @Override
        public synchronized WebSocketChannel connect(URI uri, Duration connectTimeout, Consumer<String> onMessage)
                throws Exception {
            Step step = script.poll();
            if (step == null || !step.connects()) {
                throw new ConnectException("connection refused: " + uri.getHost());
            }
            step.frames().forEach(onMessage);
            return new WebSocketChannel() {
                private volatile boolean open = step.staysOpen();

                @Override
                public void send(String text) throws IOException {}

                @Override
                public boolean isOpen() {
                    return open;
                }

                @Override
                public void close() {
                    open = false;
                    closedChannels++;
                }
            };
        }

        private record Step(boolean connects, List<String> frames, boolean staysOpen) {}
    }
}
