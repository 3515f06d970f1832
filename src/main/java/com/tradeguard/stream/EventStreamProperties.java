package com.tradeguard.stream;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Binds to {@code tradeguard.streams.*}. The stream and service catalog itself is fixed in code. */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "tradeguard.streams")
public class EventStreamProperties {

    public enum BrokerType {
        REDIS,
        MEMORY
    }

    @NotNull
    private BrokerType broker = BrokerType.REDIS;

    /** Longest a consumer blocks waiting for new entries. */
    @NotNull
    private Duration pollTimeout = Duration.ofSeconds(1);

    /** Pending entries idle for at least this long are claimed by the reclaim pass. */
    @NotNull
    private Duration reclaimMinIdle = Duration.ofSeconds(60);

    @Min(1)
    private int reclaimBatchSize = 100;

    /** How often a running consumer repeats the reclaim pass. */
    @NotNull
    private Duration reclaimInterval = Duration.ofSeconds(60);

    /** A stream with no entry newer than this is considered quiet and triggers fallback work. */
    @NotNull
    private Duration activityWindow = Duration.ofSeconds(30);

    /** Pause while the resource gate keeps a consumer from reading. */
    @NotNull
    private Duration resourceBackoff = Duration.ofSeconds(1);

    /** Pause after a broker error before the next read. */
    @NotNull
    private Duration errorBackoff = Duration.ofSeconds(1);

    @NotNull
    private Duration criticalStartStagger = Duration.ofMillis(100);

    @NotNull
    private Duration defaultStartStagger = Duration.ofMillis(500);

    @NotNull
    private Duration maxFallbackInterval = Duration.ofHours(2);

    /** How long in-flight batches get to finish on shutdown before they are interrupted. */
    @NotNull
    private Duration shutdownGracePeriod = Duration.ofSeconds(10);
}
