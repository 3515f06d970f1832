package com.tradeguard.resilience;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds to {@code tradeguard.circuit-breaker.*}.
 *
 * <p>{@code defaults} applies to breakers created on demand for names not in the
 * catalog. {@code breakers.<name>.*} overrides individual catalog entries; unset
 * fields fall back to the built-in catalog value for that name.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "tradeguard.circuit-breaker")
public class CircuitBreakerProperties {

    /** How often breaker state is exchanged with the shared store. */
    @NotNull
    private Duration syncInterval = Duration.ofSeconds(5);

    /** Expiry of persisted breaker state. */
    @NotNull
    private Duration stateTtl = Duration.ofSeconds(300);

    @Valid
    private BreakerSettings defaults = new BreakerSettings();

    @Valid
    private Map<String, BreakerSettings> breakers = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class BreakerSettings {
        private Integer failureThreshold;
        private Integer successThreshold;
        private Duration timeout;
        private Duration maxTimeout;
        private Duration failureWindow;
        private Duration slowCallThreshold;
        private Duration callTimeout;

        /** Overlays the fields that are set onto {@code base}. */
        public CircuitBreakerConfig applyTo(CircuitBreakerConfig base) {
            CircuitBreakerConfig.CircuitBreakerConfigBuilder builder = base.toBuilder();
            if (failureThreshold != null) builder.failureThreshold(failureThreshold);
            if (successThreshold != null) builder.successThreshold(successThreshold);
            if (timeout != null) builder.timeout(timeout);
            if (maxTimeout != null) builder.maxTimeout(maxTimeout);
            if (failureWindow != null) builder.failureWindow(failureWindow);
            if (slowCallThreshold != null) builder.slowCallThreshold(slowCallThreshold);
            if (callTimeout != null) builder.callTimeout(callTimeout);
            return builder.build();
        }
    }
}
