package com.tradeguard.resource;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Binds to the {@code tradeguard.resource-monitor.*} prefix in application.properties. */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "tradeguard.resource-monitor")
public class ResourceMonitorProperties {

    /** Time between host samples. */
    @NotNull
    private Duration sampleInterval = Duration.ofSeconds(5);
}
