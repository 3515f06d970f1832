package com.tradeguard.stream.handler;

import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.resource.ResourceSnapshot;
import com.tradeguard.stream.EventStreamCatalog;
import com.tradeguard.stream.EventType;
import com.tradeguard.stream.StreamEntry;
import com.tradeguard.stream.StreamEventHandler;
import com.tradeguard.stream.StreamPublisher;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs system health events and, on its fallback cycle, raises a SYSTEM_HEALTH
 * alert when CPU or memory is above {@value #ALERT_THRESHOLD_PERCENT}%.
 */
public class HealthMonitorHandler implements StreamEventHandler {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitorHandler.class);

    static final double ALERT_THRESHOLD_PERCENT = 85.0;
    static final String ALERT_FIELD = "alert";

    private final ResourceMonitor resourceMonitor;
    private final StreamPublisher publisher;

    public HealthMonitorHandler(ResourceMonitor resourceMonitor, StreamPublisher publisher) {
        this.resourceMonitor = resourceMonitor;
        this.publisher = publisher;
    }

    @Override
    public String serviceName() {
        return EventStreamCatalog.HEALTH_MONITOR;
    }

    @Override
    public void handle(StreamEntry entry) {
        if (entry.field(ALERT_FIELD) != null) {
            log.warn("Health alert {}: {}", entry.field(ALERT_FIELD), entry.fields());
        } else {
            log.debug("Health event {}: {}", entry.id(), entry.fields());
        }
    }

    @Override
    public void runFallback() {
        ResourceSnapshot snapshot = resourceMonitor.getSnapshot();
        if (snapshot.cpuPercent() <= ALERT_THRESHOLD_PERCENT && snapshot.memoryPercent() <= ALERT_THRESHOLD_PERCENT) {
            return;
        }
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put(ALERT_FIELD, "resource_pressure");
        alert.put("cpu_percent", Math.round(snapshot.cpuPercent()));
        alert.put("memory_percent", Math.round(snapshot.memoryPercent()));
        alert.put("disk_percent", Math.round(snapshot.diskPercent()));
        publisher.publish(EventType.SYSTEM_HEALTH, alert);
        log.warn("Resource pressure alert raised: cpu={}% memory={}%",
                Math.round(snapshot.cpuPercent()), Math.round(snapshot.memoryPercent()));
    }
}
