package com.tradeguard.resilience;

import com.tradeguard.resource.ResourceSnapshot;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BackpressureStats {
    int activeRequests;
    int maxConcurrentRequests;
    Map<CallPriority, Integer> queueDepths;
    long queuedRequests;
    long rejectedRequests;
    long completedRequests;
    long criticalBypasses;
    long pressureRejections;
    long queueWaitP50Ms;
    long queueWaitP95Ms;
    long queueWaitP99Ms;
    boolean underPressure;
    ResourceSnapshot resources;
}
