package com.tradeguard.resource;

/** Reads current host utilization. Implementations must not block for a sampling window. */
public interface ResourceSampler {

    ResourceSnapshot sample();
}
