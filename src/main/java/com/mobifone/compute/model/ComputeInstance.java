package com.mobifone.compute.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of a provider instance.
 */
@Value
@Builder
public class ComputeInstance {
    String name;
    // provider zone reference, usually a URL ending in /zones/{zone}
    String zone;
    String status;
    String machineType;

    /** Last path segment of {@link #zone}. */
    public String getZoneName() {
        if (zone == null) return null;
        int idx = zone.lastIndexOf('/');
        return idx < 0 ? zone : zone.substring(idx + 1);
    }

    public InstanceStatus getInstanceStatus() {
        return InstanceStatus.fromValue(status);
    }
}
