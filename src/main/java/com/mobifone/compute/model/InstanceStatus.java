package com.mobifone.compute.model;

import java.util.Arrays;

/**
 * Instance lifecycle states reported by the provider. Only {@link #RUNNING} and
 * {@link #TERMINATED} can be toggled; the others are observed as is.
 */
public enum InstanceStatus {
    PROVISIONING,
    STAGING,
    RUNNING,
    STOPPING,
    SUSPENDING,
    SUSPENDED,
    REPAIRING,
    TERMINATED,
    UNKNOWN;

    public static InstanceStatus fromValue(String value) {
        if (value == null) return UNKNOWN;
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
