package com.mobifone.compute.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InstanceTransition {

    public enum Action { START, STOP }

    String instanceName;
    String zone;
    InstanceStatus previousStatus;
    Action action;
}
