package com.mobifone.compute.computeClient;

public interface ComputeApiStrategy {
    boolean isApplicable(String provider);

    // one session per request, caller closes it
    ComputeSession openSession(String projectId);
}
