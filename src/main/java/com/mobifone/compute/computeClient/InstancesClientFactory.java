package com.mobifone.compute.computeClient;

import com.google.cloud.compute.v1.InstancesClient;

import java.io.IOException;

@FunctionalInterface
public interface InstancesClientFactory {
    InstancesClient create() throws IOException;
}
