package com.mobifone.compute.configuration;

import com.google.cloud.compute.v1.InstancesClient;
import com.mobifone.compute.computeClient.InstancesClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GoogleComputeConfig {

    // Credentials resolved from Application Default Credentials
    @Bean
    public InstancesClientFactory instancesClientFactory() {
        return InstancesClient::create;
    }
}
