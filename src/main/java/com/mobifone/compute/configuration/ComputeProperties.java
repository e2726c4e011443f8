package com.mobifone.compute.configuration;

import com.mobifone.compute.common.Constants;
import lombok.AccessLevel;
import lombok.Data;
import lombok.experimental.FieldDefaults;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@FieldDefaults(level = AccessLevel.PRIVATE)
@ConfigurationProperties(prefix = "compute")
public class ComputeProperties {

    // GCE
    String provider = Constants.GCE.NAME_SERVICE;

    // maxResults per aggregated-list page
    int pageSize = 50;

    Operation operation = new Operation();

    @Data
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class Operation {
        Duration timeout = Duration.ofSeconds(300);
        Duration pollInterval = Duration.ofSeconds(1);
        Duration maxPollInterval = Duration.ofSeconds(10);
    }
}
