package com.mobifone.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ComputeProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComputeProxyApplication.class, args);
    }
}
