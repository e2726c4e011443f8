package com.mobifone.compute.computeClient;

import com.google.cloud.compute.v1.InstancesClient;
import com.mobifone.compute.common.Constants;
import com.mobifone.compute.exception.AppException;
import com.mobifone.compute.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class GoogleComputeApiStrategy implements ComputeApiStrategy {

    InstancesClientFactory clientFactory;

    @Override
    public boolean isApplicable(String provider) {
        return Constants.GCE.NAME_SERVICE.equalsIgnoreCase(provider);
    }

    @Override
    public ComputeSession openSession(String projectId) {
        try {
            InstancesClient client = clientFactory.create();
            log.debug("Opened GCE session for project '{}'", projectId);
            return new GoogleComputeSession(projectId, client);
        } catch (IOException e) {
            log.error("Cannot create GCE instances client for project '{}': {}", projectId, e.getMessage());
            throw new AppException(ErrorCode.COMPUTE_API_ERR, "Cannot create compute client: " + e.getMessage(), e);
        }
    }
}
