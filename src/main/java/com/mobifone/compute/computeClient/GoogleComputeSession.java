package com.mobifone.compute.computeClient;

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.compute.v1.AggregatedListInstancesRequest;
import com.google.cloud.compute.v1.Instance;
import com.google.cloud.compute.v1.InstancesClient;
import com.google.cloud.compute.v1.InstancesScopedList;
import com.mobifone.compute.exception.AppException;
import com.mobifone.compute.exception.ErrorCode;
import com.mobifone.compute.model.ComputeInstance;
import com.mobifone.compute.operation.LongRunningOperation;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
class GoogleComputeSession implements ComputeSession {

    String projectId;
    InstancesClient client;

    @Override
    public Map<String, List<ComputeInstance>> aggregatedList(int pageSize) {
        AggregatedListInstancesRequest request = AggregatedListInstancesRequest.newBuilder()
                .setProject(projectId)
                .setMaxResults(pageSize)
                .build();

        Map<String, List<ComputeInstance>> byScope = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, InstancesScopedList> entry : client.aggregatedList(request).iterateAll()) {
                byScope.put(entry.getKey(), entry.getValue().getInstancesList().stream()
                        .map(GoogleComputeSession::toComputeInstance)
                        .collect(Collectors.toList()));
            }
        } catch (ApiException e) {
            log.error("GCE aggregatedList failed for project '{}': {}", projectId, e.getMessage());
            throw new AppException(ErrorCode.COMPUTE_API_ERR, "Listing instances failed: " + e.getMessage(), e);
        }
        return byScope;
    }

    @Override
    public LongRunningOperation<?> start(String zone, String instanceName) {
        try {
            log.info("Starting instance '{}' in {}/{}", instanceName, projectId, zone);
            return new GoogleComputeOperation("start " + instanceName,
                    client.startAsync(projectId, zone, instanceName));
        } catch (ApiException e) {
            log.error("GCE start failed for '{}': {}", instanceName, e.getMessage());
            throw new AppException(ErrorCode.COMPUTE_API_ERR, "Starting " + instanceName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public LongRunningOperation<?> stop(String zone, String instanceName) {
        try {
            log.info("Stopping instance '{}' in {}/{}", instanceName, projectId, zone);
            return new GoogleComputeOperation("stop " + instanceName,
                    client.stopAsync(projectId, zone, instanceName));
        } catch (ApiException e) {
            log.error("GCE stop failed for '{}': {}", instanceName, e.getMessage());
            throw new AppException(ErrorCode.COMPUTE_API_ERR, "Stopping " + instanceName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        client.close();
    }

    static ComputeInstance toComputeInstance(Instance instance) {
        return ComputeInstance.builder()
                .name(instance.getName())
                .zone(instance.getZone())
                .status(instance.getStatus())
                .machineType(instance.getMachineType())
                .build();
    }
}
