package com.mobifone.compute.service;

import com.mobifone.compute.common.Constants;
import com.mobifone.compute.computeClient.ComputeApiStrategy;
import com.mobifone.compute.computeClient.ComputeApiStrategyFactory;
import com.mobifone.compute.computeClient.ComputeSession;
import com.mobifone.compute.configuration.ComputeProperties;
import com.mobifone.compute.dto.request.SetStateRequest;
import com.mobifone.compute.dto.response.InstanceListResponse;
import com.mobifone.compute.dto.response.InstanceSummary;
import com.mobifone.compute.dto.response.SetStateResponse;
import com.mobifone.compute.exception.AppException;
import com.mobifone.compute.exception.ErrorCode;
import com.mobifone.compute.model.ComputeInstance;
import com.mobifone.compute.model.InstanceStatus;
import com.mobifone.compute.model.InstanceTransition;
import com.mobifone.compute.operation.LongRunningOperation;
import com.mobifone.compute.operation.OperationWaiter;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ComputeInstanceService {

    ComputeApiStrategyFactory strategyFactory;
    OperationWaiter operationWaiter;
    ComputeProperties properties;

    private ComputeApiStrategy strategy() {
        return strategyFactory.getStrategy(properties.getProvider());
    }

    // =====================================================================
    // List instances grouped by zone
    // =====================================================================
    public InstanceListResponse listInstances(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new AppException(ErrorCode.INVALID_KEY, "project_id must not be blank");
        }
        Map<String, List<InstanceSummary>> byZone = new TreeMap<>();

        try (ComputeSession session = strategy().openSession(projectId)) {
            session.aggregatedList(properties.getPageSize()).forEach((zone, instances) -> {
                if (instances.isEmpty()) return;
                byZone.put(zone, instances.stream()
                        .map(this::toSummary)
                        .collect(Collectors.toList()));
            });
        }

        log.info("Listed {} instance(s) in {} zone(s) for project '{}'",
                byZone.values().stream().mapToInt(List::size).sum(), byZone.size(), projectId);
        return InstanceListResponse.builder()
                .vmInstances(byZone)
                .build();
    }

    // =====================================================================
    // Toggle instances: TERMINATED -> start, RUNNING -> stop
    // =====================================================================
    public SetStateResponse setInstanceState(SetStateRequest request) {
        String projectId = request.getProject_id();
        Set<String> zones = new HashSet<>(request.getZones());
        Set<String> names = new HashSet<>(request.getInstances_names());

        List<InstanceTransition> transitions = new ArrayList<>();

        try (ComputeSession session = strategy().openSession(projectId)) {
            for (List<ComputeInstance> instances : session.aggregatedList(properties.getPageSize()).values()) {
                for (ComputeInstance instance : instances) {
                    if (!names.contains(instance.getName()) || !zones.contains(instance.getZoneName())) {
                        continue;
                    }
                    InstanceTransition transition = toggle(session, instance);
                    if (transition != null) {
                        transitions.add(transition);
                    }
                }
            }
        }

        log.info("Set state for project '{}' done: {}", projectId, transitions);
        return SetStateResponse.builder()
                .results(Constants.SET_STATE_RESULT)
                .build();
    }

    private InstanceTransition toggle(ComputeSession session, ComputeInstance instance) {
        InstanceStatus status = instance.getInstanceStatus();
        String zone = instance.getZoneName();

        LongRunningOperation<?> operation;
        InstanceTransition.Action action;
        String label;
        switch (status) {
            case TERMINATED -> {
                operation = session.start(zone, instance.getName());
                action = InstanceTransition.Action.START;
                label = Constants.LABEL.INSTANCE_STARTING;
            }
            case RUNNING -> {
                operation = session.stop(zone, instance.getName());
                action = InstanceTransition.Action.STOP;
                label = Constants.LABEL.INSTANCE_STOPPING;
            }
            default -> {
                log.info("Skipping instance '{}' in {}: status {} cannot be toggled",
                        instance.getName(), zone, instance.getStatus());
                return null;
            }
        }

        operationWaiter.await(operation, label);

        return InstanceTransition.builder()
                .instanceName(instance.getName())
                .zone(zone)
                .previousStatus(status)
                .action(action)
                .build();
    }

    private InstanceSummary toSummary(ComputeInstance instance) {
        return InstanceSummary.builder()
                .instance_name(instance.getName())
                .status(instance.getStatus())
                .machine_type(instance.getMachineType())
                .build();
    }
}
