package com.mobifone.compute.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mobifone.compute.common.Constants;
import com.mobifone.compute.common.LogApi;
import com.mobifone.compute.dto.request.SetStateRequest;
import com.mobifone.compute.dto.response.SetStateResponse;
import com.mobifone.compute.service.ComputeInstanceService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ComputeEngineController {

    ComputeInstanceService computeInstanceService;
    // sorted keys, indented
    ObjectWriter listingWriter;

    public ComputeEngineController(ComputeInstanceService computeInstanceService, ObjectMapper objectMapper) {
        this.computeInstanceService = computeInstanceService;
        this.listingWriter = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .writerWithDefaultPrettyPrinter();
    }

    @GetMapping(Constants.ENDPOINT.PING)
    public Map<String, String> ping() {
        return Map.of("key", "value");
    }

    @LogApi
    @GetMapping(value = Constants.ENDPOINT.GET_COMPUTE_ENGINE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> listInstances(
            @RequestParam(name = "project_id") String projectId) throws JsonProcessingException {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(listingWriter.writeValueAsString(computeInstanceService.listInstances(projectId)));
    }

    @LogApi
    @PostMapping(Constants.ENDPOINT.SET_STATE)
    public SetStateResponse setState(@RequestBody @Valid SetStateRequest request) {
        return computeInstanceService.setInstanceState(request);
    }
}
