package com.mobifone.compute.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class InstanceListResponse {
    // zone scope key ("zones/us-east1-b") -> instances, sorted by key
    @JsonProperty("VM instances")
    @Builder.Default
    Map<String, List<InstanceSummary>> vmInstances = new TreeMap<>();
}
