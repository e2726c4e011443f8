package com.mobifone.compute.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SetStateRequest {
    @NotBlank
    String project_id;

    // zone names, e.g. "us-east1-b"
    @NotNull
    List<String> zones;

    @NotNull
    List<String> instances_names;
}
