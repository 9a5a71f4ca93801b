package com.z254.swarm.hive.api.dto;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for saving a checkpoint. A missing name yields a timestamped one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointRequest {

    @Pattern(regexp = "[\\w.-]+", message = "Checkpoint name may only contain letters, digits, '_', '.' and '-'")
    private String name;
}
