package com.z254.swarm.hive.api.dto;

import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.Capability;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for creating an agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    @NotBlank(message = "Agent id is required")
    @Size(max = 128, message = "Agent id must be at most 128 characters")
    @Pattern(regexp = "[\\w.-]+", message = "Agent id may only contain letters, digits, '_', '.' and '-'")
    private String id;

    private String kind;

    @Size(max = 20000, message = "Instructions must be less than 20000 characters")
    private String instructions;

    private Set<String> activationKeywords;

    private Set<Capability> capabilities;

    private Map<String, String> params;

    /**
     * Convert to domain model.
     */
    public AgentDefinition toDefinition() {
        return AgentDefinition.builder()
                .id(id)
                .kind(kind != null && !kind.isBlank() ? kind : "reasoning")
                .instructions(instructions)
                .activationKeywords(activationKeywords != null ? new LinkedHashSet<>(activationKeywords) : new LinkedHashSet<>())
                .capabilities(capabilities != null && !capabilities.isEmpty()
                        ? EnumSet.copyOf(capabilities) : EnumSet.noneOf(Capability.class))
                .params(params != null ? new HashMap<>(params) : new HashMap<>())
                .build();
    }
}
