package com.z254.swarm.hive.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for injecting a message as a producer.
 *
 * <p>With {@code target} set the payload goes straight into that agent's cache; otherwise it is
 * published along the connections of ({@code source}, {@code keyword}), restricted to
 * {@code destination} when given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRequest {

    @NotBlank(message = "Source is required")
    private String source;

    @NotBlank(message = "Keyword is required")
    private String keyword;

    @NotNull(message = "Payload is required")
    private String payload;

    private String target;

    private String destination;
}
