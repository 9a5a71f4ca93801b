package com.z254.swarm.hive.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Number of caches a message was appended to.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

    private int delivered;
}
