package com.z254.swarm.hive.reasoning;

import com.z254.swarm.hive.domain.model.OutputDirective;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Stand-in used when no completion endpoint is configured.
 * Every call fails with TRANSPORT_ERROR, so reasoning agents go through the retry path
 * and eventually skip their input.
 */
@Component
@ConditionalOnProperty(prefix = "swarm.reasoning.openai", name = "enabled", havingValue = "false")
public class OfflineReasoningCollaborator implements ReasoningCollaborator {

    @Override
    public Mono<List<OutputDirective>> invoke(ReasoningRequest request) {
        return Mono.error(ReasoningException.transport("No reasoning provider configured", null));
    }

    @Override
    public String getProviderId() {
        return "offline";
    }
}
