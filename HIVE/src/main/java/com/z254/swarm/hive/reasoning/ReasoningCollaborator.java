package com.z254.swarm.hive.reasoning;

import com.z254.swarm.hive.domain.model.OutputDirective;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The opaque reasoning step an agent runs on activation.
 * Implementations signal failures as {@link ReasoningException}.
 */
public interface ReasoningCollaborator {

    /**
     * Run one reasoning call.
     *
     * @param request instructions, self state, output keywords and unused messages
     * @return the directives parsed from the output, in output order
     */
    Mono<List<OutputDirective>> invoke(ReasoningRequest request);

    /**
     * Provider id used in logs and metrics (e.g. "openai").
     */
    String getProviderId();
}
