package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.api.dto.MessageRequest;
import com.z254.swarm.hive.api.dto.MessageResponse;
import com.z254.swarm.hive.bus.MessageBus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Producer entry point into the bus.
 */
@RestController
@RequestMapping("/api/v1/messages")
@Tag(name = "Messages", description = "Inject producer messages and read bus statistics")
@Slf4j
public class MessageController {

    private final MessageBus messageBus;

    public MessageController(MessageBus messageBus) {
        this.messageBus = messageBus;
    }

    @PostMapping
    @Operation(summary = "Publish message",
            description = "Deliver to 'target' directly, or publish along the source's connections for the keyword")
    public Mono<MessageResponse> publish(@Valid @RequestBody MessageRequest request) {
        return Mono.fromCallable(() -> {
            int delivered = request.getTarget() != null && !request.getTarget().isBlank()
                    ? messageBus.deliver(request.getSource(), request.getTarget(), request.getKeyword(),
                            request.getPayload())
                    : messageBus.publish(request.getSource(), request.getKeyword(), request.getPayload(),
                            request.getDestination());
            log.debug("Producer {} published '{}' to {} caches", request.getSource(), request.getKeyword(), delivered);
            return new MessageResponse(delivered);
        });
    }

    @GetMapping("/stats")
    @Operation(summary = "Bus statistics")
    public Mono<Map<String, Object>> stats() {
        return Mono.fromCallable(messageBus::getStats);
    }
}
