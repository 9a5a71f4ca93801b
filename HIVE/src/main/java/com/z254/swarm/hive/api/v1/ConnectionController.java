package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.agent.AgentService;
import com.z254.swarm.hive.api.dto.ConnectionRequest;
import com.z254.swarm.hive.domain.model.Connection;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * REST controller for routing links and explore registrations.
 */
@RestController
@RequestMapping("/api/v1/connections")
@Tag(name = "Connections", description = "Keyword-tagged routing links between agents")
@Slf4j
public class ConnectionController {

    private final AgentService agentService;
    private final ConnectionRegistry connectionRegistry;

    public ConnectionController(AgentService agentService, ConnectionRegistry connectionRegistry) {
        this.agentService = agentService;
        this.connectionRegistry = connectionRegistry;
    }

    @PostMapping
    @Operation(summary = "Add connection", description = "Idempotent; both agents must exist")
    @ApiResponse(responseCode = "201", description = "Connection added")
    @ApiResponse(responseCode = "200", description = "Connection already existed")
    public Mono<ResponseEntity<Connection>> addConnection(@Valid @RequestBody ConnectionRequest request) {
        return Mono.fromCallable(() -> agentService.connect(
                        request.getSource(), request.getDestination(), request.getKeyword()))
                .map(added -> ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK)
                        .body(new Connection(request.getSource(), request.getDestination(), request.getKeyword())));
    }

    @DeleteMapping
    @Operation(summary = "Remove connection")
    @ApiResponse(responseCode = "204", description = "Connection removed")
    @ApiResponse(responseCode = "404", description = "Connection not found")
    public Mono<ResponseEntity<Void>> removeConnection(@RequestParam String source,
                                                       @RequestParam String destination,
                                                       @RequestParam String keyword) {
        return Mono.fromCallable(() -> agentService.disconnect(source, destination, keyword))
                .map(removed -> removed
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping
    @Operation(summary = "List connections", description = "Connections leaving an agent")
    public Flux<Connection> listConnections(@RequestParam String source) {
        return Flux.defer(() -> Flux.fromIterable(connectionRegistry.connectionsFrom(source)));
    }

    @GetMapping("/explorations")
    @Operation(summary = "Explore registrations", description = "keyword -> exploring agents")
    public Mono<Map<String, Set<String>>> explorations() {
        return Mono.fromCallable(connectionRegistry::explorations);
    }
}
