package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.agent.AgentService;
import com.z254.swarm.hive.api.dto.AgentRequest;
import com.z254.swarm.hive.api.dto.AgentView;
import com.z254.swarm.hive.domain.model.AgentDescription;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import com.z254.swarm.hive.domain.model.CachedMessage;
import com.z254.swarm.hive.observability.ActivationFrequencyMonitor;
import com.z254.swarm.hive.persistence.AgentPersistenceAdapter;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for agent management.
 */
@RestController
@RequestMapping("/api/v1/agents")
@Tag(name = "Agents", description = "Agent lifecycle, discovery and inspection")
@Slf4j
public class AgentController {

    private final AgentService agentService;
    private final ConnectionRegistry connectionRegistry;
    private final AgentPersistenceAdapter persistenceAdapter;
    private final ActivationFrequencyMonitor frequencyMonitor;

    public AgentController(AgentService agentService,
                           ConnectionRegistry connectionRegistry,
                           AgentPersistenceAdapter persistenceAdapter,
                           ActivationFrequencyMonitor frequencyMonitor) {
        this.agentService = agentService;
        this.connectionRegistry = connectionRegistry;
        this.persistenceAdapter = persistenceAdapter;
        this.frequencyMonitor = frequencyMonitor;
    }

    @PostMapping
    @Operation(summary = "Create agent", description = "Create an agent from a kind and a definition")
    @ApiResponse(responseCode = "201", description = "Agent created")
    @ApiResponse(responseCode = "409", description = "Agent id already in use")
    public Mono<ResponseEntity<AgentView>> createAgent(@Valid @RequestBody AgentRequest request) {
        log.info("Creating agent: {} (kind={})", request.getId(), request.getKind());
        return Mono.defer(() -> agentService.createAgent(request.toDefinition()))
                .map(agent -> ResponseEntity.status(HttpStatus.CREATED).body(view(agent)));
    }

    @GetMapping
    @Operation(summary = "List agents", description = "List all live agents")
    public Flux<AgentView> listAgents() {
        return Flux.fromIterable(agentService.listAgents()).map(this::view);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get agent", description = "Get an agent by id")
    @ApiResponse(responseCode = "200", description = "Agent found")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<AgentView>> getAgent(@Parameter(description = "Agent id") @PathVariable String id) {
        return Mono.justOrEmpty(agentService.getAgent(id))
                .map(agent -> ResponseEntity.ok(view(agent)))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Remove agent", description = "Remove an agent; purge=true also deletes its stored state")
    @ApiResponse(responseCode = "204", description = "Agent removed")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<Void>> removeAgent(
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean purge) {
        log.info("Removing agent: {} (purge={})", id, purge);
        return agentService.removeAgent(id, purge)
                .map(removed -> removed
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping("/{id}/description")
    @Operation(summary = "Discover agent", description = "Output keywords, input keywords and explored keywords")
    public Mono<AgentDescription> discover(@PathVariable String id) {
        return Mono.fromCallable(() -> agentService.discover(id));
    }

    @GetMapping("/{id}/cache")
    @Operation(summary = "Cache contents", description = "Ordered cache entries, used and unused")
    public Mono<List<CachedMessage>> cache(@PathVariable String id) {
        return Mono.fromCallable(() -> agent(id).getCache().entries());
    }

    @PostMapping("/{id}/trigger")
    @Operation(summary = "Trigger agent", description = "Explicitly trigger an activation")
    public Mono<Map<String, Object>> trigger(@PathVariable String id) {
        return Mono.fromCallable(() -> Map.<String, Object>of(
                "agentId", id,
                "triggered", agentService.trigger(id)));
    }

    @PostMapping("/{id}/explore")
    @Operation(summary = "Explore", description = "Make the agent discoverable for a keyword (all keywords if omitted)")
    public Mono<ResponseEntity<Void>> explore(@PathVariable String id,
                                              @RequestParam(required = false) String keyword) {
        return Mono.fromRunnable(() -> agentService.explore(id, keyword))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @DeleteMapping("/{id}/explore")
    @Operation(summary = "Stop exploring", description = "Withdraw one or all explore registrations")
    public Mono<ResponseEntity<Void>> stopExplore(@PathVariable String id,
                                                  @RequestParam(required = false) String keyword) {
        return Mono.fromRunnable(() -> agentService.stopExplore(id, keyword))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @GetMapping("/{id}/seek")
    @Operation(summary = "Seek", description = "Agents exploring a keyword, excluding the seeker")
    public Mono<List<String>> seek(@PathVariable String id, @RequestParam String keyword) {
        return Mono.fromCallable(() -> agentService.seek(id, keyword));
    }

    @GetMapping("/{id}/snapshot")
    @Operation(summary = "Snapshot", description = "Current persistable state of the agent")
    public Mono<AgentSnapshot> snapshot(@PathVariable String id) {
        return Mono.fromCallable(() -> persistenceAdapter.snapshot(id));
    }

    @PostMapping("/{id}/snapshot")
    @Operation(summary = "Sync", description = "Write the agent's snapshot to the state store now")
    public Mono<ResponseEntity<Void>> sync(@PathVariable String id) {
        return Mono.fromCallable(() -> agent(id))
                .flatMap(agent -> persistenceAdapter.sync(id))
                .thenReturn(ResponseEntity.accepted().<Void>build());
    }

    @GetMapping("/{id}/frequency")
    @Operation(summary = "Activation frequency", description = "Instant and moving-average activation frequency")
    public Mono<ResponseEntity<ActivationFrequencyMonitor.FrequencyStats>> frequency(@PathVariable String id) {
        return Mono.justOrEmpty(frequencyMonitor.stats(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    private Agent agent(String id) {
        return agentService.getAgent(id).orElseThrow(() -> new AgentRegistry.AgentNotFoundException(id));
    }

    private AgentView view(Agent agent) {
        return AgentView.from(agent, connectionRegistry.outputsOf(agent.getId()));
    }
}
