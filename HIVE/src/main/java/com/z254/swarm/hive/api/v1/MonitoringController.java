package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.agent.ActivationEngine;
import com.z254.swarm.hive.domain.model.FailureEvent;
import com.z254.swarm.hive.observability.ActivationFrequencyMonitor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Live failure stream and activation frequencies.
 */
@RestController
@RequestMapping("/api/v1/monitoring")
@Tag(name = "Monitoring", description = "Failure events and activation frequencies")
public class MonitoringController {

    private final ActivationEngine activationEngine;
    private final ActivationFrequencyMonitor frequencyMonitor;

    public MonitoringController(ActivationEngine activationEngine, ActivationFrequencyMonitor frequencyMonitor) {
        this.activationEngine = activationEngine;
        this.frequencyMonitor = frequencyMonitor;
    }

    @GetMapping(value = "/failures", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Failure stream", description = "Server-sent events of failures from now on")
    public Flux<FailureEvent> failures() {
        return activationEngine.failures();
    }

    @GetMapping("/frequencies")
    @Operation(summary = "Activation frequencies", description = "Frequency stats of every agent that activated")
    public Mono<Map<String, ActivationFrequencyMonitor.FrequencyStats>> frequencies() {
        return Mono.fromCallable(frequencyMonitor::allStats);
    }
}
