package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.HiveTestHarness;
import com.z254.swarm.hive.ScriptedReasoningCollaborator;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Set;

import static org.awaitility.Awaitility.await;

class MonitoringControllerTest {

    private HiveTestHarness harness;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        harness = HiveTestHarness.builder(ScriptedReasoningCollaborator.silent()).build();
        webTestClient = WebTestClient.bindToController(
                        new MonitoringController(harness.activationEngine, harness.frequencyMonitor))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void shouldReportFrequenciesOfActivatedAgents() {
        harness.agentService.createAgent(AgentDefinition.builder()
                .id("b")
                .activationKeywords(Set.of("ping"))
                .build()).block();

        harness.messageBus.deliver("a", "b", "ping", "hello");
        await().atMost(Duration.ofSeconds(5)).until(() -> harness.frequencyMonitor.stats("b").isPresent());

        webTestClient.get()
                .uri("/api/v1/monitoring/frequencies")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.b.totalActivations").isEqualTo(1);
    }

    @Test
    void shouldReportEmptyFrequenciesBeforeAnyActivation() {
        webTestClient.get()
                .uri("/api/v1/monitoring/frequencies")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .json("{}");
    }
}
