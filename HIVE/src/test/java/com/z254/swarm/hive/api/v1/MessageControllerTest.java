package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.HiveTestHarness;
import com.z254.swarm.hive.ScriptedReasoningCollaborator;
import com.z254.swarm.hive.api.dto.MessageRequest;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.CachedMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

class MessageControllerTest {

    private HiveTestHarness harness;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        harness = HiveTestHarness.builder(ScriptedReasoningCollaborator.silent()).stopped().build();
        webTestClient = WebTestClient.bindToController(new MessageController(harness.messageBus))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
        harness.agentService.createAgent(AgentDefinition.builder().id("in").kind("producer").build()).block();
        harness.agentService.createAgent(AgentDefinition.builder().id("x").build()).block();
        harness.agentService.createAgent(AgentDefinition.builder().id("y").build()).block();
        harness.agentService.connect("in", "x", "task");
        harness.agentService.connect("in", "y", "task");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    @DisplayName("should publish along the source's connections")
    void publishFansOut() {
        webTestClient.post()
                .uri("/api/v1/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(MessageRequest.builder().source("in").keyword("task").payload("go").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.delivered").isEqualTo(2);

        assertThat(harness.agentRegistry.get("x").getCache().entries())
                .extracting(CachedMessage::payload).containsExactly("go");
    }

    @Test
    @DisplayName("should honour the destination hint")
    void publishWithDestinationHint() {
        webTestClient.post()
                .uri("/api/v1/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(MessageRequest.builder()
                        .source("in").keyword("task").payload("only y").destination("y").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.delivered").isEqualTo(1);

        assertThat(harness.agentRegistry.get("x").getCache().entries()).isEmpty();
    }

    @Test
    @DisplayName("should deliver straight to a target without a connection")
    void deliverToTarget() {
        webTestClient.post()
                .uri("/api/v1/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(MessageRequest.builder()
                        .source("operator").keyword("note").payload("direct").target("x").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.delivered").isEqualTo(1);

        assertThat(harness.agentRegistry.get("x").getCache().entries())
                .extracting(CachedMessage::senderId).containsExactly("operator");
    }

    @Test
    @DisplayName("should report zero deliveries for a keyword with no route")
    void publishMiss() {
        webTestClient.post()
                .uri("/api/v1/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(MessageRequest.builder().source("in").keyword("other").payload("lost").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.delivered").isEqualTo(0);
    }

    @Test
    @DisplayName("should expose bus statistics")
    void stats() {
        harness.messageBus.publish("in", "task", "go");

        webTestClient.get()
                .uri("/api/v1/messages/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.published").isEqualTo(1)
                .jsonPath("$.delivered").isEqualTo(2)
                .jsonPath("$.connections").isEqualTo(2)
                .jsonPath("$.agents").isEqualTo(3);
    }
}
