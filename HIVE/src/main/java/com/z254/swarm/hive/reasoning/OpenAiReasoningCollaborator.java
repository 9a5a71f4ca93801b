package com.z254.swarm.hive.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.OutputDirective;
import com.z254.swarm.hive.observability.HiveEventLogger;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reasoning collaborator backed by an OpenAI-compatible chat completions endpoint.
 *
 * <p>The system prompt is the agent's instructions followed by its self state and output
 * keywords; the user prompt lists the unused messages, one {@code sender/keyword : payload}
 * line each. The completion text goes through the {@link DirectiveParser}.
 */
@Component
@ConditionalOnProperty(prefix = "swarm.reasoning.openai", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OpenAiReasoningCollaborator implements ReasoningCollaborator {

    private static final String PROVIDER_ID = "openai";
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final WebClient webClient;
    private final DirectiveParser directiveParser;
    private final HiveEventLogger eventLogger;
    private final SwarmProperties.ReasoningProperties.OpenAIProperties config;
    private final Timer callTimer;
    private final Counter callCounter;
    private final Counter errorCounter;

    public OpenAiReasoningCollaborator(
            SwarmProperties swarmProperties,
            WebClient.Builder webClientBuilder,
            DirectiveParser directiveParser,
            HiveEventLogger eventLogger,
            MeterRegistry meterRegistry) {
        this.config = swarmProperties.getReasoning().getOpenai();
        this.directiveParser = directiveParser;
        this.eventLogger = eventLogger;

        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        this.callTimer = Timer.builder("swarm.reasoning.call.latency")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.callCounter = Counter.builder("swarm.reasoning.calls")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.errorCounter = Counter.builder("swarm.reasoning.errors")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    @CircuitBreaker(name = "reasoning")
    public Mono<List<OutputDirective>> invoke(ReasoningRequest request) {
        callCounter.increment();
        long startTime = System.currentTimeMillis();

        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .bodyValue(buildRequestBody(request))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(WebClientException.class,
                        e -> ReasoningException.transport("Completion request failed: " + e.getMessage(), e))
                .onErrorMap(CallNotPermittedException.class,
                        e -> ReasoningException.transport("Reasoning circuit open", e))
                .map(this::extractContent)
                .map(directiveParser::parse)
                .doOnSuccess(directives -> {
                    long duration = System.currentTimeMillis() - startTime;
                    callTimer.record(Duration.ofMillis(duration));
                    eventLogger.logReasoningCall(PROVIDER_ID, config.getModel(), duration, true);
                    log.debug("Reasoning call for {}: {}ms, {} directives", request.getAgentId(), duration,
                            directives != null ? directives.size() : 0);
                })
                .doOnError(e -> {
                    errorCounter.increment();
                    eventLogger.logReasoningCall(PROVIDER_ID, config.getModel(),
                            System.currentTimeMillis() - startTime, false);
                    log.error("Reasoning call for {} failed: {}", request.getAgentId(), e.getMessage());
                });
    }

    Map<String, Object> buildRequestBody(ReasoningRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getParams().getOrDefault("model", config.getModel()));
        body.put("temperature", config.getTemperature());
        body.put("max_tokens", config.getMaxTokens());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt(request)),
                Map.of("role", "user", "content", userPrompt(request))
        ));
        return body;
    }

    static String systemPrompt(ReasoningRequest request) {
        String instructions = request.getInstructions() != null ? request.getInstructions() : "";
        return instructions
                + "\n<self_state>" + request.getSelfState() + "</self_state>"
                + "\n<output_keywords>" + String.join(" ", request.getOutputKeywords()) + "</output_keywords>";
    }

    static String userPrompt(ReasoningRequest request) {
        return request.getMessages().stream()
                .map(message -> message.senderId() + "/" + message.keyword() + " : " + message.payload())
                .collect(Collectors.joining("\n"));
    }

    private String extractContent(JsonNode json) {
        JsonNode choices = json.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw ReasoningException.malformed("Completion without choices");
        }
        JsonNode message = choices.get(0).get("message");
        if (message == null || !message.hasNonNull("content")) {
            throw ReasoningException.malformed("Completion without message content");
        }
        return message.get("content").asText();
    }
}
