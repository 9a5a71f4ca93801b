package com.z254.swarm.hive.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.domain.model.ControlSignal;
import com.z254.swarm.hive.domain.model.FailureKind;
import com.z254.swarm.hive.domain.model.OutputDirective;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses reasoning output into directives.
 *
 * <p>Output is free text containing {@code <keyword>payload</keyword>} tags. A tag may carry a
 * {@code to="agentId"} attribute, used as the destination hint. Text outside tags is ignored.
 * The payload of a {@code <signal>} tag is a JSON array (or a single object) of control
 * signals, e.g. {@code [{"type":"SEEK","keyword":"weather"}]}.
 */
@Component
public class DirectiveParser {

    private static final Pattern TAG = Pattern.compile(
            "<([\\w.-]+)(?:\\s+to\\s*=\\s*\"([^\"]*)\")?\\s*>(.*?)</\\1\\s*>", Pattern.DOTALL);
    private static final Pattern OPENING_TAG = Pattern.compile(
            "<([\\w.-]+)(?:\\s+to\\s*=\\s*\"[^\"]*\")?\\s*>");

    private final ObjectMapper objectMapper;

    public DirectiveParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ReasoningException with MALFORMED_OUTPUT if a tag is left unclosed
     */
    public List<OutputDirective> parse(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        List<OutputDirective> directives = new ArrayList<>();
        StringBuilder outside = new StringBuilder();
        Matcher matcher = TAG.matcher(output);
        int position = 0;
        while (matcher.find()) {
            outside.append(output, position, matcher.start());
            position = matcher.end();
            String hint = matcher.group(2);
            directives.add(new OutputDirective(matcher.group(1), matcher.group(3).trim(),
                    hint != null && !hint.isBlank() ? hint.trim() : null));
        }
        outside.append(output.substring(position));

        Matcher unclosed = OPENING_TAG.matcher(outside);
        if (unclosed.find()) {
            throw ReasoningException.malformed("Unclosed tag <" + unclosed.group(1) + ">");
        }
        return directives;
    }

    /**
     * @throws ReasoningException with MALFORMED_OUTPUT on invalid JSON, an unknown type
     *                            or a missing field
     */
    public List<ControlSignal> parseSignals(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ReasoningException(FailureKind.MALFORMED_OUTPUT,
                    "Invalid signal JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !(root.isArray() || root.isObject())) {
            throw ReasoningException.malformed("Signal payload must be a JSON array or object");
        }

        List<ControlSignal> signals = new ArrayList<>();
        if (root.isObject()) {
            signals.add(toSignal(root));
        } else {
            for (JsonNode node : root) {
                signals.add(toSignal(node));
            }
        }
        return signals;
    }

    private ControlSignal toSignal(JsonNode node) {
        if (!node.isObject() || !node.hasNonNull("type")) {
            throw ReasoningException.malformed("Signal without type: " + node);
        }
        ControlSignal.Type type;
        try {
            type = ControlSignal.Type.valueOf(node.get("type").asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ReasoningException.malformed("Unknown signal type: " + node.get("type").asText());
        }
        ControlSignal signal = new ControlSignal(type, text(node, "keyword"), text(node, "id"));
        if (!signal.isComplete()) {
            throw ReasoningException.malformed("Incomplete " + type + " signal: " + node);
        }
        return signal;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
