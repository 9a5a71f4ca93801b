package com.z254.swarm.hive.reasoning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.domain.model.ControlSignal;
import com.z254.swarm.hive.domain.model.FailureKind;
import com.z254.swarm.hive.domain.model.OutputDirective;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DirectiveParser}.
 */
class DirectiveParserTest {

    private final DirectiveParser parser = new DirectiveParser(new ObjectMapper());

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void shouldExtractKeywordTags() {
            List<OutputDirective> directives = parser.parse(
                    "Thinking out loud.\n<pong>hi back</pong>\n<news>  extra  </news>");

            assertThat(directives).containsExactly(
                    OutputDirective.of("pong", "hi back"),
                    OutputDirective.of("news", "extra"));
        }

        @Test
        void shouldReadDestinationHint() {
            List<OutputDirective> directives = parser.parse("<ping to=\"c\">only you</ping>");

            assertThat(directives).singleElement().satisfies(directive -> {
                assertThat(directive.keyword()).isEqualTo("ping");
                assertThat(directive.destinationHint()).isEqualTo("c");
                assertThat(directive.hasDestinationHint()).isTrue();
            });
        }

        @Test
        void shouldKeepMultilinePayloads() {
            List<OutputDirective> directives = parser.parse("<self_state>line one\nline two</self_state>");

            assertThat(directives).singleElement().satisfies(directive -> {
                assertThat(directive.isSelfState()).isTrue();
                assertThat(directive.payload()).isEqualTo("line one\nline two");
            });
        }

        @Test
        void shouldReturnNothingForPlainText() {
            assertThat(parser.parse("no directives here")).isEmpty();
            assertThat(parser.parse("")).isEmpty();
            assertThat(parser.parse(null)).isEmpty();
        }

        @Test
        void shouldRejectUnclosedTag() {
            assertThatThrownBy(() -> parser.parse("<pong>hi back</pong> <news>dangling"))
                    .isInstanceOf(ReasoningException.class)
                    .hasMessageContaining("news")
                    .extracting(e -> ((ReasoningException) e).getKind())
                    .isEqualTo(FailureKind.MALFORMED_OUTPUT);
        }

        @Test
        void shouldRejectMismatchedTags() {
            assertThatThrownBy(() -> parser.parse("<pong>hi</ping>"))
                    .isInstanceOf(ReasoningException.class);
        }
    }

    @Nested
    @DisplayName("parseSignals")
    class ParseSignals {

        @Test
        void shouldParseArrayOfSignals() {
            List<ControlSignal> signals = parser.parseSignals("""
                    [
                      {"type": "explore", "keyword": "weather"},
                      {"type": "connect", "keyword": "ping", "id": "b"},
                      {"type": "STOP_EXPLORE"}
                    ]
                    """);

            assertThat(signals).containsExactly(
                    new ControlSignal(ControlSignal.Type.EXPLORE, "weather", null),
                    new ControlSignal(ControlSignal.Type.CONNECT, "ping", "b"),
                    new ControlSignal(ControlSignal.Type.STOP_EXPLORE, null, null));
        }

        @Test
        void shouldParseSingleObject() {
            assertThat(parser.parseSignals("{\"type\":\"seek\",\"keyword\":\"weather\"}"))
                    .containsExactly(new ControlSignal(ControlSignal.Type.SEEK, "weather", null));
        }

        @Test
        void shouldRejectInvalidJson() {
            assertThatThrownBy(() -> parser.parseSignals("connect to b"))
                    .isInstanceOf(ReasoningException.class)
                    .hasMessageContaining("Invalid signal JSON");
        }

        @Test
        void shouldRejectUnknownType() {
            assertThatThrownBy(() -> parser.parseSignals("{\"type\":\"teleport\"}"))
                    .isInstanceOf(ReasoningException.class)
                    .hasMessageContaining("teleport");
        }

        @Test
        void shouldRejectIncompleteSignal() {
            assertThatThrownBy(() -> parser.parseSignals("{\"type\":\"connect\",\"keyword\":\"ping\"}"))
                    .isInstanceOf(ReasoningException.class)
                    .hasMessageContaining("Incomplete");
        }
    }
}
