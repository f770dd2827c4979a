package com.eainde.workout.repair;

import com.eainde.workout.error.MalformedResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseRepairTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Nested
    @DisplayName("parseTrustedJson")
    class ParseTrustedJson {

        @Test
        void parseTrustedJson_shouldReturnSameKeys_whenResponseHasExcessClosingBraces() {
            // Arrange
            String raw = "{\"discipline\":\"crossfit\",\"performance_metrics\":{\"intensity\":7}}}}";

            // Act
            JsonNode parsed = ResponseRepair.parseTrustedJson(raw);

            // Assert
            assertThat(fieldNames(parsed)).containsExactly("discipline", "performance_metrics");
            assertThat(parsed.path("performance_metrics").path("intensity").asInt()).isEqualTo(7);
        }

        @Test
        void parseTrustedJson_shouldExtractBody_whenWrappedInProseAndFences() {
            // Arrange
            String raw = "Here is the workout:\n```json\n{\"workout_name\":\"Fran\",\"duration\":7}\n```\nLet me know!";

            // Act
            JsonNode parsed = ResponseRepair.parseTrustedJson(raw);

            // Assert
            assertThat(parsed.path("workout_name").asText()).isEqualTo("Fran");
            assertThat(parsed.path("duration").asInt()).isEqualTo(7);
        }

        @Test
        void parseTrustedJson_shouldCloseStructures_whenOutputIsTruncated() {
            // Arrange
            String raw = "{\"workout_name\":\"Fran\",\"rounds\":[21,15";

            // Act
            JsonNode parsed = ResponseRepair.parseTrustedJson(raw);

            // Assert
            assertThat(parsed.path("workout_name").asText()).isEqualTo("Fran");
            assertThat(parsed.path("rounds")).hasSize(2);
        }

        @Test
        void parseTrustedJson_shouldUnwrap_whenWholeResponseIsQuotedJson() {
            // Arrange
            String raw = "\"{\\\"discipline\\\":\\\"running\\\"}\"";

            // Act
            JsonNode parsed = ResponseRepair.parseTrustedJson(raw);

            // Assert
            assertThat(parsed.isObject()).isTrue();
            assertThat(parsed.path("discipline").asText()).isEqualTo("running");
        }

        @Test
        void parseTrustedJson_shouldParseNestedStringProperties_whenDoubleEncoded() {
            // Arrange
            String raw = "{\"performance_metrics\":\"{\\\"intensity\\\":8,\\\"heart_rate\\\":{\\\"avg\\\":150}}\"}";

            // Act
            JsonNode parsed = ResponseRepair.parseTrustedJson(raw);

            // Assert
            JsonNode metrics = parsed.path("performance_metrics");
            assertThat(metrics.isObject()).isTrue();
            assertThat(metrics.path("heart_rate").path("avg").asInt()).isEqualTo(150);
        }

        @Test
        void parseTrustedJson_shouldThrow_whenNoJsonCanBeRecovered() {
            assertThatThrownBy(() -> ResponseRepair.parseTrustedJson("I could not find a workout in that message"))
                    .isInstanceOf(MalformedResponseException.class);
        }

        @Test
        void parseTrustedJson_shouldThrow_whenResponseIsBlank() {
            assertThatThrownBy(() -> ResponseRepair.parseTrustedJson("   "))
                    .isInstanceOf(MalformedResponseException.class)
                    .hasMessageContaining("empty");
        }
    }

    @Nested
    @DisplayName("individual stages")
    class Stages {

        @Test
        void stripNonJson_shouldReturnInputUnchanged_whenThereIsNoBracket() {
            assertThat(ResponseRepair.stripNonJson("  plain text  ")).isEqualTo("plain text");
        }

        @Test
        void stripNonJson_shouldKeepFromOpener_whenNoCloserFollows() {
            assertThat(ResponseRepair.stripNonJson("Sure! {\"a\":1")).isEqualTo("{\"a\":1");
        }

        @Test
        void cleanResponse_shouldRemoveFenceMarkers() {
            assertThat(ResponseRepair.cleanResponse("```json\n[1,2]\n```")).isEqualTo("[1,2]");
        }

        @Test
        void fixMalformedJson_shouldRemoveTrailingCommas() {
            assertThat(ResponseRepair.fixMalformedJson("{\"a\":[1,2,],}")).isEqualTo("{\"a\":[1,2]}");
        }

        @Test
        void fixMalformedJson_shouldCloseNestedStructures_whenTruncatedMidArray() throws Exception {
            // Act
            String fixed = ResponseRepair.fixMalformedJson(
                    "{\"exercises\":[{\"name\":\"squat\",\"sets\":5},{\"name\":\"bench");

            // Assert
            JsonNode exercises = objectMapper.readTree(fixed).path("exercises");
            assertThat(exercises).hasSize(2);
            assertThat(exercises.get(1).path("name").asText()).isEqualTo("bench");
        }

        @Test
        void fixMalformedJson_shouldNotMoveFields_whenOnlyTheTailHasExcessClosers() throws Exception {
            // Act
            String fixed = ResponseRepair.fixMalformedJson("{\"a\":{\"b\":{\"c\":1}},\"d\":2}}");

            // Assert
            JsonNode parsed = objectMapper.readTree(fixed);
            assertThat(parsed.path("d").asInt()).isEqualTo(2);
            assertThat(parsed.path("a").has("d")).isFalse();
        }

        @Test
        void fixMalformedJson_shouldCloseOpenString_whenTruncatedInsideValue() throws Exception {
            // Act
            String fixed = ResponseRepair.fixMalformedJson("{\"notes\":\"felt stro");

            // Assert
            assertThat(objectMapper.readTree(fixed).path("notes").asText()).isEqualTo("felt stro");
        }

        @Test
        void fixMalformedJson_shouldLeaveBracesInsideStringsAlone() throws Exception {
            // Arrange
            String json = "{\"notes\":\"used a }} grip\",\"a\":{\"b\":1}}}";

            // Act
            String fixed = ResponseRepair.fixMalformedJson(json);

            // Assert
            JsonNode parsed = objectMapper.readTree(fixed);
            assertThat(parsed.path("notes").asText()).isEqualTo("used a }} grip");
            assertThat(parsed.path("a").path("b").asInt()).isEqualTo(1);
        }

        @Test
        void fixDoubleEncodedJson_shouldReturnTrimmedInput_whenNotQuoted() {
            assertThat(ResponseRepair.fixDoubleEncodedJson(" {\"a\":1} ")).isEqualTo("{\"a\":1}");
        }
    }

    @Nested
    @DisplayName("fixDoubleEncodedProperties")
    class DoubleEncodedProperties {

        @Test
        void fixDoubleEncodedProperties_shouldBeIdempotent() throws Exception {
            // Arrange
            JsonNode input = objectMapper.readTree(
                    "{\"a\":\"{\\\"b\\\":\\\"[1,2]\\\"}\",\"list\":[\"{\\\"c\\\":3}\",\"plain\"],\"n\":4}");

            // Act
            JsonNode once = ResponseRepair.fixDoubleEncodedProperties(input);
            JsonNode twice = ResponseRepair.fixDoubleEncodedProperties(once);

            // Assert
            assertThat(twice).isEqualTo(once);
            assertThat(once.path("a").path("b").isArray()).isTrue();
            assertThat(once.path("list").get(0).path("c").asInt()).isEqualTo(3);
            assertThat(once.path("list").get(1).asText()).isEqualTo("plain");
        }

        @Test
        void fixDoubleEncodedProperties_shouldKeepString_whenItLooksLikeJsonButDoesNotParse() throws Exception {
            // Arrange
            JsonNode input = objectMapper.readTree("{\"notes\":\"{not really json\"}");

            // Act
            JsonNode fixed = ResponseRepair.fixDoubleEncodedProperties(input);

            // Assert
            assertThat(fixed.path("notes").asText()).isEqualTo("{not really json");
        }

        @Test
        void fixDoubleEncodedProperties_shouldNotModifyArgument() throws Exception {
            // Arrange
            JsonNode input = objectMapper.readTree("{\"m\":\"{\\\"x\\\":1}\"}");

            // Act
            ResponseRepair.fixDoubleEncodedProperties(input);

            // Assert
            assertThat(input.path("m").isTextual()).isTrue();
        }
    }
}
