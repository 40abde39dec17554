package com.logchef.logchefql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogchefQLService Tests")
class LogchefQLServiceTest {

    private LogchefQLService service;
    private MeterRegistry meterRegistry;
    private Schema schema;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = TestFixtures.service(meterRegistry);
        schema = TestFixtures.otelLogsSchema();
    }

    @Nested
    @DisplayName("translate")
    class Translate {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n\t"})
        @DisplayName("Should treat empty input as a valid query without conditions")
        void shouldAcceptEmptyInput(String query) {
            TranslateResult withSchema = service.translate(query, schema);
            TranslateResult withoutSchema = service.translate(query, null);

            assertThat(withSchema.isValid()).isTrue();
            assertThat(withSchema.getSql()).isEmpty();
            assertThat(withoutSchema.isValid()).isTrue();
            assertThat(withoutSchema.getSql()).isEmpty();
            assertThat(withSchema.getConditions()).isEmpty();
            assertThat(withSchema.getFieldsUsed()).isEmpty();
        }

        @Test
        @DisplayName("Should translate with metadata")
        void shouldTranslateWithMetadata() {
            // When
            TranslateResult result = service.translate(
                    "severity_text=\"ERROR\" and log_attributes.level=\"x\"", schema);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getError()).isEmpty();
            assertThat(result.getSql())
                    .isEqualTo("(`severity_text` = 'ERROR') AND (`log_attributes`['level'] = 'x')");
            assertThat(result.getFieldsUsed()).containsExactly("severity_text", "log_attributes");
            assertThat(result.getConditions()).hasSize(2);
            assertThat(result.getSelectClause()).isEmpty();
        }

        @Test
        @DisplayName("Should nest AND inside OR")
        void shouldRespectPrecedence() {
            assertThat(service.translate("a=1 or b=2 and c=3", null).getSql())
                    .isEqualTo("(`a` = 1) OR ((`b` = 2) AND (`c` = 3))");
        }

        @Test
        @DisplayName("Should choose Map access with a schema and JSON extraction without one")
        void shouldChooseNestedAccessBySchema() {
            Schema mapSchema = Schema.builder().column("log_attributes", "Map(String,String)").build();

            assertThat(service.translate("log_attributes.level=\"x\"", mapSchema).getSql()).contains("['level']");
            assertThat(service.translate("log_attributes.level=\"x\"", null).getSql()).contains("JSONExtractString");
        }

        @Test
        @DisplayName("Should build a select clause for pipe projections")
        void shouldBuildSelectClause() {
            TranslateResult result = service.translate("namespace=\"prod\" | service body", null, "ts");

            assertThat(result.getSql()).isEqualTo("`namespace` = 'prod'");
            assertThat(result.getSelectClause()).contains("`ts`, `service`, `body`");
        }

        @Test
        @DisplayName("Should report lexer errors before parser errors")
        void shouldReportLexerErrorsFirst() {
            TranslateResult result = service.translate("a=\"1\" b=\"unterminated", schema);

            assertThat(result.isValid()).isFalse();
            assertThat(result.getSql()).isEmpty();
            assertThat(result.getError()).get()
                    .extracting(ParseError::getCode).isEqualTo(ErrorCode.UNTERMINATED_STRING);
        }

        @Test
        @DisplayName("Should count translations and failures")
        void shouldRecordMetrics() {
            service.translate("a=\"1\"", schema);
            service.translate("a=", schema);

            assertThat(meterRegistry.get(TranslationMetrics.TRANSLATIONS).counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get(TranslationMetrics.TRANSLATIONS_FAILED)
                    .tag("code", "UNEXPECTED_END").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get(TranslationMetrics.TRANSLATION_LATENCY).timer().count()).isEqualTo(2L);
        }
    }

    @Nested
    @DisplayName("translateToLogsQL")
    class TranslateToLogsQL {

        @Test
        @DisplayName("Should translate with metadata and projection")
        void shouldTranslate() {
            LogsQLTranslateResult result = service.translateToLogsQL(
                    "(level=\"error\" or level=\"warn\") and service=\"api\" | timestamp service body", null);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getLogsql()).isEqualTo("(level:=error or level:=warn) service:=api");
            assertThat(result.getSelectClause()).contains("timestamp, service, body");
            assertThat(result.getFieldsUsed()).containsExactly("level", "service");
        }

        @Test
        @DisplayName("Should report errors as data")
        void shouldReportErrors() {
            LogsQLTranslateResult result = service.translateToLogsQL("level = ", null);

            assertThat(result.isValid()).isFalse();
            assertThat(result.getLogsql()).isEmpty();
            assertThat(result.getError()).isPresent();
        }

        @Test
        @DisplayName("Should treat empty input as valid")
        void shouldAcceptEmptyInput() {
            LogsQLTranslateResult result = service.translateToLogsQL(" ", null);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getLogsql()).isEmpty();
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @ParameterizedTest
        @ValueSource(strings = {
                "body ~ \"order\"",
                "field = \"android\"",
                "order=\"1\" and sandbox=\"2\"",
                "",
                "(a=\"1\" or b=\"2\") and c!=\"3\" | body"
        })
        @DisplayName("Should accept valid queries")
        void shouldAcceptValidQueries(String query) {
            ValidateResult result = service.validate(query);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getError()).isEmpty();
        }

        @Test
        @DisplayName("Should return an error instead of throwing on deeply nested groups")
        void shouldRejectDeeplyNestedGroups() {
            String query = "(".repeat(5000) + "a=\"1\"" + ")".repeat(5000);

            ValidateResult validated = service.validate(query);
            TranslateResult translated = service.translate(query, schema);
            LogsQLTranslateResult logsql = service.translateToLogsQL(query, null);

            assertThat(validated.isValid()).isFalse();
            assertThat(validated.getError().orElseThrow().getCode()).isEqualTo(ErrorCode.UNEXPECTED_TOKEN);
            assertThat(translated.isValid()).isFalse();
            assertThat(translated.getError()).isPresent();
            assertThat(logsql.isValid()).isFalse();
        }

        @Test
        @DisplayName("Should name both fields when a boolean operator is missing")
        void shouldReportMissingOperator() {
            ValidateResult result = service.validate("a=\"1\" b=\"2\"");

            assertThat(result.isValid()).isFalse();
            ParseError error = result.getError().orElseThrow();
            assertThat(error.getCode()).isEqualTo(ErrorCode.MISSING_BOOLEAN_OPERATOR);
            assertThat(error.getMessage()).contains("'a'").contains("'b'");
        }
    }

    @Test
    @DisplayName("Should return conditions only for valid queries")
    void shouldReturnConditions() {
        assertThat(service.getConditions("level=\"error\" and body~\"x\""))
                .containsExactly(new FilterCondition("level", "=", "error", false),
                        new FilterCondition("body", "~", "x", true));
        assertThat(service.getConditions("level=")).isEmpty();
        assertThat(service.getConditions("")).isEmpty();
    }

    @Test
    @DisplayName("Should serialize results with snake_case field names")
    void shouldSerializeResults() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        JsonNode valid = mapper.valueToTree(service.translate("level=\"error\" | body", schema, "timestamp"));
        assertThat(valid.get("valid").asBoolean()).isTrue();
        assertThat(valid.get("select_clause").asText()).isEqualTo("`timestamp`, `body`");
        assertThat(valid.get("fields_used").get(0).asText()).isEqualTo("level");
        assertThat(valid.get("conditions").get(0).get("is_regex").asBoolean()).isFalse();
        assertThat(valid.has("error")).isFalse();

        JsonNode invalid = mapper.valueToTree(service.translate("level=", schema));
        assertThat(invalid.get("valid").asBoolean()).isFalse();
        assertThat(invalid.get("error").get("code").asText()).isEqualTo("UNEXPECTED_END");
        assertThat(invalid.get("error").get("position").get("line").asInt()).isEqualTo(1);
        assertThat(invalid.has("select_clause")).isFalse();
    }
}
