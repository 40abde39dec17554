package com.logchef.logchefql;

import com.logchef.logchefql.ast.FieldPath;
import com.logchef.logchefql.ast.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.logchef.logchefql.TestFixtures.parse;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ClickHouseSqlGenerator
 */
class ClickHouseSqlGeneratorTest {

    private ClickHouseSqlGenerator generator;
    private Schema schema;

    @BeforeEach
    void setUp() {
        generator = new ClickHouseSqlGenerator();
        schema = TestFixtures.otelLogsSchema();
    }

    private String sql(String query) {
        return generator.generate(parse(query), schema);
    }

    @Test
    void testSimpleEquality() {
        assertThat(sql("severity_text=\"ERROR\"")).isEqualTo("`severity_text` = 'ERROR'");
    }

    @Test
    void testComparisonOperators() {
        assertThat(sql("severity_number>=500")).isEqualTo("`severity_number` >= 500");
        assertThat(sql("severity_number<1.5")).isEqualTo("`severity_number` < 1.5");
        assertThat(sql("severity_text!=\"DEBUG\"")).isEqualTo("`severity_text` != 'DEBUG'");
    }

    @Test
    void testRegexOperatorsUseCaseInsensitiveSearch() {
        assertThat(sql("body~\"timeout\""))
                .isEqualTo("positionCaseInsensitive(`body`, 'timeout') > 0");
        assertThat(sql("body!~\"healthcheck\""))
                .isEqualTo("positionCaseInsensitive(`body`, 'healthcheck') = 0");
    }

    @Test
    void testLiteralKinds() {
        assertThat(sql("ok=true")).isEqualTo("`ok` = 1");
        assertThat(sql("ok=false")).isEqualTo("`ok` = 0");
        assertThat(sql("trace_id=null")).isEqualTo("`trace_id` = NULL");
        assertThat(sql("severity_text=error")).isEqualTo("`severity_text` = 'error'");
        assertThat(sql("trace_flags=\"1\"")).isEqualTo("`trace_flags` = '1'");
    }

    @Nested
    @DisplayName("Boolean combination")
    class BooleanCombination {

        @Test
        @DisplayName("Should parenthesize every child of a logical node")
        void shouldParenthesizeChildren() {
            // Given: the scenario from the query editor help page
            Schema scenarioSchema = Schema.builder()
                    .column("severity", "LowCardinality(String)")
                    .column("status", "Int32")
                    .build();

            // When
            String sql = generator.generate(parse("severity=\"ERROR\" and status>=500"), scenarioSchema);

            // Then
            assertThat(sql).isEqualTo("(`severity` = 'ERROR') AND (`status` >= 500)");
        }

        @Test
        @DisplayName("Should nest AND inside OR")
        void shouldNestAndInsideOr() {
            assertThat(sql("a=1 or b=2 and c=3"))
                    .isEqualTo("(`a` = 1) OR ((`b` = 2) AND (`c` = 3))");
        }

        @Test
        @DisplayName("Should keep explicit grouping")
        void shouldKeepGrouping() {
            assertThat(sql("(a=\"1\" or b=\"2\") and c=\"3\""))
                    .isEqualTo("((`a` = '1') OR (`b` = '2')) AND (`c` = '3')");
        }

        @Test
        @DisplayName("Should join folded children flat")
        void shouldJoinFoldedChildren() {
            assertThat(sql("a=1 and b=2 and c=3"))
                    .isEqualTo("(`a` = 1) AND (`b` = 2) AND (`c` = 3)");
        }
    }

    @Nested
    @DisplayName("Escaping")
    class Escaping {

        @Test
        @DisplayName("Should neutralise quote injection in values")
        void shouldEscapeQuotes() {
            assertThat(sql("body=\"x' OR 1=1 --\""))
                    .isEqualTo("`body` = 'x'' OR 1=1 --'");
        }

        @Test
        @DisplayName("Should double backticks in identifiers")
        void shouldEscapeIdentifiers() {
            assertThat(sql("we`ird=\"1\"")).isEqualTo("`we``ird` = '1'");
            assertThat(ClickHouseSqlGenerator.escapeIdentifier("a`b")).isEqualTo("`a``b`");
        }

        @ParameterizedTest
        @ValueSource(strings = {"it's", "back\\slash", "line\nbreak", "carriage\rreturn", "nul\0byte",
                "\\'", "''\\\\", "mixed ' \\ \n \r \0 end"})
        @DisplayName("Should produce literals that unescape to the original value")
        void shouldRoundTripEscaping(String original) {
            // When
            String literal = ClickHouseSqlGenerator.formatValue(Value.string(original));

            // Then
            assertThat(literal).startsWith("'").endsWith("'");
            assertThat(unescape(literal.substring(1, literal.length() - 1))).isEqualTo(original);
        }

        /**
         * Reverses ClickHouse string literal escaping
         */
        private String unescape(String body) {
            StringBuilder out = new StringBuilder();
            for (int i = 0; i < body.length(); i++) {
                char c = body.charAt(i);
                if (c == '\\') {
                    char next = body.charAt(++i);
                    switch (next) {
                        case 'n' -> out.append('\n');
                        case 'r' -> out.append('\r');
                        case '0' -> out.append('\0');
                        default -> out.append(next);
                    }
                } else if (c == '\'') {
                    assertThat(body.charAt(++i)).isEqualTo('\'');
                    out.append('\'');
                } else {
                    out.append(c);
                }
            }
            return out.toString();
        }
    }

    @Nested
    @DisplayName("Nested fields")
    class NestedFields {

        @Test
        @DisplayName("Should use subscript access for Map columns")
        void shouldUseMapSubscript() {
            assertThat(sql("log_attributes.level=\"x\""))
                    .isEqualTo("`log_attributes`['level'] = 'x'");
            assertThat(sql("log_attributes.http.status=\"200\""))
                    .isEqualTo("`log_attributes`['http.status'] = '200'");
        }

        @Test
        @DisplayName("Should keep quoted segments intact as a Map key")
        void shouldUseQuotedSegmentAsKey() {
            assertThat(sql("log_attributes.\"user agent\"~\"curl\""))
                    .isEqualTo("positionCaseInsensitive(`log_attributes`['user agent'], 'curl') > 0");
        }

        @Test
        @DisplayName("Should extract JSON for JSON, String and unknown columns")
        void shouldExtractJson() {
            Schema jsonSchema = Schema.builder()
                    .column("payload", "JSON")
                    .column("raw", "String")
                    .build();

            assertThat(generator.generate(parse("payload.user.id=\"7\""), jsonSchema))
                    .isEqualTo("JSONExtractString(`payload`, 'user', 'id') = '7'");
            assertThat(generator.generate(parse("raw.level=\"x\""), jsonSchema))
                    .isEqualTo("JSONExtractString(`raw`, 'level') = 'x'");
            assertThat(generator.generate(parse("other.level=\"x\""), jsonSchema))
                    .isEqualTo("JSONExtractString(`other`, 'level') = 'x'");
        }

        @Test
        @DisplayName("Should fall back to JSON extraction without a schema")
        void shouldExtractJsonWithoutSchema() {
            assertThat(generator.generate(parse("log_attributes.level=\"x\""), null))
                    .contains("JSONExtractString");
        }

        @Test
        @DisplayName("Should escape nested keys")
        void shouldEscapeNestedKeys() {
            assertThat(sql("log_attributes.\"it's\"=\"x\""))
                    .isEqualTo("`log_attributes`['it''s'] = 'x'");
        }
    }

    @Nested
    @DisplayName("Select clause")
    class SelectClause {

        @Test
        @DisplayName("Should place the timestamp first")
        void shouldPlaceTimestampFirst() {
            String select = generator.generateSelectClause(
                    List.of(FieldPath.simple("service"), FieldPath.simple("body")), null, "ts");

            assertThat(select).isEqualTo("`ts`, `service`, `body`");
        }

        @Test
        @DisplayName("Should not repeat an explicitly selected timestamp")
        void shouldNotRepeatTimestamp() {
            String select = generator.generateSelectClause(
                    List.of(FieldPath.simple("body"), FieldPath.simple("timestamp")), schema, "timestamp");

            assertThat(select).isEqualTo("`timestamp`, `body`");
        }

        @Test
        @DisplayName("Should look up unknown fields in the first Map column")
        void shouldUseMapForUnknownFields() {
            String select = generator.generateSelectClause(
                    List.of(FieldPath.simple("service_name"), FieldPath.simple("user_id")), schema, null);

            assertThat(select).isEqualTo("`service_name`, `log_attributes`['user_id'] AS `user_id`");
        }

        @Test
        @DisplayName("Should alias nested fields")
        void shouldAliasNestedFields() {
            String select = generator.generateSelectClause(
                    List.of(new FieldPath("log_attributes", List.of("http", "method"))), schema, null);

            assertThat(select).isEqualTo("`log_attributes`['http.method'] AS `log_attributes_http_method`");
        }

        @Test
        @DisplayName("Should select everything when nothing is projected")
        void shouldSelectStar() {
            assertThat(generator.generateSelectClause(List.of(), schema, null)).isEqualTo("*");
        }
    }

    @Test
    void testEmptyAstGeneratesNothing() {
        assertThat(generator.generate(null, schema)).isEmpty();
    }
}
