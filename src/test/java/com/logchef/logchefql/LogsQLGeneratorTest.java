package com.logchef.logchefql;

import com.logchef.logchefql.ast.FieldPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.logchef.logchefql.TestFixtures.parse;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogsQLGenerator Tests")
class LogsQLGeneratorTest {

    private LogsQLGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new LogsQLGenerator();
    }

    private String logsql(String query) {
        return generator.generate(parse(query));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
            "level=\"error\"      | level:=error",
            "level!=\"debug\"     | level:!=debug",
            "body~\"err.*\"       | body:~\"err.*\"",
            "body!~\"health\"     | body:!~health",
            "status>500           | status:>500",
            "status<500           | status:<500",
            "status>=1.5          | status:>=1.5",
            "status<=2            | status:<=2"
    })
    @DisplayName("Should map every operator to its LogsQL form")
    void shouldMapOperators(String query, String expected) {
        assertThat(logsql(query)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should join AND conditions with spaces")
    void shouldJoinAndWithSpaces() {
        assertThat(logsql("a=\"1\" and b=\"2\" and c=\"3\"")).isEqualTo("a:=1 b:=2 c:=3");
    }

    @Test
    @DisplayName("Should wrap OR lists in one pair of parentheses")
    void shouldWrapOr() {
        assertThat(logsql("a=\"1\" or b=\"2\" or c=\"3\"")).isEqualTo("(a:=1 or b:=2 or c:=3)");
    }

    @Test
    @DisplayName("Should keep OR grouping inside AND")
    void shouldCombineGroups() {
        assertThat(logsql("(level=\"error\" or level=\"warn\") and service=\"api\""))
                .isEqualTo("(level:=error or level:=warn) service:=api");
        assertThat(logsql("a=1 or b=2 and c=3")).isEqualTo("(a:=1 or b:=2 c:=3)");
    }

    @Test
    @DisplayName("Should quote values only when needed")
    void shouldQuoteWhenNeeded() {
        assertThat(logsql("msg=\"hello world\"")).isEqualTo("msg:=\"hello world\"");
        assertThat(logsql("url=\"http://x\"")).isEqualTo("url:=\"http://x\"");
        assertThat(logsql("msg=\"say \\\"hi\\\"\"")).isEqualTo("msg:=\"say \\\"hi\\\"\"");
        assertThat(logsql("msg=\"\"")).isEqualTo("msg:=\"\"");
        assertThat(logsql("msg=\"a|b\"")).isEqualTo("msg:=\"a|b\"");
        assertThat(logsql("msg=\"plain-text_1\"")).isEqualTo("msg:=plain-text_1");
    }

    @Test
    @DisplayName("Should render literals")
    void shouldRenderLiterals() {
        assertThat(logsql("ok=true")).isEqualTo("ok:=true");
        assertThat(logsql("trace_id=null")).isEqualTo("trace_id:=\"\"");
    }

    @Test
    @DisplayName("Should render nested fields as dotted paths")
    void shouldRenderNestedFields() {
        assertThat(logsql("log_attributes.http.status=200")).isEqualTo("log_attributes.http.status:=200");
    }

    @Test
    @DisplayName("Should quote field names holding quoted path segments")
    void shouldQuoteFieldNames() {
        assertThat(logsql("log_attributes.\"user agent\"=\"curl\""))
                .isEqualTo("\"log_attributes.user agent\":=curl");
        assertThat(logsql("attrs.\"k:v\"=1 and level=\"error\""))
                .isEqualTo("\"attrs.k:v\":=1 level:=error");
    }

    @Test
    @DisplayName("Should keep asterisks literal instead of producing a prefix filter")
    void shouldQuoteAsterisks() {
        assertThat(logsql("msg=\"err*\"")).isEqualTo("msg:=\"err*\"");
        assertThat(logsql("msg!=\"*\"")).isEqualTo("msg:!=\"*\"");
    }

    @Test
    @DisplayName("Should quote projected fields that need it")
    void shouldQuoteProjectedFields() {
        assertThat(generator.generateSelectClause(List.of(
                new FieldPath("log", List.of("user agent")), FieldPath.simple("b"))))
                .isEqualTo("\"log.user agent\", b");
    }

    @Test
    @DisplayName("Should render the projection as a comma separated list")
    void shouldRenderSelectClause() {
        assertThat(generator.generateSelectClause(List.of(
                FieldPath.simple("timestamp"), FieldPath.simple("service"), new FieldPath("attrs", List.of("level")))))
                .isEqualTo("timestamp, service, attrs.level");
    }

    @Test
    @DisplayName("Should render only the filter of a piped query")
    void shouldRenderFilterOfPipedQuery() {
        assertThat(logsql("level=\"error\" | timestamp body")).isEqualTo("level:=error");
        assertThat(logsql("| timestamp body")).isEmpty();
    }
}
