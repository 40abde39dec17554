package com.logchef;

import com.logchef.logchefql.LogchefQLService;
import com.logchef.logchefql.QueryAssembler;
import com.logchef.logchefql.QueryProperties;
import com.logchef.logchefql.QueryTypeDetector;
import com.logchef.logchefql.SqlQueryParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "logchef.query.max-limit=500")
@DisplayName("Application context Tests")
class LogchefApplicationTest {

    @Autowired
    private LogchefQLService logchefQLService;

    @Autowired
    private QueryAssembler queryAssembler;

    @Autowired
    private QueryProperties queryProperties;

    @Autowired
    private QueryTypeDetector queryTypeDetector;

    @Test
    @DisplayName("Should wire the query components")
    void shouldWireComponents() {
        assertThat(logchefQLService.translate("level=\"error\"", null).getSql()).isEqualTo("`level` = 'error'");
        assertThat(queryTypeDetector).isNotNull();
    }

    @Test
    @DisplayName("Should bind query properties from configuration")
    void shouldBindProperties() {
        assertThat(queryProperties.getDefaultTimezone()).isEqualTo("UTC");
        assertThat(queryProperties.getDefaultLimit()).isEqualTo(100);
        assertThat(queryProperties.getMaxLimit()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should clamp limits to the configured maximum")
    void shouldClampLimit() {
        String sql = queryAssembler.buildFullQuery(SqlQueryParams.builder()
                .tableName("logs.app")
                .timestampField("timestamp")
                .startTime("2025-01-01 00:00:00")
                .endTime("2025-01-01 01:00:00")
                .limit(5000)
                .build());

        assertThat(sql).endsWith("LIMIT 500");
    }
}
