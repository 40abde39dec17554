package com.logchef.logchefql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * Assembles complete, executable query text around a translated LogchefQL filter.
 *
 * All caller supplied values are validated first; after that the filter is translated
 * and any translation error is raised unchanged inside a {@link QueryBuildException}.
 */
@Component
public class QueryAssembler {

    private static final Logger logger = LoggerFactory.getLogger(QueryAssembler.class);

    private final LogchefQLService logchefQLService;
    private final QueryParamValidator validator;
    private final QueryProperties properties;

    @Autowired
    public QueryAssembler(LogchefQLService logchefQLService,
                          QueryParamValidator validator,
                          QueryProperties properties) {
        this.logchefQLService = logchefQLService;
        this.validator = validator;
        this.properties = properties;
    }

    /**
     * Build a ClickHouse query:
     * <pre>
     * SELECT cols
     * FROM table
     * WHERE `ts` BETWEEN toDateTime('start', 'tz') AND toDateTime('end', 'tz')
     *   AND (filter)
     * ORDER BY `ts` DESC
     * LIMIT n
     * </pre>
     *
     * @throws QueryBuildException when a parameter is invalid or the filter does not translate
     */
    public String buildFullQuery(SqlQueryParams params) {
        String timezone = params.getTimezone() == null ? properties.getDefaultTimezone() : params.getTimezone();

        validator.validateTableName(params.getTableName());
        validator.validateTimestampField(params.getTimestampField());
        validator.validateTimezone(timezone);
        validator.parseTime(params.getStartTime());
        validator.parseTime(params.getEndTime());

        TranslateResult translated = logchefQLService.translate(
                params.getLogchefQL(), params.getSchema(), params.getTimestampField());
        if (!translated.isValid()) {
            throw new QueryBuildException(translated.getError()
                    .orElseGet(() -> new ParseError(ErrorCode.UNEXPECTED_TOKEN, "invalid LogchefQL query")));
        }

        String timestamp = ClickHouseSqlGenerator.escapeIdentifier(params.getTimestampField());
        StringBuilder query = new StringBuilder();
        query.append("SELECT ").append(selectColumns(translated, params)).append('\n');
        query.append("FROM ").append(params.getTableName()).append('\n');
        query.append("WHERE ").append(timestamp)
                .append(" BETWEEN toDateTime('").append(params.getStartTime()).append("', '").append(timezone)
                .append("') AND toDateTime('").append(params.getEndTime()).append("', '").append(timezone)
                .append("')");
        if (!translated.getSql().isEmpty()) {
            query.append("\n  AND (").append(translated.getSql()).append(')');
        }
        query.append('\n');
        query.append("ORDER BY ").append(timestamp).append(" DESC");

        int limit = resolveLimit(params.getLimit());
        if (limit > 0) {
            query.append("\nLIMIT ").append(limit);
        }

        String sql = query.toString();
        logger.debug("Assembled ClickHouse query for table {}: {}", params.getTableName(), sql);
        return sql;
    }

    /**
     * Build a LogsQL query:
     * {@code filter _time:[start, end] | fields a, b | sort by (_time desc) | limit n}.
     * Start and end are read in the given timezone and emitted as UTC RFC 3339 instants.
     *
     * @throws QueryBuildException when a parameter is invalid or the filter does not translate
     */
    public String buildFullLogsQLQuery(LogsQLQueryParams params) {
        String timezone = params.getTimezone() == null ? properties.getDefaultTimezone() : params.getTimezone();
        ZoneId zone = validator.resolveZone(timezone);
        Instant start = validator.parseTime(params.getStartTime()).atZone(zone).toInstant();
        Instant end = validator.parseTime(params.getEndTime()).atZone(zone).toInstant();

        LogsQLTranslateResult translated = logchefQLService.translateToLogsQL(params.getLogchefQL(), params.getSchema());
        if (!translated.isValid()) {
            throw new QueryBuildException(translated.getError()
                    .orElseGet(() -> new ParseError(ErrorCode.UNEXPECTED_TOKEN, "invalid LogchefQL query")));
        }

        StringBuilder query = new StringBuilder();
        if (!translated.getLogsql().isEmpty()) {
            query.append(translated.getLogsql()).append(' ');
        }
        query.append("_time:[")
                .append(DateTimeFormatter.ISO_INSTANT.format(start))
                .append(", ")
                .append(DateTimeFormatter.ISO_INSTANT.format(end))
                .append(']');
        translated.getSelectClause().ifPresent(fields -> query.append(" | fields ").append(fields));
        query.append(" | sort by (_time desc)");

        int limit = resolveLimit(params.getLimit());
        if (limit > 0) {
            query.append(" | limit ").append(limit);
        }

        String logsql = query.toString();
        logger.debug("Assembled LogsQL query: {}", logsql);
        return logsql;
    }

    /**
     * Pipe projection first, then the caller's column list, then {@code *}
     */
    private String selectColumns(TranslateResult translated, SqlQueryParams params) {
        if (translated.getSelectClause().isPresent()) {
            return translated.getSelectClause().get();
        }
        if (!params.getColumns().isEmpty()) {
            return params.getColumns().stream()
                    .map(ClickHouseSqlGenerator::escapeIdentifier)
                    .collect(Collectors.joining(", "));
        }
        return "*";
    }

    private int resolveLimit(Integer requested) {
        int limit = requested == null ? properties.getDefaultLimit() : requested;
        return properties.clampLimit(limit);
    }
}
