package com.logchef.logchefql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Validates caller supplied values before they are interpolated into query text.
 *
 * Table names, timestamp columns, timezones and time bounds reach the assembled query
 * verbatim, so anything outside a narrow character set is rejected rather than escaped.
 * Every rejection is logged at warn level and counted, since it usually means a caller
 * bug or an injection attempt. Rejections surface as {@link QueryBuildException}.
 */
@Component
public class QueryParamValidator {

    private static final Logger logger = LoggerFactory.getLogger(QueryParamValidator.class);

    private static final Pattern TABLE_NAME =
            Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");
    private static final Pattern TIMESTAMP_FIELD =
            Pattern.compile("^@?[A-Za-z_][A-Za-z0-9_.:]*$");
    private static final Pattern ZONE_NAME =
            Pattern.compile("^[A-Za-z][A-Za-z0-9_+\\-]*(/[A-Za-z0-9_+\\-]+)*$");
    private static final Pattern ZONE_OFFSET =
            Pattern.compile("^(UTC|GMT)?[+-]\\d{1,2}(:?\\d{2})?$");
    private static final int MAX_TIMEZONE_LENGTH = 64;

    static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private final TranslationMetrics metrics;

    @Autowired
    public QueryParamValidator(TranslationMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Accepts {@code table} or {@code database.table} built from identifier characters
     */
    public void validateTableName(String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw reject(ErrorCode.INVALID_TABLE_NAME,
                    "invalid table name '" + tableName + "': expected 'table' or 'database.table' with valid identifiers");
        }
    }

    /**
     * Accepts identifier characters plus {@code .} and {@code :}, with an optional
     * leading {@code @} for ELK style {@code @timestamp} columns
     */
    public void validateTimestampField(String timestampField) {
        if (timestampField == null || !TIMESTAMP_FIELD.matcher(timestampField).matches()) {
            throw reject(ErrorCode.INVALID_TIMESTAMP_FIELD,
                    "invalid timestamp field '" + timestampField + "': must start with a letter, underscore or '@'"
                            + " and contain only alphanumerics, '_', '.' or ':'");
        }
    }

    /**
     * Accepts IANA style names ({@code Europe/Berlin}, {@code UTC}) and numeric offsets
     * ({@code +05:30}, {@code UTC+05:30}, {@code GMT-3})
     */
    public void validateTimezone(String timezone) {
        if (timezone == null || timezone.isEmpty()) {
            throw reject(ErrorCode.INVALID_TIMEZONE, "invalid timezone: timezone cannot be empty");
        }
        if (timezone.length() > MAX_TIMEZONE_LENGTH) {
            throw reject(ErrorCode.INVALID_TIMEZONE, "invalid timezone: too long");
        }
        if (!ZONE_NAME.matcher(timezone).matches() && !ZONE_OFFSET.matcher(timezone).matches()) {
            throw reject(ErrorCode.INVALID_TIMEZONE,
                    "invalid timezone '" + timezone + "': contains disallowed characters");
        }
    }

    /**
     * Validates the timezone and resolves it to a zone the JDK knows
     */
    public ZoneId resolveZone(String timezone) {
        validateTimezone(timezone);
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw reject(ErrorCode.INVALID_TIMEZONE, "invalid timezone '" + timezone + "': unknown zone");
        }
    }

    /**
     * Parses a {@code yyyy-MM-dd HH:mm:ss} timestamp, rejecting impossible dates
     * such as month 13 or February 30
     */
    public LocalDateTime parseTime(String time) {
        if (time == null) {
            throw reject(ErrorCode.INVALID_TIME_FORMAT,
                    "invalid time format: expected 'YYYY-MM-DD HH:MM:SS', got nothing");
        }
        try {
            return LocalDateTime.parse(time, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw reject(ErrorCode.INVALID_TIME_FORMAT,
                    "invalid time format: expected 'YYYY-MM-DD HH:MM:SS', got '" + time + "'");
        }
    }

    private QueryBuildException reject(ErrorCode code, String message) {
        logger.warn("Rejected query parameter [{}]: {}", code, message);
        metrics.recordAssemblyRejected(code);
        return new QueryBuildException(new ParseError(code, message));
    }
}
