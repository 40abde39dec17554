package com.logchef.logchefql;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Best-effort classifier that routes free-form input to the SQL editor or the
 * LogchefQL compiler. SQL keywords win over LogchefQL shapes; anything
 * unrecognised is treated as LogchefQL.
 */
@Component
public class QueryTypeDetector {

    private static final List<Pattern> SQL_PATTERNS = List.of(
            Pattern.compile("(?i)^\\s*SELECT\\s+"),
            Pattern.compile("(?i)^\\s*WITH\\s+"),
            Pattern.compile("(?i)\\s+FROM\\s+"),
            Pattern.compile("(?i)\\s+GROUP\\s+BY\\s+"),
            Pattern.compile("(?i)\\s+ORDER\\s+BY\\s+"));

    private static final List<Pattern> LOGCHEFQL_PATTERNS = List.of(
            Pattern.compile("\\w+\\s*=\\s*\""),
            Pattern.compile("\\w+\\s*!=\\s*\""),
            Pattern.compile("\\w+\\s*~\\s*\""),
            Pattern.compile("\\|\\s*\\w+"));

    public QueryType detect(String query) {
        if (query == null || query.isBlank()) {
            return QueryType.LOGCHEFQL;
        }
        String trimmed = query.trim();

        for (Pattern pattern : SQL_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                return QueryType.SQL;
            }
        }
        for (Pattern pattern : LOGCHEFQL_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                return QueryType.LOGCHEFQL;
            }
        }
        return QueryType.LOGCHEFQL;
    }
}
