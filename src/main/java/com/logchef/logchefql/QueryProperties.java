package com.logchef.logchefql;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Defaults applied while assembling full queries
 */
@Component
public class QueryProperties {

    private final String defaultTimezone;
    private final int defaultLimit;
    private final int maxLimit;

    public QueryProperties(@Value("${logchef.query.default-timezone:UTC}") String defaultTimezone,
                           @Value("${logchef.query.default-limit:100}") int defaultLimit,
                           @Value("${logchef.query.max-limit:10000}") int maxLimit) {
        this.defaultTimezone = defaultTimezone;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    /**
     * Caps a requested limit at the configured maximum. Zero and negative values
     * mean "no limit" and pass through unchanged.
     */
    public int clampLimit(int requested) {
        if (requested > maxLimit && maxLimit > 0) {
            return maxLimit;
        }
        return requested;
    }
}
