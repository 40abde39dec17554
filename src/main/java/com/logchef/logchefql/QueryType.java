package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Language of a free-form query typed by a user
 */
public enum QueryType {
    SQL("sql"),
    LOGCHEFQL("logchefql");

    private final String value;

    QueryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
