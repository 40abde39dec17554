package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single {@code field operator value} condition as written by the user,
 * used by the UI to highlight active filters
 */
public final class FilterCondition {

    @JsonProperty("field")
    private final String field;

    @JsonProperty("operator")
    private final String operator;

    @JsonProperty("value")
    private final String value;

    @JsonProperty("is_regex")
    private final boolean regex;

    public FilterCondition(String field, String operator, String value, boolean regex) {
        this.field = field;
        this.operator = operator;
        this.value = value;
        this.regex = regex;
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public boolean isRegex() {
        return regex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterCondition)) return false;
        FilterCondition that = (FilterCondition) o;
        return regex == that.regex
                && Objects.equals(field, that.field)
                && Objects.equals(operator, that.operator)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value, regex);
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
