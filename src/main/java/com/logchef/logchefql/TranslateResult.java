package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Result of translating LogchefQL to a ClickHouse condition
 *
 * On failure {@code sql} is empty and the metadata lists are empty; the error
 * describes the first problem found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TranslateResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("sql")
    private final String sql;

    @JsonProperty("select_clause")
    private final String selectClause;

    @JsonProperty("conditions")
    private final List<FilterCondition> conditions;

    @JsonProperty("fields_used")
    private final List<String> fieldsUsed;

    @JsonProperty("error")
    private final ParseError error;

    private TranslateResult(boolean valid, String sql, String selectClause,
                            List<FilterCondition> conditions, List<String> fieldsUsed, ParseError error) {
        this.valid = valid;
        this.sql = sql;
        this.selectClause = selectClause;
        this.conditions = List.copyOf(conditions);
        this.fieldsUsed = List.copyOf(fieldsUsed);
        this.error = error;
    }

    public static TranslateResult success(String sql, String selectClause,
                                          List<FilterCondition> conditions, List<String> fieldsUsed) {
        return new TranslateResult(true, sql, selectClause, conditions, fieldsUsed, null);
    }

    public static TranslateResult empty() {
        return new TranslateResult(true, "", null, List.of(), List.of(), null);
    }

    public static TranslateResult failure(ParseError error) {
        return new TranslateResult(false, "", null, List.of(), List.of(), error);
    }

    public boolean isValid() {
        return valid;
    }

    public String getSql() {
        return sql;
    }

    /**
     * Column list of a pipe projection, absent when the query has no pipe
     */
    @JsonIgnore
    public Optional<String> getSelectClause() {
        return Optional.ofNullable(selectClause);
    }

    public List<FilterCondition> getConditions() {
        return conditions;
    }

    public List<String> getFieldsUsed() {
        return fieldsUsed;
    }

    @JsonIgnore
    public Optional<ParseError> getError() {
        return Optional.ofNullable(error);
    }
}
