package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Result of translating LogchefQL to a LogsQL filter
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LogsQLTranslateResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("logsql")
    private final String logsql;

    @JsonProperty("select_clause")
    private final String selectClause;

    @JsonProperty("conditions")
    private final List<FilterCondition> conditions;

    @JsonProperty("fields_used")
    private final List<String> fieldsUsed;

    @JsonProperty("error")
    private final ParseError error;

    private LogsQLTranslateResult(boolean valid, String logsql, String selectClause,
                                  List<FilterCondition> conditions, List<String> fieldsUsed, ParseError error) {
        this.valid = valid;
        this.logsql = logsql;
        this.selectClause = selectClause;
        this.conditions = List.copyOf(conditions);
        this.fieldsUsed = List.copyOf(fieldsUsed);
        this.error = error;
    }

    public static LogsQLTranslateResult success(String logsql, String selectClause,
                                                List<FilterCondition> conditions, List<String> fieldsUsed) {
        return new LogsQLTranslateResult(true, logsql, selectClause, conditions, fieldsUsed, null);
    }

    public static LogsQLTranslateResult empty() {
        return new LogsQLTranslateResult(true, "", null, List.of(), List.of(), null);
    }

    public static LogsQLTranslateResult failure(ParseError error) {
        return new LogsQLTranslateResult(false, "", null, List.of(), List.of(), error);
    }

    public boolean isValid() {
        return valid;
    }

    public String getLogsql() {
        return logsql;
    }

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
