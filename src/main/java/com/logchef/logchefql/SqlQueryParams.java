package com.logchef.logchefql;

import java.util.List;

/**
 * Inputs for assembling a complete ClickHouse query around a LogchefQL filter
 */
public final class SqlQueryParams {

    private final String logchefQL;
    private final Schema schema;
    private final String tableName;
    private final String timestampField;
    private final String startTime;
    private final String endTime;
    private final String timezone;
    private final Integer limit;
    private final List<String> columns;

    private SqlQueryParams(Builder builder) {
        this.logchefQL = builder.logchefQL;
        this.schema = builder.schema;
        this.tableName = builder.tableName;
        this.timestampField = builder.timestampField;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.timezone = builder.timezone;
        this.limit = builder.limit;
        this.columns = List.copyOf(builder.columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getLogchefQL() {
        return logchefQL;
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Table as {@code name} or {@code database.name}
     */
    public String getTableName() {
        return tableName;
    }

    public String getTimestampField() {
        return timestampField;
    }

    /**
     * Range start as {@code yyyy-MM-dd HH:mm:ss}, interpreted in {@link #getTimezone()}
     */
    public String getStartTime() {
        return startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    public String getTimezone() {
        return timezone;
    }

    /**
     * Row limit, zero or negative for none, null for the configured default
     */
    public Integer getLimit() {
        return limit;
    }

    /**
     * Columns to select when the query has no pipe projection, empty for {@code *}
     */
    public List<String> getColumns() {
        return columns;
    }

    public static final class Builder {
        private String logchefQL = "";
        private Schema schema;
        private String tableName;
        private String timestampField;
        private String startTime;
        private String endTime;
        private String timezone;
        private Integer limit;
        private List<String> columns = List.of();

        private Builder() {
        }

        public Builder logchefQL(String logchefQL) {
            this.logchefQL = logchefQL;
            return this;
        }

        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder timestampField(String timestampField) {
            this.timestampField = timestampField;
            return this;
        }

        public Builder startTime(String startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(String endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder columns(List<String> columns) {
            this.columns = columns == null ? List.of() : columns;
            return this;
        }

        public SqlQueryParams build() {
            return new SqlQueryParams(this);
        }
    }
}
