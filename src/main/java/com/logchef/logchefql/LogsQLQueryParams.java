package com.logchef.logchefql;

/**
 * Inputs for assembling a complete LogsQL query around a LogchefQL filter
 */
public final class LogsQLQueryParams {

    private final String logchefQL;
    private final Schema schema;
    private final String startTime;
    private final String endTime;
    private final String timezone;
    private final Integer limit;

    private LogsQLQueryParams(Builder builder) {
        this.logchefQL = builder.logchefQL;
        this.schema = builder.schema;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.timezone = builder.timezone;
        this.limit = builder.limit;
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

    public String getStartTime() {
        return startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    /**
     * Zone the start and end times are written in; null falls back to the configured default
     */
    public String getTimezone() {
        return timezone;
    }

    /**
     * Row limit, zero or negative for none, null for the configured default
     */
    public Integer getLimit() {
        return limit;
    }

    public static final class Builder {
        private String logchefQL = "";
        private Schema schema;
        private String startTime;
        private String endTime;
        private String timezone;
        private Integer limit;

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

        public LogsQLQueryParams build() {
            return new LogsQLQueryParams(this);
        }
    }
}
