package com.logchef.logchefql;

/**
 * Exception thrown when a full query cannot be assembled, either because a
 * parameter failed validation or because the LogchefQL text did not translate.
 * The underlying error is available as data through {@link #getError()}.
 */
public class QueryBuildException extends RuntimeException {

    private final ParseError error;

    public QueryBuildException(ParseError error) {
        super(error.format());
        this.error = error;
    }

    public ParseError getError() {
        return error;
    }

    public ErrorCode getCode() {
        return error.getCode();
    }
}
