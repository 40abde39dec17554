package com.logchef.logchefql;

/**
 * Closed set of error codes reported by the lexer, parser and query assembler
 */
public enum ErrorCode {
    UNTERMINATED_STRING,
    UNEXPECTED_END,
    UNEXPECTED_TOKEN,
    EXPECTED_OPERATOR,
    EXPECTED_VALUE,
    EXPECTED_CLOSING_PAREN,
    UNKNOWN_OPERATOR,
    UNKNOWN_BOOLEAN_OPERATOR,
    MISSING_BOOLEAN_OPERATOR,

    // Query assembly
    INVALID_TIME_FORMAT,
    INVALID_TIMEZONE,
    INVALID_TABLE_NAME,
    INVALID_TIMESTAMP_FIELD
}
