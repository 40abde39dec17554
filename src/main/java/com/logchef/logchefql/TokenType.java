package com.logchef.logchefql;

/**
 * Lexical token types produced by {@link QueryLexer}
 */
public enum TokenType {
    KEY,
    OPERATOR,
    VALUE,
    NUMBER,
    PAREN,
    BOOL,
    PIPE
}
