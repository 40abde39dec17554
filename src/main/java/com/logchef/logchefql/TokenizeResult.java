package com.logchef.logchefql;

import java.util.List;

/**
 * Token stream plus lexical errors. The stream is returned even when errors exist.
 */
public final class TokenizeResult {

    private final List<Token> tokens;
    private final List<ParseError> errors;

    public TokenizeResult(List<Token> tokens, List<ParseError> errors) {
        this.tokens = List.copyOf(tokens);
        this.errors = List.copyOf(errors);
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
