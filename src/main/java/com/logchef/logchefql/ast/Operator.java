package com.logchef.logchefql.ast;

import java.util.Optional;

/**
 * Comparison operators supported by LogchefQL
 */
public enum Operator {
    EQUALS("="),
    NOT_EQUALS("!="),
    REGEX("~"),
    NOT_REGEX("!~"),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Substring/regex style match operators ({@code ~} and {@code !~})
     */
    public boolean isRegex() {
        return this == REGEX || this == NOT_REGEX;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
