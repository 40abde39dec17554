package com.logchef.logchefql;

import java.util.Objects;

/**
 * Immutable lexical token.
 *
 * For VALUE tokens built from string literals {@code value} holds the unescaped text;
 * for KEY tokens it holds the raw path text including any quoted segments.
 */
public final class Token {

    private final TokenType type;
    private final String value;
    private final Position position;
    private final boolean quoted;
    private final boolean incomplete;

    public Token(TokenType type, String value, Position position) {
        this(type, value, position, false, false);
    }

    public Token(TokenType type, String value, Position position, boolean quoted, boolean incomplete) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
        this.position = Objects.requireNonNull(position, "position");
        this.quoted = quoted;
        this.incomplete = incomplete;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public Position getPosition() {
        return position;
    }

    public boolean isQuoted() {
        return quoted;
    }

    /**
     * Set on a string literal whose closing quote was never found
     */
    public boolean isIncomplete() {
        return incomplete;
    }

    public boolean is(TokenType expected, String text) {
        return type == expected && value.equals(text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return quoted == token.quoted
                && incomplete == token.incomplete
                && type == token.type
                && value.equals(token.value)
                && position.equals(token.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, position, quoted, incomplete);
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + position;
    }
}
