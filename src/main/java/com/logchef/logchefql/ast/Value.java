package com.logchef.logchefql.ast;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Literal on the right-hand side of a comparison.
 *
 * A tagged union: consumers switch on {@link #getKind()} and read the matching accessor.
 */
public final class Value {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        BARE_WORD
    }

    private static final Value NULL_VALUE = new Value(Kind.NULL, null, 0d, false);
    private static final Value TRUE_VALUE = new Value(Kind.BOOLEAN, null, 0d, true);
    private static final Value FALSE_VALUE = new Value(Kind.BOOLEAN, null, 0d, false);

    private final Kind kind;
    private final String text;
    private final double number;
    private final boolean bool;

    private Value(Kind kind, String text, double number, boolean bool) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.bool = bool;
    }

    public static Value string(String text) {
        return new Value(Kind.STRING, Objects.requireNonNull(text, "text"), 0d, false);
    }

    public static Value number(double number) {
        return new Value(Kind.NUMBER, null, number, false);
    }

    public static Value bool(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    public static Value nullValue() {
        return NULL_VALUE;
    }

    public static Value bareWord(String text) {
        return new Value(Kind.BARE_WORD, Objects.requireNonNull(text, "text"), 0d, false);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Text of a STRING or BARE_WORD value
     */
    public String getText() {
        if (kind != Kind.STRING && kind != Kind.BARE_WORD) {
            throw new IllegalStateException("Value of kind " + kind + " has no text");
        }
        return text;
    }

    public double getNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Value of kind " + kind + " is not a number");
        }
        return number;
    }

    public boolean getBoolean() {
        if (kind != Kind.BOOLEAN) {
            throw new IllegalStateException("Value of kind " + kind + " is not a boolean");
        }
        return bool;
    }

    /**
     * Plain rendering of a number: {@code 500} rather than {@code 500.0}, no exponent.
     */
    public static String formatNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    /**
     * Display form used in extracted metadata; null renders as an empty string.
     */
    public String asDisplayString() {
        return switch (kind) {
            case STRING, BARE_WORD -> text;
            case NUMBER -> formatNumber(number);
            case BOOLEAN -> Boolean.toString(bool);
            case NULL -> "";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return kind == other.kind
                && Double.compare(number, other.number) == 0
                && bool == other.bool
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, number, bool);
    }

    @Override
    public String toString() {
        return kind + "(" + asDisplayString() + ")";
    }
}
