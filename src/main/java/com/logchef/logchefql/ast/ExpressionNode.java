package com.logchef.logchefql.ast;

import java.util.Objects;

/**
 * A single comparison, {@code field <op> value}
 */
public final class ExpressionNode implements Node {

    private final FieldPath field;
    private final Operator operator;
    private final Value value;
    private final boolean quoted;

    public ExpressionNode(FieldPath field, Operator operator, Value value, boolean quoted) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
        this.quoted = quoted;
    }

    public FieldPath getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public Value getValue() {
        return value;
    }

    /**
     * Whether the value was written as a quoted string literal
     */
    public boolean isQuoted() {
        return quoted;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitExpression(this);
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
