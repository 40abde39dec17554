package com.logchef.logchefql.ast;

import java.util.List;
import java.util.Objects;

/**
 * N-ary AND/OR combination. Successive operators of the same kind are folded into
 * one node, so children always number at least two.
 */
public final class LogicalNode implements Node {

    private final BoolOperator operator;
    private final List<Node> children;

    public LogicalNode(BoolOperator operator, List<Node> children) {
        this.operator = Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(children, "children");
        if (children.size() < 2) {
            throw new IllegalArgumentException("Logical node requires at least two children, got " + children.size());
        }
        this.children = List.copyOf(children);
    }

    /**
     * Combine the nodes with the operator, collapsing a single node to itself
     */
    public static Node of(BoolOperator operator, List<Node> nodes) {
        if (nodes.size() == 1) {
            return nodes.get(0);
        }
        return new LogicalNode(operator, nodes);
    }

    public BoolOperator getOperator() {
        return operator;
    }

    public List<Node> getChildren() {
        return children;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public String toString() {
        return operator + children.toString();
    }
}
