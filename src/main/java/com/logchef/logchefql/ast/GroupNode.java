package com.logchef.logchefql.ast;

import java.util.Objects;

/**
 * A parenthesized sub-expression. Always wraps exactly one child.
 */
public final class GroupNode implements Node {

    private final Node child;

    public GroupNode(Node child) {
        this.child = Objects.requireNonNull(child, "child");
    }

    public Node getChild() {
        return child;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
        return "(" + child + ")";
    }
}
