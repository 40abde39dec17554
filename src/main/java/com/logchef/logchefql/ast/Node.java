package com.logchef.logchefql.ast;

/**
 * Base type of all LogchefQL AST nodes.
 * Consumers walk the tree through {@link NodeVisitor} so every node type is handled.
 */
public interface Node {

    <T> T accept(NodeVisitor<T> visitor);
}
