package com.logchef.logchefql.ast;

/**
 * Visitor over the LogchefQL AST, implemented by the code generators
 */
public interface NodeVisitor<T> {

    T visitExpression(ExpressionNode node);

    T visitLogical(LogicalNode node);

    T visitGroup(GroupNode node);

    T visitQuery(QueryNode node);
}
