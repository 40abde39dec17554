package com.logchef.logchefql.ast;

import java.util.List;
import java.util.Optional;

/**
 * Top-level query produced when the pipe operator is present:
 * an optional filter and the projected fields.
 */
public final class QueryNode implements Node {

    private final Node where;
    private final List<FieldPath> select;

    public QueryNode(Node where, List<FieldPath> select) {
        this.where = where;
        this.select = select == null ? List.of() : List.copyOf(select);
    }

    public Optional<Node> getWhere() {
        return Optional.ofNullable(where);
    }

    public List<FieldPath> getSelect() {
        return select;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitQuery(this);
    }

    @Override
    public String toString() {
        return "Query{where=" + where + ", select=" + select + "}";
    }
}
