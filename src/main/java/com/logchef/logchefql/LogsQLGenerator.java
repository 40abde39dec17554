package com.logchef.logchefql;

import com.logchef.logchefql.ast.BoolOperator;
import com.logchef.logchefql.ast.ExpressionNode;
import com.logchef.logchefql.ast.FieldPath;
import com.logchef.logchefql.ast.GroupNode;
import com.logchef.logchefql.ast.LogicalNode;
import com.logchef.logchefql.ast.Node;
import com.logchef.logchefql.ast.NodeVisitor;
import com.logchef.logchefql.ast.QueryNode;
import com.logchef.logchefql.ast.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Generates VictoriaLogs LogsQL filters from a LogchefQL AST
 *
 * LogsQL has native nested-field syntax, so fields render as dotted paths and the
 * schema plays no part. Field names and values are quoted under the same rules. AND is implicit (space separated); OR lists are wrapped
 * in a single pair of parentheses.
 */
@Component
public class LogsQLGenerator implements NodeVisitor<String> {

    private static final Logger logger = LoggerFactory.getLogger(LogsQLGenerator.class);

    public String generate(Node ast) {
        if (ast == null) {
            return "";
        }
        String logsql = ast.accept(this);
        logger.debug("Generated LogsQL filter: {}", logsql);
        return logsql;
    }

    /**
     * Comma separated field list for a pipe projection, empty when there are no fields
     */
    public String generateSelectClause(List<FieldPath> fields) {
        return fields.stream()
                .map(LogsQLGenerator::formatField)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String visitExpression(ExpressionNode node) {
        String field = formatField(node.getField());
        String value = formatValue(node.getValue());
        return switch (node.getOperator()) {
            case EQUALS -> field + ":=" + value;
            case NOT_EQUALS -> field + ":!=" + value;
            case REGEX -> field + ":~" + value;
            case NOT_REGEX -> field + ":!~" + value;
            case GREATER_THAN -> field + ":>" + value;
            case LESS_THAN -> field + ":<" + value;
            case GREATER_OR_EQUAL -> field + ":>=" + value;
            case LESS_OR_EQUAL -> field + ":<=" + value;
        };
    }

    @Override
    public String visitLogical(LogicalNode node) {
        List<String> conditions = new ArrayList<>();
        for (Node child : node.getChildren()) {
            String logsql = child.accept(this);
            if (!logsql.isEmpty()) {
                conditions.add(logsql);
            }
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        if (node.getOperator() == BoolOperator.OR) {
            return "(" + String.join(" or ", conditions) + ")";
        }
        return String.join(" ", conditions);
    }

    @Override
    public String visitGroup(GroupNode node) {
        return node.getChild().accept(this);
    }

    @Override
    public String visitQuery(QueryNode node) {
        return node.getWhere().map(where -> where.accept(this)).orElse("");
    }

    static String formatField(FieldPath field) {
        return quoteIfNeeded(field.toDottedString());
    }

    static String formatValue(Value value) {
        return switch (value.getKind()) {
            case STRING, BARE_WORD -> quoteIfNeeded(value.getText());
            case NUMBER -> Value.formatNumber(value.getNumber());
            case BOOLEAN -> Boolean.toString(value.getBoolean());
            case NULL -> "\"\"";
        };
    }

    static String quoteIfNeeded(String text) {
        if (!needsQuoting(text)) {
            return text;
        }
        return "\"" + escape(text) + "\"";
    }

    static boolean needsQuoting(String text) {
        if (text.isEmpty()) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '\'' || c == '(' || c == ')'
                    || c == ':' || c == '|' || c == '\\' || c == '*') {
                return true;
            }
        }
        return false;
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
