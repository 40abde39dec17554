package com.logchef.logchefql;

import com.logchef.logchefql.ast.ExpressionNode;
import com.logchef.logchefql.ast.FieldPath;
import com.logchef.logchefql.ast.GroupNode;
import com.logchef.logchefql.ast.LogicalNode;
import com.logchef.logchefql.ast.Node;
import com.logchef.logchefql.ast.NodeVisitor;
import com.logchef.logchefql.ast.Operator;
import com.logchef.logchefql.ast.QueryNode;
import com.logchef.logchefql.ast.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Generates ClickHouse SQL boolean expressions from a LogchefQL AST
 *
 * Output is a WHERE-clause fragment with every identifier backtick-quoted and every
 * string literal escaped. Nested fields are resolved against the schema: Map columns
 * use subscript access, everything else falls back to JSONExtractString.
 */
@Component
public class ClickHouseSqlGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ClickHouseSqlGenerator.class);

    /**
     * Generate the SQL condition for an AST
     *
     * @param ast    parsed query, may be null for an empty query
     * @param schema table schema, may be null
     * @return the condition text, empty when there is nothing to filter on
     */
    public String generate(Node ast, Schema schema) {
        if (ast == null) {
            return "";
        }
        String sql = ast.accept(new SqlVisitor(schema));
        logger.debug("Generated SQL condition: {}", sql);
        return sql;
    }

    /**
     * Build the SELECT column list for a pipe projection.
     *
     * The timestamp field, when given, always comes first and is not repeated if the
     * projection names it explicitly. Fields known to the schema are selected directly;
     * unknown simple fields are looked up in the first Map column of the schema.
     */
    public String generateSelectClause(List<FieldPath> fields, Schema schema, String timestampField) {
        List<String> columns = new ArrayList<>();
        boolean hasTimestamp = timestampField != null && !timestampField.isBlank();
        if (hasTimestamp) {
            columns.add(escapeIdentifier(timestampField));
        }

        for (FieldPath field : fields) {
            if (hasTimestamp && !field.isNested() && field.getBase().equals(timestampField)) {
                continue;
            }
            columns.add(selectExpression(field, schema));
        }

        if (columns.isEmpty()) {
            return "*";
        }
        return String.join(", ", columns);
    }

    private String selectExpression(FieldPath field, Schema schema) {
        if (field.isNested()) {
            String alias = field.getBase() + "_" + String.join("_", field.getPath());
            return nestedAccess(field, columnOf(schema, field.getBase())) + " AS " + escapeIdentifier(alias);
        }

        String name = field.getBase();
        if (schema == null || schema.hasColumn(name)) {
            return escapeIdentifier(name);
        }
        return schema.firstMapColumn()
                .map(map -> escapeIdentifier(map.getName()) + "['" + escapeString(name) + "'] AS " + escapeIdentifier(name))
                .orElseGet(() -> escapeIdentifier(name));
    }

    /**
     * Column expression for a nested field, chosen by the base column's type
     */
    private static String nestedAccess(FieldPath field, Optional<ColumnInfo> column) {
        String base = escapeIdentifier(field.getBase());
        if (column.isPresent() && column.get().isMapType()) {
            String key = field.getPath().stream()
                    .map(ClickHouseSqlGenerator::escapeString)
                    .collect(Collectors.joining("."));
            return base + "['" + key + "']";
        }

        // JSON, String and unknown columns all go through JSON extraction
        if (column.isPresent() && !column.get().isJsonType() && !column.get().isStringType()) {
            logger.debug("Column {} has type {}, extracting '{}' as JSON anyway",
                    field.getBase(), column.get().getType(), field.toDottedString());
        }
        String segments = field.getPath().stream()
                .map(segment -> "'" + escapeString(segment) + "'")
                .collect(Collectors.joining(", "));
        return "JSONExtractString(" + base + ", " + segments + ")";
    }

    private static Optional<ColumnInfo> columnOf(Schema schema, String name) {
        return schema == null ? Optional.empty() : schema.findColumn(name);
    }

    /**
     * Wrap in backticks, doubling embedded backticks
     */
    public static String escapeIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Escape a string for use inside single quotes: backslash first, then the quote,
     * then NUL, CR and LF.
     */
    public static String escapeString(String value) {
        return value.replace("\\", "\\\\")
                .replace("'", "''")
                .replace("\0", "\\0")
                .replace("\r", "\\r")
                .replace("\n", "\\n");
    }

    static String formatValue(Value value) {
        return switch (value.getKind()) {
            case STRING, BARE_WORD -> "'" + escapeString(value.getText()) + "'";
            case NUMBER -> Value.formatNumber(value.getNumber());
            case BOOLEAN -> value.getBoolean() ? "1" : "0";
            case NULL -> "NULL";
        };
    }

    static String comparison(String column, Operator operator, String value) {
        return switch (operator) {
            case REGEX -> "positionCaseInsensitive(" + column + ", " + value + ") > 0";
            case NOT_REGEX -> "positionCaseInsensitive(" + column + ", " + value + ") = 0";
            case EQUALS, NOT_EQUALS, GREATER_THAN, LESS_THAN, GREATER_OR_EQUAL, LESS_OR_EQUAL ->
                    column + " " + operator.getSymbol() + " " + value;
        };
    }

    /**
     * Visitor bound to the schema of a single generate call
     */
    private static final class SqlVisitor implements NodeVisitor<String> {

        private final Schema schema;

        private SqlVisitor(Schema schema) {
            this.schema = schema;
        }

        @Override
        public String visitExpression(ExpressionNode node) {
            FieldPath field = node.getField();
            String column = field.isNested()
                    ? nestedAccess(field, columnOf(schema, field.getBase()))
                    : escapeIdentifier(field.getBase());
            return comparison(column, node.getOperator(), formatValue(node.getValue()));
        }

        @Override
        public String visitLogical(LogicalNode node) {
            List<String> conditions = new ArrayList<>();
            for (Node child : node.getChildren()) {
                String sql = child.accept(this);
                if (!sql.isEmpty()) {
                    conditions.add(sql);
                }
            }
            if (conditions.size() == 1) {
                return conditions.get(0);
            }
            return conditions.stream()
                    .map(condition -> "(" + condition + ")")
                    .collect(Collectors.joining(" " + node.getOperator().name() + " "));
        }

        @Override
        public String visitGroup(GroupNode node) {
            return node.getChild().accept(this);
        }

        @Override
        public String visitQuery(QueryNode node) {
            return node.getWhere().map(where -> where.accept(this)).orElse("");
        }
    }
}
