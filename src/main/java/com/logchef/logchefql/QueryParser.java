package com.logchef.logchefql;

import com.logchef.logchefql.ast.BoolOperator;
import com.logchef.logchefql.ast.ExpressionNode;
import com.logchef.logchefql.ast.FieldPath;
import com.logchef.logchefql.ast.GroupNode;
import com.logchef.logchefql.ast.LogicalNode;
import com.logchef.logchefql.ast.Node;
import com.logchef.logchefql.ast.Operator;
import com.logchef.logchefql.ast.QueryNode;
import com.logchef.logchefql.ast.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recursive descent parser for LogchefQL.
 *
 * <pre>
 * Query      := Or? ( '|' FieldPath+ )?
 * Or         := And ( 'or' And )*
 * And        := Term ( 'and' Term )*
 * Term       := '(' Or ')' | Comparison
 * Comparison := FieldPath Operator Value
 * </pre>
 *
 * AND binds tighter than OR; runs of the same operator fold into one N-ary
 * {@link LogicalNode}. Parsing stops at the first error. Groups nest at most
 * {@value #MAX_NESTING_DEPTH} levels deep.
 */
public class QueryParser {

    static final int MAX_NESTING_DEPTH = 128;

    public ParseResult parse(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return ParseResult.empty();
        }

        ParseError missingOperator = detectMissingBooleanOperator(tokens);
        if (missingOperator != null) {
            return ParseResult.failure(missingOperator);
        }

        int pipeIndex = indexOfPipe(tokens);
        if (pipeIndex < 0) {
            return parseFilter(tokens);
        }

        List<Token> whereTokens = tokens.subList(0, pipeIndex);
        List<Token> selectTokens = tokens.subList(pipeIndex + 1, tokens.size());

        Node where = null;
        if (!whereTokens.isEmpty()) {
            ParseResult whereResult = parseFilter(whereTokens);
            if (!whereResult.isSuccess()) {
                return whereResult;
            }
            where = whereResult.getAst().orElse(null);
        }

        List<FieldPath> select = new ArrayList<>();
        ParseError selectError = parseSelectFields(tokens.get(pipeIndex), selectTokens, select);
        if (selectError != null) {
            return ParseResult.failure(selectError);
        }
        return ParseResult.success(new QueryNode(where, select));
    }

    /**
     * Find {@code key op value key} with no boolean keyword in between. Parentheses after
     * the value are skipped once a group has closed, so {@code (a="1") (b="2")} is reported
     * the same way while {@code a="1" (b="2")} is left to the trailing-token check.
     *
     * @return the error naming both fields, or null when every pair is joined
     */
    public ParseError detectMissingBooleanOperator(List<Token> tokens) {
        for (int i = 0; i + 3 < tokens.size(); i++) {
            Token key = tokens.get(i);
            Token operator = tokens.get(i + 1);
            Token value = tokens.get(i + 2);
            if (key.getType() != TokenType.KEY
                    || operator.getType() != TokenType.OPERATOR
                    || !isValueToken(value)) {
                continue;
            }

            int next = i + 3;
            boolean groupClosed = false;
            while (next < tokens.size() && tokens.get(next).getType() == TokenType.PAREN) {
                groupClosed |= tokens.get(next).is(TokenType.PAREN, ")");
                next++;
            }
            boolean adjacent = next == i + 3 || groupClosed;
            if (adjacent && next < tokens.size() && tokens.get(next).getType() == TokenType.KEY) {
                Token nextKey = tokens.get(next);
                return new ParseError(ErrorCode.MISSING_BOOLEAN_OPERATOR,
                        "Missing boolean operator (and/or) between conditions: '"
                                + key.getValue() + "' and '" + nextKey.getValue() + "'",
                        nextKey.getPosition());
            }
        }
        return null;
    }

    private ParseResult parseFilter(List<Token> tokens) {
        Cursor cursor = new Cursor(tokens);
        Node ast = parseOr(cursor);
        if (cursor.error != null) {
            return ParseResult.failure(cursor.error);
        }

        if (!cursor.atEnd()) {
            Token trailing = cursor.peek();
            return ParseResult.failure(new ParseError(ErrorCode.UNEXPECTED_TOKEN,
                    "Unexpected token '" + trailing.getValue() + "' after complete expression",
                    trailing.getPosition()));
        }
        return ParseResult.success(ast);
    }

    private Node parseOr(Cursor cursor) {
        return parseLevel(cursor, BoolOperator.OR);
    }

    private Node parseAnd(Cursor cursor) {
        return parseLevel(cursor, BoolOperator.AND);
    }

    /**
     * Parse operands of one precedence level separated by its keyword. Operands come from
     * the next tighter level: AND terms for OR, comparisons and groups for AND.
     */
    private Node parseLevel(Cursor cursor, BoolOperator operator) {
        List<Node> operands = new ArrayList<>();
        Node first = parseOperand(cursor, operator);
        if (first == null) {
            return null;
        }
        operands.add(first);

        while (!cursor.atEnd() && cursor.peek().getType() == TokenType.BOOL) {
            Token keyword = cursor.peek();
            Optional<BoolOperator> parsed = BoolOperator.fromKeyword(keyword.getValue());
            // The lexer only emits and/or, but parse() also takes caller-built token lists
            if (parsed.isEmpty()) {
                cursor.fail(new ParseError(ErrorCode.UNKNOWN_BOOLEAN_OPERATOR,
                        "Unknown boolean operator: " + keyword.getValue(), keyword.getPosition()));
                return null;
            }
            if (parsed.get() != operator) {
                break;
            }
            cursor.next();

            Node operand = parseOperand(cursor, operator);
            if (operand == null) {
                return null;
            }
            operands.add(operand);
        }

        return LogicalNode.of(operator, operands);
    }

    private Node parseOperand(Cursor cursor, BoolOperator level) {
        return level == BoolOperator.OR ? parseAnd(cursor) : parseTerm(cursor);
    }

    private Node parseTerm(Cursor cursor) {
        if (cursor.atEnd()) {
            cursor.fail(unexpectedEnd(cursor, "Unexpected end of query, expected a condition"));
            return null;
        }

        Token token = cursor.peek();
        if (token.is(TokenType.PAREN, "(")) {
            return parseGroup(cursor);
        }
        if (token.getType() == TokenType.KEY) {
            return parseComparison(cursor);
        }

        cursor.fail(new ParseError(ErrorCode.UNEXPECTED_TOKEN,
                "Unexpected token: " + token.getValue(), token.getPosition()));
        return null;
    }

    private Node parseGroup(Cursor cursor) {
        Token open = cursor.next();
        if (++cursor.depth > MAX_NESTING_DEPTH) {
            cursor.fail(new ParseError(ErrorCode.UNEXPECTED_TOKEN,
                    "Parentheses nested deeper than " + MAX_NESTING_DEPTH + " levels",
                    open.getPosition()));
            return null;
        }
        Node inner = parseOr(cursor);
        if (inner == null) {
            return null;
        }

        if (cursor.atEnd() || !cursor.peek().is(TokenType.PAREN, ")")) {
            Position position = cursor.atEnd() ? cursor.endPosition() : cursor.peek().getPosition();
            cursor.fail(new ParseError(ErrorCode.EXPECTED_CLOSING_PAREN,
                    "Expected closing parenthesis for '(' at " + open.getPosition(), position));
            return null;
        }
        cursor.next();
        cursor.depth--;
        return new GroupNode(inner);
    }

    private Node parseComparison(Cursor cursor) {
        Token keyToken = cursor.next();
        FieldPath field = FieldPath.parse(keyToken.getValue());

        if (cursor.atEnd()) {
            cursor.fail(unexpectedEnd(cursor, "Unexpected end of query, expected operator after '" + keyToken.getValue() + "'"));
            return null;
        }
        Token operatorToken = cursor.next();
        if (operatorToken.getType() != TokenType.OPERATOR) {
            cursor.fail(new ParseError(ErrorCode.EXPECTED_OPERATOR,
                    "Expected operator after field name '" + keyToken.getValue() + "'",
                    operatorToken.getPosition()));
            return null;
        }
        Optional<Operator> operator = Operator.fromSymbol(operatorToken.getValue());
        if (operator.isEmpty()) {
            cursor.fail(new ParseError(ErrorCode.UNKNOWN_OPERATOR,
                    "Unknown operator: " + operatorToken.getValue(), operatorToken.getPosition()));
            return null;
        }

        if (cursor.atEnd()) {
            cursor.fail(unexpectedEnd(cursor, "Unexpected end of query, expected value after '" + operatorToken.getValue() + "'"));
            return null;
        }
        Token valueToken = cursor.next();
        if (!isValueToken(valueToken)) {
            cursor.fail(new ParseError(ErrorCode.EXPECTED_VALUE,
                    "Expected value after operator '" + operatorToken.getValue() + "'",
                    valueToken.getPosition()));
            return null;
        }

        return new ExpressionNode(field, operator.get(), toValue(valueToken), valueToken.isQuoted());
    }

    private ParseError parseSelectFields(Token pipe, List<Token> tokens, List<FieldPath> select) {
        if (tokens.isEmpty()) {
            Position after = new Position(pipe.getPosition().getLine(), pipe.getPosition().getColumn() + 1);
            return new ParseError(ErrorCode.UNEXPECTED_END,
                    "Expected at least one field name after '|'", after);
        }
        for (Token token : tokens) {
            if (token.getType() != TokenType.KEY) {
                return new ParseError(ErrorCode.UNEXPECTED_TOKEN,
                        "Expected field name after '|', got '" + token.getValue() + "'",
                        token.getPosition());
            }
            select.add(FieldPath.parse(token.getValue()));
        }
        return null;
    }

    /**
     * Quoted literals stay strings; lexer-typed numbers become numbers; bare
     * {@code true}, {@code false} and {@code null} become typed literals.
     */
    private Value toValue(Token token) {
        if (token.isQuoted()) {
            return Value.string(token.getValue());
        }
        if (token.getType() == TokenType.NUMBER) {
            return Value.number(Double.parseDouble(token.getValue()));
        }
        return switch (token.getValue().toLowerCase(Locale.ROOT)) {
            case "true" -> Value.bool(true);
            case "false" -> Value.bool(false);
            case "null" -> Value.nullValue();
            default -> Value.bareWord(token.getValue());
        };
    }

    private ParseError unexpectedEnd(Cursor cursor, String message) {
        return new ParseError(ErrorCode.UNEXPECTED_END, message, cursor.endPosition());
    }

    private static boolean isValueToken(Token token) {
        TokenType type = token.getType();
        return type == TokenType.VALUE || type == TokenType.NUMBER || type == TokenType.KEY;
    }

    private static int indexOfPipe(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).getType() == TokenType.PIPE) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Per-call position in the token list and the first error seen
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int position;
        private int depth;
        private ParseError error;

        private Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean atEnd() {
            return position >= tokens.size();
        }

        Token peek() {
            return tokens.get(position);
        }

        Token next() {
            return tokens.get(position++);
        }

        void fail(ParseError parseError) {
            if (error == null) {
                error = parseError;
            }
        }

        /**
         * Position just past the last token
         */
        Position endPosition() {
            if (tokens.isEmpty()) {
                return new Position(1, 1);
            }
            Token last = tokens.get(tokens.size() - 1);
            return new Position(last.getPosition().getLine(),
                    last.getPosition().getColumn() + last.getValue().length());
        }
    }
}
