package com.logchef.logchefql;

import com.logchef.logchefql.ast.Node;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing: an AST (absent for empty input) or the errors that stopped the parse
 */
public final class ParseResult {

    private static final ParseResult EMPTY = new ParseResult(null, List.of());

    private final Node ast;
    private final List<ParseError> errors;

    private ParseResult(Node ast, List<ParseError> errors) {
        this.ast = ast;
        this.errors = List.copyOf(errors);
    }

    public static ParseResult empty() {
        return EMPTY;
    }

    public static ParseResult success(Node ast) {
        return new ParseResult(ast, List.of());
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, List.of(error));
    }

    public Optional<Node> getAst() {
        return Optional.ofNullable(ast);
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
