package com.logchef.logchefql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits LogchefQL text into a flat token stream.
 *
 * Single left-to-right scan without backtracking. Scanning is lenient: characters the
 * lexer does not recognise are absorbed into the surrounding key or value and left to
 * the parser to reject. The only lexical error is an unterminated string literal, and
 * even then the partial token is emitted (flagged incomplete) so later stages still see
 * a complete stream.
 *
 * Instances hold no state; all scan state lives in a {@link Scan} created per call.
 */
public class QueryLexer {

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(\\.\\d+)?");

    private static final int PREVIEW_LENGTH = 20;

    public TokenizeResult tokenize(String input) {
        Scan scan = new Scan(input == null ? "" : input);
        while (!scan.atEnd()) {
            scanNext(scan);
        }
        return new TokenizeResult(scan.tokens, scan.errors);
    }

    private void scanNext(Scan scan) {
        char c = scan.peek();

        if (Character.isWhitespace(c)) {
            scan.advance();
            return;
        }

        if (c == '(' || c == ')') {
            scan.emit(TokenType.PAREN, String.valueOf(c), scan.position());
            scan.advance();
            return;
        }

        if (c == '|') {
            scan.emit(TokenType.PIPE, "|", scan.position());
            scan.advance();
            return;
        }

        if (isOperatorChar(c)) {
            readOperator(scan);
            return;
        }

        if (Character.isLetter(c) && readBoolKeyword(scan)) {
            return;
        }

        boolean valuePosition = scan.lastTokenType() == TokenType.OPERATOR;
        if (isQuote(c)) {
            if (valuePosition) {
                readString(scan);
            } else {
                readKey(scan);
            }
            return;
        }

        if (valuePosition) {
            readBareValue(scan);
        } else {
            readKey(scan);
        }
    }

    /**
     * Operators are runs of operator characters; validity is checked by the parser
     */
    private void readOperator(Scan scan) {
        Position start = scan.position();
        StringBuilder text = new StringBuilder();
        while (!scan.atEnd() && isOperatorChar(scan.peek())) {
            text.append(scan.peek());
            scan.advance();
        }
        scan.emit(TokenType.OPERATOR, text.toString(), start);
    }

    /**
     * Emit {@code and}/{@code or} when the letter run at the cursor is one of them and sits
     * on word boundaries, so {@code order}, {@code android} or {@code sandbox} never match.
     */
    private boolean readBoolKeyword(Scan scan) {
        int start = scan.index;
        int end = start;
        while (end < scan.input.length() && Character.isLetter(scan.input.charAt(end))) {
            end++;
        }
        String word = scan.input.substring(start, end);
        if (!"and".equalsIgnoreCase(word) && !"or".equalsIgnoreCase(word)) {
            return false;
        }

        boolean boundaryBefore = start == 0 || isDelimiter(scan.input.charAt(start - 1));
        boolean boundaryAfter = end == scan.input.length() || isDelimiter(scan.input.charAt(end));
        if (!boundaryBefore || !boundaryAfter) {
            return false;
        }

        Position position = scan.position();
        for (int i = start; i < end; i++) {
            scan.advance();
        }
        scan.emit(TokenType.BOOL, word.toLowerCase(Locale.ROOT), position);
        return true;
    }

    /**
     * Quoted string literal in value position. Escapes are resolved here.
     */
    private void readString(Scan scan) {
        Position start = scan.position();
        char delimiter = scan.peek();
        scan.advance();

        StringBuilder text = new StringBuilder();
        while (!scan.atEnd()) {
            char c = scan.peek();
            if (c == '\\') {
                scan.advance();
                if (scan.atEnd()) {
                    break;
                }
                text.append(unescape(scan.peek()));
                scan.advance();
                continue;
            }
            if (c == delimiter) {
                scan.advance();
                scan.emit(TokenType.VALUE, text.toString(), start, true, false);
                return;
            }
            text.append(c);
            scan.advance();
        }

        scan.errors.add(unterminated(delimiter, text.toString(), start));
        scan.emit(TokenType.VALUE, text.toString(), start, true, true);
    }

    /**
     * A field name, possibly a dotted path with quoted segments such as
     * {@code log.attributes."foo bar"}. The raw text, quotes included, is kept on the token.
     */
    private void readKey(Scan scan) {
        Position start = scan.position();
        StringBuilder text = new StringBuilder();
        boolean quoted = false;

        while (!scan.atEnd()) {
            char c = scan.peek();
            if (isQuote(c)) {
                quoted = true;
                Position segmentStart = scan.position();
                int segmentOffset = text.length();
                if (!readQuotedSegment(scan, text)) {
                    scan.errors.add(unterminated(c, text.substring(segmentOffset + 1), segmentStart));
                    scan.emit(TokenType.KEY, text.toString(), start, true, true);
                    return;
                }
                continue;
            }
            if (isDelimiter(c)) {
                break;
            }
            text.append(c);
            scan.advance();
        }

        String raw = text.toString();
        TokenType type = !quoted && NUMBER.matcher(raw).matches() ? TokenType.NUMBER : TokenType.KEY;
        scan.emit(type, raw, start, quoted, false);
    }

    /**
     * Copy a quoted path segment verbatim, quotes and escapes included.
     *
     * @return false when the input ends before the closing quote
     */
    private boolean readQuotedSegment(Scan scan, StringBuilder text) {
        char delimiter = scan.peek();
        text.append(delimiter);
        scan.advance();
        while (!scan.atEnd()) {
            char c = scan.peek();
            text.append(c);
            scan.advance();
            if (c == '\\' && !scan.atEnd()) {
                text.append(scan.peek());
                scan.advance();
            } else if (c == delimiter) {
                return true;
            }
        }
        return false;
    }

    /**
     * Unquoted literal after an operator: numbers become NUMBER tokens, anything else a bare VALUE
     */
    private void readBareValue(Scan scan) {
        Position start = scan.position();
        StringBuilder text = new StringBuilder();
        while (!scan.atEnd() && !isDelimiter(scan.peek())) {
            text.append(scan.peek());
            scan.advance();
        }
        String raw = text.toString();
        TokenType type = NUMBER.matcher(raw).matches() ? TokenType.NUMBER : TokenType.VALUE;
        scan.emit(type, raw, start);
    }

    private ParseError unterminated(char delimiter, String partial, Position position) {
        String preview = partial.length() > PREVIEW_LENGTH
                ? partial.substring(0, PREVIEW_LENGTH) + "..."
                : partial;
        return new ParseError(ErrorCode.UNTERMINATED_STRING,
                "Unterminated string literal starting with " + delimiter + preview + delimiter
                        + ". Missing closing quote.",
                position);
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }

    static boolean isOperatorChar(char c) {
        return c == '=' || c == '!' || c == '~' || c == '>' || c == '<';
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || isOperatorChar(c) || c == '(' || c == ')' || c == '|';
    }

    /**
     * Per-call scan state: cursor, line/column bookkeeping and the accumulated output
     */
    private static final class Scan {
        private final String input;
        private final List<Token> tokens = new ArrayList<>();
        private final List<ParseError> errors = new ArrayList<>();
        private int index;
        private int line = 1;
        private int column = 1;

        private Scan(String input) {
            this.input = input;
        }

        boolean atEnd() {
            return index >= input.length();
        }

        char peek() {
            return input.charAt(index);
        }

        void advance() {
            if (input.charAt(index) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            index++;
        }

        Position position() {
            return new Position(line, column);
        }

        TokenType lastTokenType() {
            return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1).getType();
        }

        void emit(TokenType type, String value, Position position) {
            emit(type, value, position, false, false);
        }

        void emit(TokenType type, String value, Position position, boolean quoted, boolean incomplete) {
            tokens.add(new Token(type, value, position, quoted, incomplete));
        }
    }
}
