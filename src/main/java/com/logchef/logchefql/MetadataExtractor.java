package com.logchef.logchefql;

import com.logchef.logchefql.ast.FieldPath;
import com.logchef.logchefql.ast.Operator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts UI metadata from the token stream.
 *
 * Works on tokens rather than the AST so the result mirrors what the user typed,
 * independent of how the parser folds or groups conditions.
 */
@Component
public class MetadataExtractor {

    /**
     * Distinct base field names of all conditions, in order of first appearance.
     * {@code log_attributes.level} contributes {@code log_attributes}.
     */
    public List<String> extractFieldsUsed(List<Token> tokens) {
        Set<String> fields = new LinkedHashSet<>();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() == TokenType.KEY && tokens.get(i + 1).getType() == TokenType.OPERATOR) {
                String base = FieldPath.parse(token.getValue()).getBase();
                if (!base.isEmpty()) {
                    fields.add(base);
                }
            }
        }
        return new ArrayList<>(fields);
    }

    /**
     * Every {@code key operator value} triplet in sequence
     */
    public List<FilterCondition> extractConditions(List<Token> tokens) {
        List<FilterCondition> conditions = new ArrayList<>();
        int i = 0;
        while (i + 2 < tokens.size()) {
            Token key = tokens.get(i);
            Token operator = tokens.get(i + 1);
            Token value = tokens.get(i + 2);
            if (key.getType() == TokenType.KEY
                    && operator.getType() == TokenType.OPERATOR
                    && isValue(value)) {
                String symbol = operator.getValue();
                conditions.add(new FilterCondition(
                        FieldPath.parse(key.getValue()).toDottedString(),
                        symbol,
                        value.getValue(),
                        Operator.fromSymbol(symbol).map(Operator::isRegex).orElse(false)));
                i += 3;
            } else {
                i++;
            }
        }
        return conditions;
    }

    private static boolean isValue(Token token) {
        return token.getType() == TokenType.VALUE
                || token.getType() == TokenType.NUMBER
                || token.getType() == TokenType.KEY;
    }
}
