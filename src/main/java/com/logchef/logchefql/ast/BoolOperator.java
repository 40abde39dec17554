package com.logchef.logchefql.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * Boolean operators combining conditions. AND binds tighter than OR.
 */
public enum BoolOperator {
    AND("and"),
    OR("or");

    private final String keyword;

    BoolOperator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static Optional<BoolOperator> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "and" -> Optional.of(AND);
            case "or" -> Optional.of(OR);
            default -> Optional.empty();
        };
    }
}
