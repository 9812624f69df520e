package com.duckmart.segment.filter;

import java.util.Locale;
import java.util.Optional;

/**
 * Combinator joining the attribute predicate group and the event predicate group.
 */
public enum LogicOperator {
    AND,
    OR;

    /**
     * Resolves a combinator name, ignoring case.
     *
     * @param name "AND" or "OR"
     * @return the operator, or empty if the name is unknown
     */
    public static Optional<LogicOperator> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "AND" -> Optional.of(AND);
            case "OR" -> Optional.of(OR);
            default -> Optional.empty();
        };
    }
}
