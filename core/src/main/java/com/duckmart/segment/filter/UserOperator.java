package com.duckmart.segment.filter;

import java.util.Optional;

/**
 * Operators accepted by attribute filters.
 *
 * <p>Codes are the lowercase names used on the wire:
 * {@code eq, ne, gt, gte, lt, lte, in, not_in, like}.
 */
public enum UserOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("in"),
    NOT_IN("not_in"),
    LIKE("like");

    private final String code;

    UserOperator(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a wire code.
     *
     * @param code the operator code from a request (case-sensitive)
     * @return the operator, or empty if the code is unknown
     */
    public static Optional<UserOperator> fromCode(String code) {
        for (UserOperator op : values()) {
            if (op.code.equals(code)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns whether this operator takes a list of values.
     *
     * @return true for IN and NOT_IN
     */
    public boolean isSetMembership() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Returns whether this operator compares by order.
     *
     * @return true for GT, GTE, LT and LTE
     */
    public boolean isOrdering() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
