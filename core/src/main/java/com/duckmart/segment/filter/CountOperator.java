package com.duckmart.segment.filter;

import java.util.Optional;

/**
 * Operators comparing a per-user event count against a threshold.
 */
public enum CountOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte");

    private final String code;

    CountOperator(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<CountOperator> fromCode(String code) {
        for (CountOperator op : values()) {
            if (op.code.equals(code)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluates this operator on plain numbers.
     *
     * @param actual the observed count
     * @param threshold the requested count
     * @return the comparison result
     */
    public boolean test(long actual, long threshold) {
        return switch (this) {
            case EQ -> actual == threshold;
            case NE -> actual != threshold;
            case GT -> actual > threshold;
            case GTE -> actual >= threshold;
            case LT -> actual < threshold;
            case LTE -> actual <= threshold;
        };
    }
}
