package com.duckmart.segment.exception;

import com.duckmart.segment.validation.Violation;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a segmentation request is rejected before compilation.
 *
 * <p>Carries every {@link Violation} found, in request order, so a caller can fix
 * all of them in one round trip. The message names the first one.
 *
 * @see com.duckmart.segment.validation.RequestValidator
 */
public class ValidationException extends RuntimeException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Returns the violations, at least one.
     *
     * @return the violations
     */
    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * Returns all violations, one per line.
     *
     * @return the detailed message
     */
    public String getTechnicalMessage() {
        return violations.stream()
            .map(Violation::toString)
            .collect(Collectors.joining("\n", "Segmentation request rejected\n", ""));
    }

    private static String describe(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations must not be empty");
        }
        String first = violations.get(0).toString();
        if (violations.size() == 1) {
            return "Invalid segmentation request: " + first;
        }
        return "Invalid segmentation request: " + first
            + " (and " + (violations.size() - 1) + " more)";
    }
}
