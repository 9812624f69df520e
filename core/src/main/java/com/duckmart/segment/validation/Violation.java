package com.duckmart.segment.validation;

/**
 * One reason a segmentation request was rejected.
 *
 * @param path location in the request, e.g. {@code user_filters[1]} or {@code limit}
 * @param field the field or event name involved, or null
 * @param operator the operator involved, or null
 * @param value the offending value rendered as text, or null
 * @param reason what is wrong
 */
public record Violation(String path, String field, String operator, String value, String reason) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(path).append(": ").append(reason);
        StringBuilder details = new StringBuilder();
        if (field != null) {
            details.append("field=").append(field);
        }
        if (operator != null) {
            details.append(details.length() > 0 ? ", " : "").append("operator=").append(operator);
        }
        if (value != null) {
            details.append(details.length() > 0 ? ", " : "").append("value=").append(value);
        }
        if (details.length() > 0) {
            sb.append(" (").append(details).append(')');
        }
        return sb.toString();
    }
}
