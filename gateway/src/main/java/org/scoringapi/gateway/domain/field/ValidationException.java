package org.scoringapi.gateway.domain.field;

import java.util.Objects;

/**
 * Raised by a {@link Field} when a value violates its contract.
 * The message is returned to the caller as-is.
 */
public final class ValidationException extends Exception {

    /**
     * Why a value was rejected.
     */
    public enum Reason {
        MISSING_REQUIRED_FIELD,
        EMPTY_NOT_ALLOWED,
        WRONG_TYPE,
        BAD_FORMAT,
        BAD_DATE_FORMAT,
        AGE_LIMIT_EXCEEDED,
        INVALID_LIST_ELEMENT
    }

    private final String fieldName;
    private final Reason reason;

    public ValidationException(String fieldName, Reason reason, String message) {
        super(message);
        this.fieldName = fieldName;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Name of the offending attribute, or {@code null} when the field was validated standalone.
     */
    public String getFieldName() {
        return fieldName;
    }

    public Reason getReason() {
        return reason;
    }
}
