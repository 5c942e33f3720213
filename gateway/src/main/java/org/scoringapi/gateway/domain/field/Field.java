package org.scoringapi.gateway.domain.field;

import java.math.BigInteger;

/**
 * Base class for all field descriptors.
 *
 * A descriptor is immutable configuration: a {@code required} flag (the key must be
 * present, even if its value is null) and a {@code nullable} flag (the value may be
 * the empty form for its kind). Subclasses add a type or format rule by overriding
 * {@link #check(String, Object)} and, where their empty form differs from plain
 * {@code null}, {@link #isEmpty(Object)}.
 *
 * Validation order:
 * <ol>
 *   <li>required and unset: {@link ValidationException.Reason#MISSING_REQUIRED_FIELD}</li>
 *   <li>unset: accepted, nothing else runs</li>
 *   <li>empty: {@link ValidationException.Reason#EMPTY_NOT_ALLOWED} unless nullable, otherwise accepted</li>
 *   <li>the kind-specific rule</li>
 * </ol>
 */
public abstract class Field {

    /**
     * Value of an attribute whose key was absent from the input. Distinct from an explicit {@code null}.
     */
    public static final Object UNSET = new Object() {
        @Override
        public String toString() {
            return "UNSET";
        }
    };

    private final boolean required;
    private final boolean nullable;

    protected Field(boolean required, boolean nullable) {
        this.required = required;
        this.nullable = nullable;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * Validate a standalone value.
     */
    public final Object validate(Object value) throws ValidationException {
        return validate(null, value);
    }

    /**
     * Validate the value of the named attribute and return it unchanged.
     *
     * @param name  attribute name used in error messages, may be null
     * @param value raw value, {@link #UNSET} when the key was absent
     */
    public final Object validate(String name, Object value) throws ValidationException {
        if (value == UNSET) {
            if (required) {
                throw new ValidationException(name, ValidationException.Reason.MISSING_REQUIRED_FIELD,
                        label(name) + " is required");
            }
            return value;
        }
        if (isEmpty(value)) {
            if (!nullable) {
                throw new ValidationException(name, ValidationException.Reason.EMPTY_NOT_ALLOWED,
                        label(name) + " should not be empty");
            }
            return value;
        }
        check(name, value);
        return value;
    }

    /**
     * Whether the value is the canonical empty form for this kind of field.
     * Null is empty for every kind.
     */
    public boolean isEmpty(Object value) {
        return value == null;
    }

    /**
     * Kind-specific rule, called only for present, non-empty values.
     */
    protected abstract void check(String name, Object value) throws ValidationException;

    protected static String label(String name) {
        return name == null ? "The value" : "The field '" + name + "'";
    }

    protected static ValidationException failure(String name, ValidationException.Reason reason, String detail) {
        return new ValidationException(name, reason, label(name) + " " + detail);
    }

    /**
     * Whether the value is a JSON integer as produced by Jackson. Booleans and
     * floating point numbers are not integers.
     */
    protected static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{required=" + required + ", nullable=" + nullable + '}';
    }
}
