package org.scoringapi.gateway.domain.field;

/**
 * Phone number given as text or as an integer: 11 characters, starting with 7.
 */
public final class PhoneField extends Field {

    static final int LENGTH = 11;

    public PhoneField(boolean required, boolean nullable) {
        super(required, nullable);
    }

    @Override
    public boolean isEmpty(Object value) {
        return value == null || "".equals(value);
    }

    @Override
    protected void check(String name, Object value) throws ValidationException {
        if (!(value instanceof String) && !isIntegral(value)) {
            throw failure(name, ValidationException.Reason.WRONG_TYPE, "should be a string or an integer");
        }
        String digits = value.toString();
        if (digits.charAt(0) != '7') {
            throw failure(name, ValidationException.Reason.BAD_FORMAT, "should start with 7");
        }
        if (digits.length() != LENGTH) {
            throw failure(name, ValidationException.Reason.BAD_FORMAT, "should consist of " + LENGTH + " digits");
        }
    }
}
