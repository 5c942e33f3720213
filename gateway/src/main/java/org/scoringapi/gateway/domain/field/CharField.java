package org.scoringapi.gateway.domain.field;

/**
 * Text field. Its empty form is {@code ""}.
 */
public class CharField extends Field {

    public CharField(boolean required, boolean nullable) {
        super(required, nullable);
    }

    @Override
    public boolean isEmpty(Object value) {
        return value == null || "".equals(value);
    }

    @Override
    protected void check(String name, Object value) throws ValidationException {
        if (!(value instanceof String)) {
            throw failure(name, ValidationException.Reason.WRONG_TYPE, "should be a string");
        }
    }
}
