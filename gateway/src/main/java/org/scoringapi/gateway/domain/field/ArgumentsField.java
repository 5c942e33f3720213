package org.scoringapi.gateway.domain.field;

import java.util.Map;

/**
 * Key-value mapping field, used for the method arguments. Its empty form is {@code {}}.
 */
public final class ArgumentsField extends Field {

    public ArgumentsField(boolean required, boolean nullable) {
        super(required, nullable);
    }

    @Override
    public boolean isEmpty(Object value) {
        return value == null || (value instanceof Map && ((Map<?, ?>) value).isEmpty());
    }

    @Override
    protected void check(String name, Object value) throws ValidationException {
        if (!(value instanceof Map)) {
            throw failure(name, ValidationException.Reason.WRONG_TYPE, "should be an object");
        }
    }
}
