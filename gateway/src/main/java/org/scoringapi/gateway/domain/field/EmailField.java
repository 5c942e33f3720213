package org.scoringapi.gateway.domain.field;

public final class EmailField extends CharField {

    public EmailField(boolean required, boolean nullable) {
        super(required, nullable);
    }

    @Override
    protected void check(String name, Object value) throws ValidationException {
        super.check(name, value);
        if (((String) value).indexOf('@') < 0) {
            throw failure(name, ValidationException.Reason.BAD_FORMAT, "should be a correct email");
        }
    }
}
