package org.scoringapi.gateway.domain.field;

import java.math.BigInteger;
import java.util.List;

/**
 * List of integer client ids, each within the signed 64-bit range. Its empty form is {@code []}.
 */
public final class ClientIdsField extends Field {

    public ClientIdsField(boolean required, boolean nullable) {
        super(required, nullable);
    }

    @Override
    public boolean isEmpty(Object value) {
        return value == null || (value instanceof List && ((List<?>) value).isEmpty());
    }

    @Override
    protected void check(String name, Object value) throws ValidationException {
        if (!(value instanceof List)) {
            throw failure(name, ValidationException.Reason.WRONG_TYPE, "should be a list");
        }
        for (Object item : (List<?>) value) {
            if (!isIntegral(item) || (item instanceof BigInteger && ((BigInteger) item).bitLength() > 63)) {
                throw failure(name, ValidationException.Reason.INVALID_LIST_ELEMENT,
                        "should be a list of integers, got " + item);
            }
        }
    }
}
