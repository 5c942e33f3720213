package org.scoringapi.gateway.domain.field;

import java.util.Map;

/**
 * Integer gender code: 0 unknown, 1 male, 2 female.
 */
public final class GenderField extends Field {

    public static final int UNKNOWN = 0;
    public static final int MALE = 1;
    public static final int FEMALE = 2;

    public static final Map<Integer, String> GENDERS = Map.of(
            UNKNOWN, "unknown",
            MALE, "male",
            FEMALE, "female");

    public GenderField(boolean required, boolean nullable) {
        super(required, nullable);
    }

    /**
     * Whether the value is one of the known gender codes.
     */
    public static boolean isKnown(Object value) {
        if (!isIntegral(value)) {
            return false;
        }
        try {
            return GENDERS.containsKey(Integer.valueOf(value.toString()));
        } catch (NumberFormatException e) {
            // wider than int
            return false;
        }
    }

    @Override
    protected void check(String name, Object value) throws ValidationException {
        if (!isIntegral(value)) {
            throw failure(name, ValidationException.Reason.WRONG_TYPE, "should be an integer");
        }
        if (!isKnown(value)) {
            throw failure(name, ValidationException.Reason.BAD_FORMAT, "takes the values 0, 1 or 2");
        }
    }
}
