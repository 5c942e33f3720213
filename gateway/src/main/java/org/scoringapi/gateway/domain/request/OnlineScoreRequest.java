package org.scoringapi.gateway.domain.request;

import org.scoringapi.gateway.domain.field.BirthDayField;
import org.scoringapi.gateway.domain.field.CharField;
import org.scoringapi.gateway.domain.field.DateField;
import org.scoringapi.gateway.domain.field.EmailField;
import org.scoringapi.gateway.domain.field.GenderField;
import org.scoringapi.gateway.domain.field.PhoneField;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

/**
 * Arguments of the {@code online_score} method.
 */
public final class OnlineScoreRequest extends Request {

    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String BIRTHDAY = "birthday";
    public static final String GENDER = "gender";

    public static final Schema SCHEMA = schema(Clock.systemDefaultZone());

    public OnlineScoreRequest(Map<String, ?> raw) {
        this(SCHEMA, raw);
    }

    /**
     * Use a schema built by {@link #schema(Clock)}.
     */
    public OnlineScoreRequest(Schema schema, Map<String, ?> raw) {
        super(schema, raw);
    }

    /**
     * Schema whose birthday check measures age against the given clock.
     */
    public static Schema schema(Clock clock) {
        return Schema.builder("OnlineScoreRequest")
                .field(FIRST_NAME, new CharField(false, true))
                .field(LAST_NAME, new CharField(false, true))
                .field(EMAIL, new EmailField(false, true))
                .field(PHONE, new PhoneField(false, true))
                .field(BIRTHDAY, new BirthDayField(false, true, clock))
                .field(GENDER, new GenderField(false, true))
                .build();
    }

    public String getFirstName() {
        return getText(FIRST_NAME);
    }

    public String getLastName() {
        return getText(LAST_NAME);
    }

    public String getEmail() {
        return getText(EMAIL);
    }

    /**
     * Phone as text, whether it was sent as a string or as a number.
     */
    public String getPhone() {
        Object value = getValue(PHONE);
        return value == null ? null : value.toString();
    }

    /**
     * Parsed birthday; only meaningful after {@link #validate()} succeeded.
     */
    public LocalDate getBirthday() {
        return isPresent(BIRTHDAY) ? DateField.parse(getText(BIRTHDAY)) : null;
    }

    public Integer getGender() {
        Object value = getValue(GENDER);
        return GenderField.isKnown(value) ? ((Number) value).intValue() : null;
    }

    /**
     * At least one informative pair is filled in: phone and email, first and
     * last name, or birthday and a known gender.
     */
    public boolean hasEnoughFields() {
        return (isPresent(PHONE) && isPresent(EMAIL))
                || (isPresent(FIRST_NAME) && isPresent(LAST_NAME))
                || (isPresent(BIRTHDAY) && GenderField.isKnown(getValue(GENDER)));
    }
}
