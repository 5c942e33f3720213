package org.scoringapi.gateway.domain.field;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;

/**
 * Date given as text in {@code DD.MM.YYYY} form.
 */
public class DateField extends CharField {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("dd.MM.uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    public DateField(boolean required, boolean nullable) {
        this(required, nullable, Clock.systemDefaultZone());
    }

    public DateField(boolean required, boolean nullable, Clock clock) {
        super(required, nullable);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Parse a value that already passed validation.
     */
    public static LocalDate parse(String value) {
        return LocalDate.parse(value, FORMAT);
    }

    protected Clock getClock() {
        return clock;
    }

    @Override
    protected void check(String name, Object value) throws ValidationException {
        super.check(name, value);
        LocalDate date;
        try {
            date = parse((String) value);
        } catch (DateTimeParseException e) {
            throw failure(name, ValidationException.Reason.BAD_DATE_FORMAT, "is not a date in format DD.MM.YYYY");
        }
        checkDate(name, date);
    }

    /**
     * Further rule on a well-formed date.
     */
    protected void checkDate(String name, LocalDate date) throws ValidationException {
    }
}
