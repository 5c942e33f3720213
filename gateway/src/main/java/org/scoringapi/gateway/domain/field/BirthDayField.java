package org.scoringapi.gateway.domain.field;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Birth date no more than {@value #AGE_LIMIT} whole years ago.
 */
public final class BirthDayField extends DateField {

    public static final int AGE_LIMIT = 70;

    public BirthDayField(boolean required, boolean nullable) {
        super(required, nullable);
    }

    public BirthDayField(boolean required, boolean nullable, Clock clock) {
        super(required, nullable, clock);
    }

    @Override
    protected void checkDate(String name, LocalDate birthday) throws ValidationException {
        if (age(birthday, LocalDate.now(getClock())) > AGE_LIMIT) {
            throw failure(name, ValidationException.Reason.AGE_LIMIT_EXCEEDED,
                    "should be no older than " + AGE_LIMIT + " years");
        }
    }

    /**
     * Whole years between the two dates; the current year counts only once the
     * birthday has been reached.
     */
    static int age(LocalDate birthday, LocalDate today) {
        int years = today.getYear() - birthday.getYear();
        if (today.getMonthValue() < birthday.getMonthValue()
                || (today.getMonthValue() == birthday.getMonthValue()
                && today.getDayOfMonth() < birthday.getDayOfMonth())) {
            years--;
        }
        return years;
    }
}
