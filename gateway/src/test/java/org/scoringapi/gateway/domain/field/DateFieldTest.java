package org.scoringapi.gateway.domain.field;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateFieldTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2024-06-15T10:30:00Z"), ZoneOffset.UTC);

    @Nested
    class Date {
        private final DateField field = new DateField(false, true, NOW);

        @Test
        void acceptsDayMonthYear() throws Exception {
            assertThat(field.validate("01.01.2000")).isEqualTo("01.01.2000");
        }

        @Test
        void rejectsIsoFormat() {
            assertThatThrownBy(() -> field.validate("date", "2000-01-01"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("The field 'date' is not a date in format DD.MM.YYYY")
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.BAD_DATE_FORMAT);
        }

        @Test
        void rejectsImpossibleDate() {
            assertThatThrownBy(() -> field.validate("31.02.2000"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void rejectsNonText() {
            assertThatThrownBy(() -> field.validate(20000101))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.WRONG_TYPE);
        }
    }

    @Nested
    class BirthDay {
        private final BirthDayField field = new BirthDayField(false, true, NOW);

        @Test
        void exactlySeventyYearsPasses() {
            assertThatCode(() -> field.validate("15.06.1954")).doesNotThrowAnyException();
        }

        @Test
        void seventiethBirthdayTomorrowPasses() {
            assertThatCode(() -> field.validate("16.06.1954")).doesNotThrowAnyException();
        }

        @Test
        void ageIsCountedInWholeYears() {
            // turned 70 yesterday, still 70
            assertThatCode(() -> field.validate("14.06.1954")).doesNotThrowAnyException();
        }

        @Test
        void seventyOneYearsFails() {
            assertThatThrownBy(() -> field.validate("birthday", "15.06.1953"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("The field 'birthday' should be no older than 70 years")
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.AGE_LIMIT_EXCEEDED);
        }

        @Test
        void formatIsCheckedFirst() {
            assertThatThrownBy(() -> field.validate("1890-01-01"))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.BAD_DATE_FORMAT);
        }

        @Test
        void ageSubtractsYearBeforeBirthday() {
            LocalDate today = LocalDate.of(2024, 6, 15);
            assertThat(BirthDayField.age(LocalDate.of(2000, 6, 15), today)).isEqualTo(24);
            assertThat(BirthDayField.age(LocalDate.of(2000, 6, 16), today)).isEqualTo(23);
            assertThat(BirthDayField.age(LocalDate.of(2000, 7, 1), today)).isEqualTo(23);
            assertThat(BirthDayField.age(LocalDate.of(2000, 5, 31), today)).isEqualTo(24);
        }
    }
}
