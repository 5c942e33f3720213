package org.scoringapi.gateway.domain.field;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhoneFieldTest {

    private final PhoneField field = new PhoneField(false, true);

    @Test
    void acceptsElevenDigitsStartingWithSeven() throws Exception {
        assertThat(field.validate("79161234567")).isEqualTo("79161234567");
    }

    @Test
    void acceptsIntegerForm() throws Exception {
        assertThat(field.validate(79161234567L)).isEqualTo(79161234567L);
        assertThat(field.validate(new BigInteger("79161234567"))).isEqualTo(new BigInteger("79161234567"));
    }

    @Test
    void rejectsLeadingEight() {
        assertThatThrownBy(() -> field.validate("phone", "89161234567"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("The field 'phone' should start with 7");
    }

    @Test
    void rejectsTenDigits() {
        assertThatThrownBy(() -> field.validate("7916123456"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason())
                .isEqualTo(ValidationException.Reason.BAD_FORMAT);
        assertThatThrownBy(() -> field.validate(7916123456L))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsOtherTypes() {
        assertThatThrownBy(() -> field.validate(7.9161234567E10))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason())
                .isEqualTo(ValidationException.Reason.WRONG_TYPE);
        assertThatThrownBy(() -> field.validate(true))
                .isInstanceOf(ValidationException.class);
    }
}
