package org.scoringapi.gateway.domain.field;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextFieldsTest {

    @Nested
    class Char {
        private final CharField field = new CharField(false, false);

        @Test
        void acceptsString() throws Exception {
            assertThat(field.validate("abc")).isEqualTo("abc");
        }

        @Test
        void rejectsNonString() {
            assertThatThrownBy(() -> field.validate("first_name", 2))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("The field 'first_name' should be a string");
        }
    }

    @Nested
    class Arguments {
        private final ArgumentsField field = new ArgumentsField(true, false);

        @Test
        void acceptsMap() throws Exception {
            Map<String, Object> value = Map.of("phone", "79175002040");
            assertThat(field.validate(value)).isSameAs(value);
        }

        @Test
        void rejectsList() {
            assertThatThrownBy(() -> field.validate(List.of(1)))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.WRONG_TYPE);
        }
    }

    @Nested
    class Email {
        private final EmailField field = new EmailField(false, true);

        @Test
        void acceptsAddressWithAt() throws Exception {
            assertThat(field.validate("stupnikov@otus.ru")).isEqualTo("stupnikov@otus.ru");
        }

        @Test
        void rejectsAddressWithoutAt() {
            assertThatThrownBy(() -> field.validate("email", "stupnikovotus.ru"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("The field 'email' should be a correct email")
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.BAD_FORMAT);
        }

        @Test
        void typeIsCheckedBeforeFormat() {
            assertThatThrownBy(() -> field.validate(42))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getReason())
                    .isEqualTo(ValidationException.Reason.WRONG_TYPE);
        }
    }
}
