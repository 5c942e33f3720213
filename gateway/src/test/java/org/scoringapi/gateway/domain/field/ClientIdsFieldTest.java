package org.scoringapi.gateway.domain.field;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientIdsFieldTest {

    private final ClientIdsField field = new ClientIdsField(true, false);

    @Test
    void acceptsListOfIntegers() throws Exception {
        List<Object> ids = Arrays.asList(1, 2L, 3);
        assertThat(field.validate(ids)).isSameAs(ids);
    }

    @Test
    void rejectsNonIntegerElement() {
        assertThatThrownBy(() -> field.validate("client_ids", Arrays.asList(1, "2")))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason())
                .isEqualTo(ValidationException.Reason.INVALID_LIST_ELEMENT);
        assertThatThrownBy(() -> field.validate(Arrays.asList(1, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void bigIdsMustFitInLong() throws Exception {
        List<Object> ids = List.of(BigInteger.valueOf(Long.MAX_VALUE));
        assertThat(field.validate(ids)).isSameAs(ids);

        assertThatThrownBy(() -> field.validate(List.of(BigInteger.ONE.shiftLeft(63))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsNonList() {
        assertThatThrownBy(() -> field.validate(Map.of("1", 1)))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason())
                .isEqualTo(ValidationException.Reason.WRONG_TYPE);
        assertThatThrownBy(() -> field.validate(1))
                .isInstanceOf(ValidationException.class);
    }
}
