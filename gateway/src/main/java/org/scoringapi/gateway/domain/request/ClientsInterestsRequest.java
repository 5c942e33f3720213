package org.scoringapi.gateway.domain.request;

import org.scoringapi.gateway.domain.field.ClientIdsField;
import org.scoringapi.gateway.domain.field.DateField;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Arguments of the {@code clients_interests} method.
 */
public final class ClientsInterestsRequest extends Request {

    public static final String CLIENT_IDS = "client_ids";
    public static final String DATE = "date";

    public static final Schema SCHEMA = Schema.builder("ClientsInterestsRequest")
            .field(CLIENT_IDS, new ClientIdsField(true, false))
            .field(DATE, new DateField(false, true))
            .build();

    public ClientsInterestsRequest(Map<String, ?> raw) {
        super(SCHEMA, raw);
    }

    /**
     * Client ids in request order; only meaningful after {@link #validate()} succeeded.
     */
    public List<Long> getClientIds() {
        Object value = getValue(CLIENT_IDS);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<Long> ids = new ArrayList<>();
        for (Object item : (List<?>) value) {
            ids.add(((Number) item).longValue());
        }
        return ids;
    }

    public LocalDate getDate() {
        return isPresent(DATE) ? DateField.parse(getText(DATE)) : null;
    }
}
