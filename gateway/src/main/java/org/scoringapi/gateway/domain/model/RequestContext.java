package org.scoringapi.gateway.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-call context: the request id plus attributes handlers record for the access log.
 * Not shared between calls.
 */
public final class RequestContext {

    private final String requestId;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public RequestContext(String requestId) {
        this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
    }

    /**
     * Context with the given id, or a random one when blank.
     */
    public static RequestContext withRequestId(String requestId) {
        if (requestId == null || requestId.trim().isEmpty()) {
            return new RequestContext(UUID.randomUUID().toString().replace("-", ""));
        }
        return new RequestContext(requestId.trim());
    }

    public String getRequestId() {
        return requestId;
    }

    public void put(String key, Object value) {
        attributes.put(key, value);
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put("request_id", requestId);
        all.putAll(attributes);
        return all.toString();
    }
}
