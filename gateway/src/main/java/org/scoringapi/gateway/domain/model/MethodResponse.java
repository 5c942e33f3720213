package org.scoringapi.gateway.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a dispatched call: an optional payload and a response code.
 */
public final class MethodResponse {

    private final Object payload;
    private final ResponseCode code;

    private MethodResponse(Object payload, ResponseCode code) {
        this.payload = payload;
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public static MethodResponse ok(Object payload) {
        return new MethodResponse(payload, ResponseCode.OK);
    }

    /**
     * 422 with the {@code {code, error}} payload.
     */
    public static MethodResponse invalid(String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", ResponseCode.INVALID_REQUEST.getCode());
        payload.put("error", error);
        return new MethodResponse(payload, ResponseCode.INVALID_REQUEST);
    }

    /**
     * An error code without payload; the transport fills in the standard message.
     */
    public static MethodResponse error(ResponseCode code) {
        return new MethodResponse(null, code);
    }

    public Object getPayload() {
        return payload;
    }

    public ResponseCode getCode() {
        return code;
    }

    /**
     * Response envelope: {@code {"response", "code"}} on success,
     * {@code {"error", "code"}} otherwise.
     */
    public Map<String, Object> toEnvelope() {
        Map<String, Object> envelope = new LinkedHashMap<>();
        if (code.isError()) {
            envelope.put("error", payload != null ? payload : code.getMessage());
        } else {
            envelope.put("response", payload);
        }
        envelope.put("code", code.getCode());
        return envelope;
    }

    @Override
    public String toString() {
        return "MethodResponse{code=" + code.getCode() + ", payload=" + payload + '}';
    }
}
