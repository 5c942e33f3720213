package org.scoringapi.gateway.domain.model;

/**
 * Response codes returned to callers, with their standard messages.
 */
public enum ResponseCode {
    OK(200, "OK"),
    BAD_REQUEST(400, "Bad Request"),
    FORBIDDEN(403, "Forbidden"),
    NOT_FOUND(404, "Not Found"),
    INVALID_REQUEST(422, "Invalid Request"),
    INTERNAL_ERROR(500, "Internal Server Error");

    private final int code;
    private final String message;

    ResponseCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public boolean isError() {
        return this != OK;
    }
}
