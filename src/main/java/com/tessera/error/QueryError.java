package com.tessera.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Machine-checkable error payload returned to callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryError {

    @JsonProperty("kind")
    private final ErrorKind kind;

    @JsonProperty("reason")
    private final String reason;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("handler")
    private final String handler;

    @JsonProperty("error_code")
    private final Integer errorCode;

    public QueryError(ErrorKind kind, String reason, String message, String handler, Integer errorCode) {
        this.kind = kind;
        this.reason = reason;
        this.message = message;
        this.handler = handler;
        this.errorCode = errorCode;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public String getHandler() {
        return handler;
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "QueryError{" + kind + "/" + reason + ": " + message + "}";
    }
}
