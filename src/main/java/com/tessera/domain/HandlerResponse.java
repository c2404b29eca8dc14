package com.tessera.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tessera.error.ErrorKind;
import com.tessera.error.PlanningException;
import com.tessera.error.QueryExecutionException;
import com.tessera.error.TesseraException;

import java.util.Objects;

/**
 * Normalized response of a handler call: TABLE, OK or ERROR.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class HandlerResponse {

    @JsonProperty("type")
    private final ResponseType type;

    @JsonProperty("table")
    private final ResultTable table;

    @JsonProperty("error_message")
    private final String errorMessage;

    @JsonProperty("error_code")
    private final Integer errorCode;

    @JsonProperty("error_kind")
    private final ErrorKind errorKind;

    private HandlerResponse(ResponseType type, ResultTable table, String errorMessage, Integer errorCode,
                            ErrorKind errorKind) {
        this.type = type;
        this.table = table;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
        this.errorKind = errorKind;
    }

    public static HandlerResponse table(ResultTable table) {
        return new HandlerResponse(ResponseType.TABLE, Objects.requireNonNull(table, "table"), null, null, null);
    }

    public static HandlerResponse ok() {
        return new HandlerResponse(ResponseType.OK, null, null, null, null);
    }

    public static HandlerResponse error(String message) {
        return error(message, null);
    }

    public static HandlerResponse error(String message, Integer errorCode) {
        return error(message, errorCode, ErrorKind.EXECUTION);
    }

    public static HandlerResponse error(String message, Integer errorCode, ErrorKind errorKind) {
        return new HandlerResponse(ResponseType.ERROR, null,
            message != null ? message : "Unknown handler error", errorCode,
            errorKind != null ? errorKind : ErrorKind.EXECUTION);
    }

    public ResponseType getType() {
        return type;
    }

    public ResultTable getTable() {
        return table;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    /**
     * Kind of failure behind an ERROR response; null for TABLE and OK
     */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public boolean isError() {
        return type == ResponseType.ERROR;
    }

    /**
     * Exception a caller raises when it cannot continue past this ERROR response.
     * Planning failures keep their kind; everything else is an execution failure.
     */
    public TesseraException toException(String handlerName, String query) {
        if (errorKind == ErrorKind.PLANNING) {
            return new PlanningException(errorMessage);
        }
        return new QueryExecutionException(errorMessage, handlerName, query, errorCode);
    }

    /**
     * The carried table, or an empty table for OK responses
     *
     * @throws IllegalStateException for ERROR responses
     */
    public ResultTable tableOrEmpty() {
        return switch (type) {
            case TABLE -> table;
            case OK -> ResultTable.empty();
            case ERROR -> throw new IllegalStateException("Error response has no table: " + errorMessage);
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case TABLE -> "HandlerResponse{TABLE, " + table + "}";
            case OK -> "HandlerResponse{OK}";
            case ERROR -> "HandlerResponse{ERROR, kind=" + errorKind + ", code=" + errorCode
                + ", message=" + errorMessage + "}";
        };
    }
}
