package com.tessera.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeoutException;

/**
 * QueryErrorMapper provides centralized exception-to-error mapping for callers of the engine.
 *
 * Mapping:
 * - HandlerConnectionException -> CONNECTION / HANDLER_CONNECTION_FAILED
 * - PlanningException -> PLANNING / PLANNING_FAILED
 * - QueryExecutionException -> EXECUTION / QUERY_EXECUTION_FAILED
 * - TesseraException(TIMEOUT), TimeoutException -> TIMEOUT / QUERY_TIMEOUT
 * - IllegalArgumentException -> PLANNING / VALIDATION_FAILED
 * - UnsupportedOperationException -> PLANNING / UNSUPPORTED_OPERATION
 * - IllegalStateException -> INTERNAL / INVALID_STATE
 * - anything else -> INTERNAL / INTERNAL_ERROR
 *
 * Messages are sanitized so connection strings, URLs and addresses do not leak.
 */
@Component
public class QueryErrorMapper {

    private static final Logger log = LoggerFactory.getLogger(QueryErrorMapper.class);

    static final String REASON_CONNECTION_FAILED = "HANDLER_CONNECTION_FAILED";
    static final String REASON_PLANNING_FAILED = "PLANNING_FAILED";
    static final String REASON_QUERY_EXECUTION_FAILED = "QUERY_EXECUTION_FAILED";
    static final String REASON_PERSISTENCE_FAILED = "PERSISTENCE_FAILED";
    static final String REASON_QUERY_TIMEOUT = "QUERY_TIMEOUT";
    static final String REASON_VALIDATION_FAILED = "VALIDATION_FAILED";
    static final String REASON_UNSUPPORTED_OPERATION = "UNSUPPORTED_OPERATION";
    static final String REASON_INVALID_STATE = "INVALID_STATE";
    static final String REASON_INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final int MAX_MESSAGE_LENGTH = 500;

    /**
     * Map an exception to a QueryError and log it at a level matching its kind
     *
     * @param exception The exception raised by the engine
     * @return The error payload for the caller
     */
    public QueryError map(Throwable exception) {
        Throwable root = unwrap(exception);
        QueryError error = toError(root);
        logException(root, error);
        return error;
    }

    private QueryError toError(Throwable exception) {
        if (exception instanceof HandlerConnectionException) {
            HandlerConnectionException connEx = (HandlerConnectionException) exception;
            return new QueryError(ErrorKind.CONNECTION, REASON_CONNECTION_FAILED,
                sanitizeMessage(connEx.getMessage()), connEx.getHandlerName(), null);
        }

        if (exception instanceof QueryExecutionException) {
            QueryExecutionException queryEx = (QueryExecutionException) exception;
            String message = queryEx.getHandlerName() != null
                ? String.format("Query execution failed on handler %s: %s",
                    queryEx.getHandlerName(), sanitizeMessage(queryEx.getMessage()))
                : String.format("Query execution failed: %s", sanitizeMessage(queryEx.getMessage()));
            return new QueryError(ErrorKind.EXECUTION, REASON_QUERY_EXECUTION_FAILED,
                message, queryEx.getHandlerName(), queryEx.getErrorCode());
        }

        if (exception instanceof TesseraException) {
            TesseraException tesseraEx = (TesseraException) exception;
            return new QueryError(tesseraEx.getKind(), reasonFor(tesseraEx.getKind()),
                sanitizeMessage(tesseraEx.getMessage()), null, null);
        }

        if (exception instanceof TimeoutException) {
            return new QueryError(ErrorKind.TIMEOUT, REASON_QUERY_TIMEOUT,
                "Query execution timed out", null, null);
        }

        if (exception instanceof IllegalArgumentException) {
            return new QueryError(ErrorKind.PLANNING, REASON_VALIDATION_FAILED,
                sanitizeMessage(exception.getMessage()), null, null);
        }

        if (exception instanceof UnsupportedOperationException) {
            return new QueryError(ErrorKind.PLANNING, REASON_UNSUPPORTED_OPERATION,
                sanitizeMessage(exception.getMessage()), null, null);
        }

        if (exception instanceof IllegalStateException) {
            return new QueryError(ErrorKind.INTERNAL, REASON_INVALID_STATE,
                sanitizeMessage(exception.getMessage()), null, null);
        }

        return new QueryError(ErrorKind.INTERNAL, REASON_INTERNAL_ERROR, "Internal engine error", null, null);
    }

    private String reasonFor(ErrorKind kind) {
        return switch (kind) {
            case CONNECTION -> REASON_CONNECTION_FAILED;
            case PLANNING -> REASON_PLANNING_FAILED;
            case EXECUTION -> REASON_QUERY_EXECUTION_FAILED;
            case PERSISTENCE -> REASON_PERSISTENCE_FAILED;
            case TIMEOUT -> REASON_QUERY_TIMEOUT;
            case INTERNAL -> REASON_INTERNAL_ERROR;
        };
    }

    /**
     * Reactor and executor wrappers hide the engine exception behind a generic cause chain
     */
    private Throwable unwrap(Throwable exception) {
        Throwable current = exception;
        while (!(current instanceof TesseraException)
            && current.getCause() != null
            && current.getCause() != current
            && (current instanceof java.util.concurrent.ExecutionException
                || current instanceof java.util.concurrent.CompletionException
                || current.getClass().getName().startsWith("reactor.core"))) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Sanitize an error message to prevent leaking connection strings and addresses
     */
    String sanitizeMessage(String message) {
        if (message == null) {
            return "An error occurred";
        }

        message = message.replaceAll("jdbc:[^\\s\\]]+", "[connection-string]");
        message = message.replaceAll("https?://[^\\s\\]]+", "[url]");
        message = message.replaceAll("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b", "[ip-address]");

        if (message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
        }
        return message;
    }

    private void logException(Throwable exception, QueryError error) {
        switch (error.getKind()) {
            case PLANNING:
            case TIMEOUT:
                // Caller errors and deadlines
                log.warn("{} ({}): {}", error.getKind(), error.getReason(), error.getMessage());
                break;
            case PERSISTENCE:
                log.warn("{} ({}): {}", error.getKind(), error.getReason(), error.getMessage(), exception);
                break;
            case CONNECTION:
            case EXECUTION:
            case INTERNAL:
            default:
                log.error("{} ({}): {}", error.getKind(), error.getReason(), error.getMessage(), exception);
                break;
        }
    }
}
