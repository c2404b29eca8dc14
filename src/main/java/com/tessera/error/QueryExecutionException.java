package com.tessera.error;

/**
 * Exception thrown when query execution fails
 * Provides context about which handler failed, the native query and the provider error code
 */
public class QueryExecutionException extends TesseraException {

    private final String handlerName;
    private final String query;
    private final Integer errorCode;

    public QueryExecutionException(String message) {
        this(message, null, null, null, null);
    }

    public QueryExecutionException(String message, String handlerName) {
        this(message, handlerName, null, null, null);
    }

    public QueryExecutionException(String message, String handlerName, Throwable cause) {
        this(message, handlerName, null, null, cause);
    }

    public QueryExecutionException(String message, String handlerName, String query, Integer errorCode) {
        this(message, handlerName, query, errorCode, null);
    }

    public QueryExecutionException(String message, String handlerName, String query, Integer errorCode,
                                   Throwable cause) {
        super(ErrorKind.EXECUTION, message, cause);
        this.handlerName = handlerName;
        this.query = query;
        this.errorCode = errorCode;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public String getQuery() {
        return query;
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (handlerName != null) {
            sb.append(" [Handler: ").append(handlerName).append("]");
        }
        if (errorCode != null) {
            sb.append(" [Code: ").append(errorCode).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
