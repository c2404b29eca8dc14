package com.tessera.error;

/**
 * Exception thrown when a handler cannot connect to its back end
 */
public class HandlerConnectionException extends TesseraException {

    private final String handlerName;

    public HandlerConnectionException(String handlerName, String message) {
        super(ErrorKind.CONNECTION, message);
        this.handlerName = handlerName;
    }

    public HandlerConnectionException(String handlerName, String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }

    @Override
    public String getMessage() {
        if (handlerName == null) {
            return super.getMessage();
        }
        return super.getMessage() + " [Handler: " + handlerName + "]";
    }
}
