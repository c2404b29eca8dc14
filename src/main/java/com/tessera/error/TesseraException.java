package com.tessera.error;

/**
 * Root of the engine's unchecked exception hierarchy
 */
public class TesseraException extends RuntimeException {

    private final ErrorKind kind;

    public TesseraException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TesseraException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
