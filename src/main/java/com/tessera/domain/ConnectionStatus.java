package com.tessera.domain;

/**
 * Result of a connection attempt or connection check.
 */
public final class ConnectionStatus {

    private static final ConnectionStatus CONNECTED = new ConnectionStatus(true, null);

    private final boolean success;
    private final String errorMessage;

    private ConnectionStatus(boolean success, String errorMessage) {
        this.success = success;
        this.errorMessage = errorMessage;
    }

    public static ConnectionStatus connected() {
        return CONNECTED;
    }

    public static ConnectionStatus failed(String errorMessage) {
        return new ConnectionStatus(false, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return success ? "ConnectionStatus{connected}" : "ConnectionStatus{failed: " + errorMessage + "}";
    }
}
