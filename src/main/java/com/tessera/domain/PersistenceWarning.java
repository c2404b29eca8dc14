package com.tessera.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Non-fatal failure to persist a computed result into its INTO destination.
 */
public final class PersistenceWarning {

    @JsonProperty("destination")
    private final String destination;

    @JsonProperty("message")
    private final String message;

    public PersistenceWarning(String destination, String message) {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.message = message != null ? message : "Unknown persistence failure";
    }

    public String getDestination() {
        return destination;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistenceWarning)) return false;
        PersistenceWarning that = (PersistenceWarning) o;
        return destination.equals(that.destination) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(destination, message);
    }

    @Override
    public String toString() {
        return "PersistenceWarning{" + destination + ": " + message + "}";
    }
}
