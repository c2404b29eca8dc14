package com.tessera.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of external system a handler exposes.
 */
public enum HandlerKind {

    /**
     * SQL or NoSQL databases, warehouses and file-backed tables
     */
    DATABASE("database", "Database or file-backed data source"),

    /**
     * SaaS and search APIs exposed as tables
     */
    API("api", "Remote API exposed through virtual tables"),

    /**
     * Machine-learning engines serving predictors
     */
    ML("ml", "Machine-learning engine");

    private final String value;
    private final String description;

    HandlerKind(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse a string value to HandlerKind
     */
    public static HandlerKind fromValue(String value) {
        for (HandlerKind kind : HandlerKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown HandlerKind value: " + value);
    }
}
