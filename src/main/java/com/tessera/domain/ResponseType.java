package com.tessera.domain;

/**
 * Outcome kind of every call across the handler boundary.
 */
public enum ResponseType {
    /** Carries a {@link ResultTable} */
    TABLE,
    /** No rows, e.g. DDL or DML acknowledgement */
    OK,
    /** Failure with a message and, where available, a provider error code */
    ERROR
}
