package com.tessera.error;

/**
 * Category of a failure surfaced to the caller.
 */
public enum ErrorKind {
    /** A handler could not be reached or authenticated */
    CONNECTION,
    /** The statement is valid SQL but cannot be planned against the registered handlers */
    PLANNING,
    /** A handler or predictor failed while executing a planned query */
    EXECUTION,
    /** The result was computed but could not be written to its destination */
    PERSISTENCE,
    /** The caller-level deadline expired */
    TIMEOUT,
    /** Anything else */
    INTERNAL
}
