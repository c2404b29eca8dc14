package com.tessera.error;

/**
 * Exception thrown when a statement cannot be planned: unknown integrations or
 * predictors, unsupported condition shapes, or query clauses a time-series
 * predictor does not accept.
 */
public class PlanningException extends TesseraException {

    public PlanningException(String message) {
        super(ErrorKind.PLANNING, message);
    }

    public PlanningException(String message, Throwable cause) {
        super(ErrorKind.PLANNING, message, cause);
    }
}
