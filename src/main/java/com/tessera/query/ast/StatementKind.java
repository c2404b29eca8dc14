package com.tessera.query.ast;

/**
 * Closed set of statements the engine executes.
 */
public enum StatementKind {
    SELECT,
    CREATE_PREDICTOR,
    RETRAIN_PREDICTOR,
    DROP_PREDICTOR
}
