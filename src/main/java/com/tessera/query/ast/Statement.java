package com.tessera.query.ast;

/**
 * Parsed SQL statement. Dispatch on {@link #kind()} is exhaustive, so a new
 * statement kind must be handled everywhere statements are executed.
 */
public sealed interface Statement
    permits SelectStatement, CreatePredictorStatement, RetrainPredictorStatement, DropPredictorStatement {

    StatementKind kind();
}
