package com.tessera.query.ast;

import java.util.Objects;

/**
 * {@code RETRAIN name}
 */
public final class RetrainPredictorStatement implements Statement {

    private final String name;

    public RetrainPredictorStatement(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.RETRAIN_PREDICTOR;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RetrainPredictorStatement
            && name.equals(((RetrainPredictorStatement) o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "RETRAIN " + name;
    }
}
