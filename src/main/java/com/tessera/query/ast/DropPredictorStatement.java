package com.tessera.query.ast;

import java.util.Objects;

/**
 * {@code DROP PREDICTOR name}
 */
public final class DropPredictorStatement implements Statement {

    private final String name;

    public DropPredictorStatement(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.DROP_PREDICTOR;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DropPredictorStatement
            && name.equals(((DropPredictorStatement) o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "DROP PREDICTOR " + name;
    }
}
