package com.tessera.query.ast;

/**
 * The {@code LATEST} keyword, used as a time cutoff: {@code WHERE t.saledate > LATEST}.
 */
public final class Latest implements Expression {

    public static final Latest INSTANCE = new Latest();

    private Latest() {
    }

    @Override
    public String toString() {
        return "LATEST";
    }
}
