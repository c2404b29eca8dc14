package com.tessera.query.ast;

/**
 * Node of a parsed SQL expression tree
 */
public interface Expression {

    /**
     * Output alias given in the select list, or null
     */
    default String getAlias() {
        return null;
    }
}
