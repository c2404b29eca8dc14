package com.tessera.query.ast;

/**
 * FROM-clause item: a named table or a join of two references
 */
public interface TableReference {
}
