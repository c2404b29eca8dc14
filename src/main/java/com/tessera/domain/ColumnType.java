package com.tessera.domain;

/**
 * Storage type used when persisting results into a destination table.
 */
public enum ColumnType {
    INTEGER("BIGINT"),
    FLOAT("DOUBLE PRECISION"),
    TEXT("TEXT"),
    DATETIME("TIMESTAMP");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String getSqlType() {
        return sqlType;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
