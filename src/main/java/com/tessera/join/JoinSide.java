package com.tessera.join;

import com.tessera.query.ast.TableIdentifier;

import java.util.List;

/**
 * One side of a predictor join: either a predictor or an integration table
 */
public final class JoinSide {

    private final TableIdentifier table;
    private final String alias;
    private final String integration;
    private final String name;

    private JoinSide(TableIdentifier table, String integration, String name) {
        this.table = table;
        this.alias = table.getReferenceName();
        this.integration = integration;
        this.name = name;
    }

    public static JoinSide predictor(TableIdentifier table, String predictorName) {
        return new JoinSide(table, null, predictorName);
    }

    public static JoinSide data(TableIdentifier table) {
        return new JoinSide(table, table.getQualifier(), table.getTablePath());
    }

    public TableIdentifier getTable() {
        return table;
    }

    /**
     * Name columns of this side are qualified with: the alias, else the last name part
     */
    public String getAlias() {
        return alias;
    }

    /**
     * Integration owning the table; null for the predictor side
     */
    public String getIntegration() {
        return integration;
    }

    /**
     * Handler-relative table name, or the predictor name
     */
    public String getName() {
        return name;
    }

    public boolean isPredictor() {
        return integration == null;
    }

    /**
     * Table reference relative to the integration, as handlers expect it
     */
    public TableIdentifier relativeTable() {
        List<String> parts = table.getParts();
        return new TableIdentifier(parts.subList(1, parts.size()), null);
    }

    /**
     * Whether a column qualifier designates this side
     */
    public boolean matches(String qualifier) {
        if (qualifier == null) {
            return false;
        }
        return qualifier.equalsIgnoreCase(alias)
            || qualifier.equalsIgnoreCase(table.getName())
            || (integration != null && qualifier.equalsIgnoreCase(integration));
    }

    @Override
    public String toString() {
        return (isPredictor() ? "predictor " : "table ") + table;
    }
}
