package com.tessera.handler.jdbc;

import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;
import com.tessera.query.pushdown.PushdownAdapter;

import java.util.List;

/**
 * Pushes every condition a SQL database can evaluate; only values without a
 * SQL literal (LATEST) are left residual.
 */
public class JdbcPushdownAdapter implements PushdownAdapter<SqlRequest> {

    private final SqlRenderer renderer;

    public JdbcPushdownAdapter(SqlRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public SqlRequest newRequest(String table) {
        return new SqlRequest(table);
    }

    @Override
    public boolean tryPushCondition(SqlRequest request, FilterCondition condition) {
        // Rendered before mutating so a rejected literal leaves the request untouched
        String predicate = renderer.renderCondition(condition);
        request.addPredicate(predicate);
        return true;
    }

    @Override
    public boolean isNativeField(SqlRequest request, String column) {
        return true;
    }

    @Override
    public void applySort(SqlRequest request, List<SortColumn> sort) {
        request.setSort(sort);
    }

    @Override
    public void applyLimit(SqlRequest request, Integer limit) {
        request.setLimit(limit);
    }

    @Override
    public String describe(SqlRequest request) {
        return renderer.render(request);
    }
}
