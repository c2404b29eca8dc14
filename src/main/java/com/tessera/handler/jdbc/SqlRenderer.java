package com.tessera.handler.jdbc;

import com.tessera.domain.ColumnType;
import com.tessera.query.FilterCondition;
import com.tessera.query.SortColumn;
import com.tessera.query.ast.BetweenOperation;
import com.tessera.query.ast.BinaryOperation;
import com.tessera.query.ast.Constant;
import com.tessera.query.ast.ConstantList;
import com.tessera.query.ast.Expression;
import com.tessera.query.ast.FunctionCall;
import com.tessera.query.ast.Identifier;
import com.tessera.query.ast.Latest;
import com.tessera.query.ast.NullCheck;
import com.tessera.query.ast.OrderByItem;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.ast.Star;
import com.tessera.query.ast.TableIdentifier;
import com.tessera.query.ast.TableReference;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders requests and parsed statements into SQL text for JDBC back ends.
 *
 * Identifiers are always quoted with the dialect's quote character and string
 * literals are escaped by doubling single quotes.
 */
public class SqlRenderer {

    private static final DateTimeFormatter DATETIME_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private final String quote;

    public SqlRenderer() {
        this("\"");
    }

    public SqlRenderer(String quote) {
        this.quote = quote;
    }

    /**
     * Quote character matching a JDBC URL: backticks for MySQL-family drivers, double quotes otherwise
     */
    public static SqlRenderer forJdbcUrl(String url) {
        String lower = url != null ? url.toLowerCase(Locale.ROOT) : "";
        if (lower.startsWith("jdbc:mysql:") || lower.startsWith("jdbc:mariadb:")) {
            return new SqlRenderer("`");
        }
        return new SqlRenderer("\"");
    }

    /**
     * Render a pushdown request
     */
    public String render(SqlRequest request) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quoteName(request.getTable()));

        if (!request.getPredicates().isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", request.getPredicates()));
        }

        if (!request.getSort().isEmpty()) {
            sql.append(" ORDER BY ").append(renderSort(request.getSort()));
        }

        if (request.getLimit() != null) {
            sql.append(" LIMIT ").append(request.getLimit());
        }
        return sql.toString();
    }

    /**
     * Render a whole parsed statement, including aggregation clauses
     */
    public String render(SelectStatement select) {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (select.isDistinct()) {
            sql.append("DISTINCT ");
        }
        sql.append(select.getTargets().stream().map(this::renderTarget).collect(Collectors.joining(", ")));

        if (select.getFrom() != null) {
            sql.append(" FROM ").append(renderTable(select.getFrom()));
        }
        if (select.getWhere() != null) {
            sql.append(" WHERE ").append(renderExpression(select.getWhere()));
        }
        if (!select.getGroupBy().isEmpty()) {
            sql.append(" GROUP BY ").append(select.getGroupBy().stream()
                .map(this::renderExpression).collect(Collectors.joining(", ")));
        }
        if (select.getHaving() != null) {
            sql.append(" HAVING ").append(renderExpression(select.getHaving()));
        }
        if (!select.getOrderBy().isEmpty()) {
            List<String> items = new ArrayList<>();
            for (OrderByItem item : select.getOrderBy()) {
                items.add(renderExpression(item.getExpression()) + (item.isAscending() ? " ASC" : " DESC"));
            }
            sql.append(" ORDER BY ").append(String.join(", ", items));
        }
        if (select.getLimit() != null) {
            sql.append(" LIMIT ").append(select.getLimit());
        }
        if (select.getOffset() != null) {
            sql.append(" OFFSET ").append(select.getOffset());
        }
        return sql.toString();
    }

    /**
     * Render one filter condition as a SQL predicate
     *
     * @throws IllegalArgumentException for values that have no SQL literal, such as LATEST
     */
    public String renderCondition(FilterCondition condition) {
        String column = quoteName(condition.getColumn());
        return switch (condition.getOperator()) {
            case IS_NULL -> column + " IS NULL";
            case IS_NOT_NULL -> column + " IS NOT NULL";
            case IN -> column + " IN (" + renderList(condition.getValues()) + ")";
            case NOT_IN -> column + " NOT IN (" + renderList(condition.getValues()) + ")";
            case BETWEEN -> column + " BETWEEN " + literal(condition.getValues().get(0))
                + " AND " + literal(condition.getValues().get(1));
            case LIKE -> column + " LIKE " + literal(condition.getValue());
            case NOT_LIKE -> column + " NOT LIKE " + literal(condition.getValue());
            default -> column + " " + condition.getOperator().getSymbol() + " " + literal(condition.getValue());
        };
    }

    public String createTable(String table, Map<String, ColumnType> columnTypes) {
        String columns = columnTypes.entrySet().stream()
            .map(e -> quoteName(e.getKey()) + " " + e.getValue().getSqlType())
            .collect(Collectors.joining(", "));
        return "CREATE TABLE IF NOT EXISTS " + quoteName(table) + " (" + columns + ")";
    }

    public String insert(String table, Collection<String> columns) {
        String names = columns.stream().map(this::quoteName).collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + quoteName(table) + " (" + names + ") VALUES (" + placeholders + ")";
    }

    /**
     * Quote a possibly dotted name part by part
     */
    public String quoteName(String name) {
        List<String> parts = new ArrayList<>();
        for (String part : name.split("\\.")) {
            parts.add(quote + part.replace(quote, quote + quote) + quote);
        }
        return String.join(".", parts);
    }

    /**
     * SQL literal for a Java value
     */
    public String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Latest) {
            throw new IllegalArgumentException("LATEST has no SQL literal");
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        if (value instanceof LocalDate) {
            return "'" + DATE_FORMATTER.format((LocalDate) value) + "'";
        }
        if (value instanceof LocalDateTime) {
            return "'" + DATETIME_FORMATTER.format(((LocalDateTime) value).atOffset(ZoneOffset.UTC)) + "'";
        }
        if (value instanceof LocalTime) {
            return "'" + value + "'";
        }
        if (value instanceof java.sql.Time) {
            return "'" + ((java.sql.Time) value).toLocalTime() + "'";
        }
        if (value instanceof Date) {
            return "'" + DATETIME_FORMATTER.format(((Date) value).toInstant()) + "'";
        }
        if (value instanceof TemporalAccessor) {
            return "'" + DATETIME_FORMATTER.format((TemporalAccessor) value) + "'";
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    private String renderList(List<Object> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Empty IN list");
        }
        return values.stream().map(this::literal).collect(Collectors.joining(", "));
    }

    private String renderSort(List<SortColumn> sort) {
        return sort.stream()
            .map(key -> quoteName(key.getColumn()) + (key.isAscending() ? " ASC" : " DESC"))
            .collect(Collectors.joining(", "));
    }

    private String renderTable(TableReference table) {
        if (!(table instanceof TableIdentifier)) {
            throw new IllegalArgumentException("Only single-table statements can be rendered: " + table);
        }
        TableIdentifier identifier = (TableIdentifier) table;
        String name = quoteName(String.join(".", identifier.getParts()));
        return identifier.getAlias() != null ? name + " AS " + quoteName(identifier.getAlias()) : name;
    }

    private String renderTarget(Expression target) {
        String rendered = renderExpression(target);
        return target.getAlias() != null ? rendered + " AS " + quoteName(target.getAlias()) : rendered;
    }

    private String renderExpression(Expression expression) {
        if (expression instanceof Identifier) {
            return quoteName(String.join(".", ((Identifier) expression).getParts()));
        }
        if (expression instanceof Star) {
            Star star = (Star) expression;
            return star.getQualifier() != null ? quoteName(star.getQualifier()) + ".*" : "*";
        }
        if (expression instanceof Constant) {
            return literal(((Constant) expression).getValue());
        }
        if (expression instanceof ConstantList) {
            return "(" + renderList(((ConstantList) expression).getValues()) + ")";
        }
        if (expression instanceof FunctionCall) {
            FunctionCall call = (FunctionCall) expression;
            return call.getName().toUpperCase(Locale.ROOT) + "("
                + call.getArgs().stream().map(this::renderExpression).collect(Collectors.joining(", ")) + ")";
        }
        if (expression instanceof BinaryOperation) {
            BinaryOperation op = (BinaryOperation) expression;
            return "(" + renderExpression(op.getLeft()) + " " + op.getOp().toUpperCase(Locale.ROOT) + " "
                + renderExpression(op.getRight()) + ")";
        }
        if (expression instanceof BetweenOperation) {
            BetweenOperation between = (BetweenOperation) expression;
            return "(" + renderExpression(between.getOperand()) + " BETWEEN " + renderExpression(between.getLow())
                + " AND " + renderExpression(between.getHigh()) + ")";
        }
        if (expression instanceof NullCheck) {
            NullCheck check = (NullCheck) expression;
            return "(" + renderExpression(check.getOperand()) + (check.isNegated() ? " IS NOT NULL)" : " IS NULL)");
        }
        throw new IllegalArgumentException("Cannot render expression: " + expression);
    }
}
