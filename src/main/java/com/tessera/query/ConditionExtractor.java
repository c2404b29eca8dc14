package com.tessera.query;

import com.tessera.error.PlanningException;
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Converts parsed WHERE and ORDER BY clauses into filter conditions and sort columns.
 *
 * Only conjunctions of simple column-versus-value predicates are supported;
 * anything else (OR, column-versus-column, functions) raises a {@link PlanningException}.
 * Column qualifiers are stripped: {@code t.sqft} becomes {@code sqft}.
 */
public final class ConditionExtractor {

    private ConditionExtractor() {
    }

    /**
     * Flatten a WHERE tree into its top-level AND conjuncts, in source order
     */
    public static List<Expression> splitConjuncts(Expression where) {
        if (where == null) {
            return Collections.emptyList();
        }
        List<Expression> conjuncts = new ArrayList<>();
        collectConjuncts(where, conjuncts);
        return conjuncts;
    }

    private static void collectConjuncts(Expression expression, List<Expression> out) {
        if (expression instanceof BinaryOperation && ((BinaryOperation) expression).isConjunction()) {
            BinaryOperation and = (BinaryOperation) expression;
            collectConjuncts(and.getLeft(), out);
            collectConjuncts(and.getRight(), out);
        } else {
            out.add(expression);
        }
    }

    /**
     * Rebuild a conjunction from conjuncts; null when the list is empty
     */
    public static Expression joinConjuncts(List<? extends Expression> conjuncts) {
        Expression result = null;
        for (Expression conjunct : conjuncts) {
            result = result == null ? conjunct : BinaryOperation.and(result, conjunct);
        }
        return result;
    }

    /**
     * Extract the WHERE clause as a conjunction of filter conditions
     *
     * @throws PlanningException if the clause contains anything but AND-ed simple predicates
     */
    public static List<FilterCondition> extractConditions(Expression where) {
        List<FilterCondition> conditions = new ArrayList<>();
        for (Expression conjunct : splitConjuncts(where)) {
            conditions.add(toCondition(conjunct));
        }
        return conditions;
    }

    /**
     * Convert a single predicate into a filter condition
     */
    public static FilterCondition toCondition(Expression predicate) {
        if (predicate instanceof NullCheck) {
            NullCheck check = (NullCheck) predicate;
            String column = columnName(check.getOperand(), predicate);
            return check.isNegated() ? FilterCondition.isNotNull(column) : FilterCondition.isNull(column);
        }

        if (predicate instanceof BetweenOperation) {
            BetweenOperation between = (BetweenOperation) predicate;
            String column = columnName(between.getOperand(), predicate);
            return FilterCondition.between(column,
                constantValue(between.getLow(), predicate),
                constantValue(between.getHigh(), predicate));
        }

        if (predicate instanceof BinaryOperation) {
            BinaryOperation op = (BinaryOperation) predicate;
            if ("or".equals(op.getOp())) {
                throw new PlanningException("OR conditions are not supported: " + predicate);
            }
            if (op.isConjunction()) {
                throw new PlanningException("Nested conjunction must be flattened first: " + predicate);
            }
            FilterOperator operator = parseOperator(op.getOp(), predicate);

            if (op.getLeft() instanceof Identifier && !(op.getRight() instanceof Identifier)) {
                return new FilterCondition(columnName(op.getLeft(), predicate), operator,
                    rightValue(operator, op.getRight(), predicate));
            }
            if (op.getRight() instanceof Identifier && !(op.getLeft() instanceof Identifier)
                && !operator.takesList() && operator != FilterOperator.LIKE && operator != FilterOperator.NOT_LIKE) {
                return new FilterCondition(columnName(op.getRight(), predicate), operator.mirrored(),
                    constantValue(op.getLeft(), predicate));
            }
        }

        throw new PlanningException("Unsupported condition: " + predicate);
    }

    /**
     * Inverse of {@link #toCondition(Expression)}: rebuild the predicate for a derived statement
     */
    public static Expression toExpression(FilterCondition condition) {
        Identifier column = Identifier.of(condition.getColumn());
        return switch (condition.getOperator()) {
            case IS_NULL -> NullCheck.isNull(column);
            case IS_NOT_NULL -> NullCheck.isNotNull(column);
            case BETWEEN -> new BetweenOperation(column,
                new Constant(condition.getValues().get(0)),
                new Constant(condition.getValues().get(1)));
            case IN, NOT_IN -> new BinaryOperation(condition.getOperator().getSymbol(), column,
                new ConstantList(condition.getValues()));
            default -> new BinaryOperation(condition.getOperator().getSymbol(), column,
                new Constant(condition.getValue()));
        };
    }

    /**
     * Convert ORDER BY items to sort columns
     */
    public static List<SortColumn> extractSort(List<OrderByItem> orderBy) {
        List<SortColumn> sort = new ArrayList<>();
        for (OrderByItem item : orderBy) {
            if (!(item.getExpression() instanceof Identifier)) {
                throw new PlanningException("Only column references can be sorted on: " + item);
            }
            sort.add(new SortColumn(((Identifier) item.getExpression()).getName(), item.isAscending()));
        }
        return sort;
    }

    /**
     * Qualifiers (table aliases) referenced by identifiers anywhere in the expression
     */
    public static Set<String> referencedQualifiers(Expression expression) {
        Set<String> qualifiers = new LinkedHashSet<>();
        for (Identifier identifier : identifiers(expression)) {
            qualifiers.add(identifier.getQualifier());
        }
        return qualifiers;
    }

    /**
     * Bare column names referenced anywhere in the expression
     */
    public static Set<String> referencedColumns(Expression expression) {
        Set<String> columns = new LinkedHashSet<>();
        for (Identifier identifier : identifiers(expression)) {
            columns.add(identifier.getName());
        }
        return columns;
    }

    /**
     * Copy of the expression with every identifier replaced through the mapper; aliases are kept
     */
    public static Expression mapIdentifiers(Expression expression, Function<Identifier, Expression> mapper) {
        if (expression instanceof Identifier) {
            return mapper.apply((Identifier) expression);
        }
        if (expression instanceof BinaryOperation) {
            BinaryOperation op = (BinaryOperation) expression;
            return new BinaryOperation(op.getOp(), mapIdentifiers(op.getLeft(), mapper),
                mapIdentifiers(op.getRight(), mapper), op.getAlias());
        }
        if (expression instanceof BetweenOperation) {
            BetweenOperation between = (BetweenOperation) expression;
            return new BetweenOperation(mapIdentifiers(between.getOperand(), mapper),
                mapIdentifiers(between.getLow(), mapper), mapIdentifiers(between.getHigh(), mapper));
        }
        if (expression instanceof NullCheck) {
            NullCheck check = (NullCheck) expression;
            return new NullCheck(mapIdentifiers(check.getOperand(), mapper), check.isNegated());
        }
        if (expression instanceof FunctionCall) {
            FunctionCall call = (FunctionCall) expression;
            List<Expression> args = new ArrayList<>();
            for (Expression arg : call.getArgs()) {
                args.add(mapIdentifiers(arg, mapper));
            }
            return new FunctionCall(call.getName(), args, call.getAlias());
        }
        return expression;
    }

    /**
     * Every identifier in the expression, depth first
     */
    public static List<Identifier> identifiers(Expression expression) {
        List<Identifier> found = new ArrayList<>();
        collectIdentifiers(expression, found);
        return found;
    }

    private static void collectIdentifiers(Expression expression, List<Identifier> out) {
        if (expression instanceof Identifier) {
            out.add((Identifier) expression);
        } else if (expression instanceof BinaryOperation) {
            collectIdentifiers(((BinaryOperation) expression).getLeft(), out);
            collectIdentifiers(((BinaryOperation) expression).getRight(), out);
        } else if (expression instanceof BetweenOperation) {
            BetweenOperation between = (BetweenOperation) expression;
            collectIdentifiers(between.getOperand(), out);
            collectIdentifiers(between.getLow(), out);
            collectIdentifiers(between.getHigh(), out);
        } else if (expression instanceof NullCheck) {
            collectIdentifiers(((NullCheck) expression).getOperand(), out);
        } else if (expression instanceof FunctionCall) {
            for (Expression arg : ((FunctionCall) expression).getArgs()) {
                collectIdentifiers(arg, out);
            }
        }
    }

    private static FilterOperator parseOperator(String op, Expression predicate) {
        try {
            return FilterOperator.fromSql(op);
        } catch (IllegalArgumentException e) {
            throw new PlanningException("Unsupported operator '" + op + "' in " + predicate, e);
        }
    }

    private static String columnName(Expression expression, Expression predicate) {
        if (!(expression instanceof Identifier)) {
            throw new PlanningException("Expected a column reference in " + predicate);
        }
        return ((Identifier) expression).getName();
    }

    private static Object rightValue(FilterOperator operator, Expression right, Expression predicate) {
        if (operator == FilterOperator.IN || operator == FilterOperator.NOT_IN) {
            if (right instanceof ConstantList) {
                return ((ConstantList) right).getValues();
            }
            if (right instanceof Constant) {
                List<Object> single = new ArrayList<>(1);
                single.add(((Constant) right).getValue());
                return single;
            }
            throw new PlanningException("IN requires a value list in " + predicate);
        }
        return constantValue(right, predicate);
    }

    private static Object constantValue(Expression expression, Expression predicate) {
        if (expression instanceof Constant) {
            return ((Constant) expression).getValue();
        }
        if (expression instanceof Latest) {
            return Latest.INSTANCE;
        }
        throw new PlanningException("Expected a constant value in " + predicate);
    }
}
