package com.tessera.join;

import com.tessera.error.PlanningException;
import com.tessera.query.FilterCondition;
import com.tessera.query.FilterOperator;
import com.tessera.query.ast.Latest;

import java.util.List;

/**
 * Turns the time cutoff of a time-series query into the slices fetched for each group.
 *
 * Mapping of the cutoff on the order column:
 * - none, or {@code > LATEST}: the latest window
 * - {@code > X}: history {@code <= X} (windowed), then forecast {@code > X}
 * - {@code >= X}: history {@code < X} (windowed), then forecast {@code >= X}
 * - {@code < X}, {@code <= X}: one windowed slice with the filter
 * - {@code = X}: one windowed slice {@code <= X}
 * - {@code BETWEEN a AND b}: history {@code < a} (windowed), then the range
 */
public final class TimeSliceBuilder {

    static final String LATEST = "latest";
    static final String HISTORY = "history";
    static final String FORECAST = "forecast";
    static final String WINDOW = "window";

    private TimeSliceBuilder() {
    }

    /**
     * @param orderColumn the predictor's order column
     * @param cutoff the single condition on the order column, or null
     * @throws PlanningException for operators that do not define a time cutoff
     */
    public static List<TimeSlice> build(String orderColumn, FilterCondition cutoff) {
        if (cutoff == null) {
            return List.of(new TimeSlice(LATEST, List.of(), true));
        }
        FilterOperator operator = cutoff.getOperator();
        boolean latest = !operator.takesList() && cutoff.getValue() instanceof Latest;
        if (latest && operator != FilterOperator.GREATER_THAN) {
            throw new PlanningException("LATEST can only be used as '" + orderColumn + " > LATEST'");
        }
        if (operator.takesList() && cutoff.getValues().stream().anyMatch(value -> value instanceof Latest)) {
            throw new PlanningException("LATEST can only be used as '" + orderColumn + " > LATEST'");
        }

        return switch (operator) {
            case GREATER_THAN -> latest
                ? List.of(new TimeSlice(LATEST, List.of(), true))
                : List.of(
                    new TimeSlice(HISTORY, List.of(FilterCondition.of(orderColumn, FilterOperator.LESS_THAN_OR_EQUAL, cutoff.getValue())), true),
                    new TimeSlice(FORECAST, List.of(cutoff.copy()), false));
            case GREATER_THAN_OR_EQUAL -> List.of(
                new TimeSlice(HISTORY, List.of(FilterCondition.of(orderColumn, FilterOperator.LESS_THAN, cutoff.getValue())), true),
                new TimeSlice(FORECAST, List.of(cutoff.copy()), false));
            case LESS_THAN, LESS_THAN_OR_EQUAL -> List.of(
                new TimeSlice(WINDOW, List.of(cutoff.copy()), true));
            case EQUAL -> List.of(
                new TimeSlice(WINDOW, List.of(FilterCondition.of(orderColumn, FilterOperator.LESS_THAN_OR_EQUAL, cutoff.getValue())), true));
            case BETWEEN -> List.of(
                new TimeSlice(HISTORY, List.of(FilterCondition.of(orderColumn, FilterOperator.LESS_THAN, cutoff.getValues().get(0))), true),
                new TimeSlice(FORECAST, List.of(cutoff.copy()), false));
            default -> throw new PlanningException("Operator " + operator + " cannot be used on time column '"
                + orderColumn + "' of a time-series predictor");
        };
    }
}
