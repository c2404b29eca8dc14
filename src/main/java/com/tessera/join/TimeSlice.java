package com.tessera.join;

import com.tessera.query.FilterCondition;

import java.util.List;

/**
 * Part of a time-series input: conditions on the order column, and whether only
 * the latest {@code window} rows of it are kept
 */
public final class TimeSlice {

    private final String label;
    private final List<FilterCondition> conditions;
    private final boolean windowed;

    TimeSlice(String label, List<FilterCondition> conditions, boolean windowed) {
        this.label = label;
        this.conditions = List.copyOf(conditions);
        this.windowed = windowed;
    }

    public String getLabel() {
        return label;
    }

    public List<FilterCondition> getConditions() {
        return conditions;
    }

    public boolean isWindowed() {
        return windowed;
    }

    @Override
    public String toString() {
        return label + (windowed ? "(windowed)" : "") + conditions;
    }
}
