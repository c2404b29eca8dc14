package com.tessera.join;

import com.tessera.domain.ResultTable;

import java.util.Collections;
import java.util.Map;

/**
 * Merged output, with the prediction column each output column was taken from
 */
public final class MergeResult {

    private final ResultTable table;
    private final Map<String, String> predictorColumns;

    MergeResult(ResultTable table, Map<String, String> predictorColumns) {
        this.table = table;
        this.predictorColumns = Collections.unmodifiableMap(predictorColumns);
    }

    public ResultTable getTable() {
        return table;
    }

    /**
     * Output column name to prediction column name, for outputs taken from the predictor
     */
    public Map<String, String> getPredictorColumns() {
        return predictorColumns;
    }
}
