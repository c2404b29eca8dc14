package com.tessera.predictor;

import com.tessera.domain.PredictorDescriptor;
import com.tessera.domain.ResultTable;

/**
 * Runtime contract of a trained model.
 */
public interface Predictor {

    PredictorDescriptor getDescriptor();

    default String getName() {
        return getDescriptor().getName();
    }

    /**
     * Produce one output row per input row.
     *
     * The output may carry an {@code original_index} column giving, for each row,
     * the position of the input row it belongs to; rows are re-aligned on it.
     *
     * @throws com.tessera.error.QueryExecutionException if inference fails
     */
    ResultTable predict(ResultTable input);
}
