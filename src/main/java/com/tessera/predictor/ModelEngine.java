package com.tessera.predictor;

import com.tessera.domain.ResultTable;
import com.tessera.query.ast.CreatePredictorStatement;

/**
 * Trains predictors from gathered data. Training itself happens outside the engine.
 */
public interface ModelEngine {

    /**
     * Name used in {@code USING engine = '...'}
     */
    String name();

    Predictor create(CreatePredictorStatement definition, ResultTable trainingData);

    Predictor retrain(Predictor current, CreatePredictorStatement definition, ResultTable trainingData);

    /**
     * Release whatever the engine holds for the predictor
     */
    void drop(String predictorName);
}
