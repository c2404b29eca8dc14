package com.tessera.predictor.process;

import com.tessera.domain.PredictorDescriptor;
import com.tessera.domain.ResultTable;
import com.tessera.predictor.Predictor;

import java.util.Map;

/**
 * Predictor whose inference runs in a worker process
 */
public class ProcessPredictor implements Predictor {

    private final PredictorDescriptor descriptor;
    private final WorkerProcess worker;

    public ProcessPredictor(PredictorDescriptor descriptor, WorkerProcess worker) {
        this.descriptor = descriptor;
        this.worker = worker;
    }

    @Override
    public PredictorDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public ResultTable predict(ResultTable input) {
        WorkerRequest request = new WorkerRequest("predict", descriptor.getName(), input.getColumns(),
            WorkerProcess.toRows(input), Map.of("targets", descriptor.getTargets()));
        return WorkerProcess.toTable(worker.call(request));
    }

    @Override
    public String toString() {
        return "ProcessPredictor{" + descriptor.getName() + ", " + worker + "}";
    }
}
