package com.tessera.handler;

import com.tessera.domain.HandlerDescriptor;
import com.tessera.domain.HandlerResponse;
import com.tessera.domain.ResultTable;
import com.tessera.error.PlanningException;
import com.tessera.query.ast.SelectStatement;
import com.tessera.query.pushdown.PushdownAdapter;
import com.tessera.query.pushdown.StructuredQueryRunner;

/**
 * Handler whose structured queries go through the pushdown pipeline.
 *
 * Statements with aggregation are rendered natively when the handler supports
 * native queries and rejected otherwise.
 *
 * @param <Q> native request type
 */
public abstract class PushdownDataHandler<Q> extends AbstractDataHandler {

    private final StructuredQueryRunner runner;

    protected PushdownDataHandler(HandlerDescriptor descriptor, StructuredQueryRunner runner) {
        super(descriptor);
        this.runner = runner;
    }

    @Override
    protected ResultTable doRunStructured(SelectStatement select) throws Exception {
        if (select.hasAggregation()) {
            if (!descriptor.supportsNativeQuery()) {
                throw new PlanningException("Handler " + getName()
                    + " cannot evaluate GROUP BY, HAVING, DISTINCT or aggregates");
            }
            String nativeQuery = renderNative(select);
            HandlerResponse response = doRunNative(nativeQuery);
            if (response.isError()) {
                throw response.toException(getName(), nativeQuery);
            }
            return response.tableOrEmpty();
        }
        return runner.run(select, descriptor, pushdownAdapter(), this::fetch);
    }

    /**
     * Native translation used by the pushdown translator
     */
    protected abstract PushdownAdapter<Q> pushdownAdapter();

    /**
     * Execute a native request built by {@link #pushdownAdapter()}
     */
    protected abstract ResultTable fetch(Q request) throws Exception;

    /**
     * Render a whole statement in the native dialect; only called when native queries are supported
     */
    protected String renderNative(SelectStatement select) {
        throw new UnsupportedOperationException("Handler " + getName() + " cannot render native queries");
    }
}
