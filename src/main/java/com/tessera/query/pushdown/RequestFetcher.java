package com.tessera.query.pushdown;

import com.tessera.domain.ResultTable;

/**
 * Executes a native request against the handler's back end
 *
 * @param <Q> native request type
 */
@FunctionalInterface
public interface RequestFetcher<Q> {

    ResultTable fetch(Q request) throws Exception;
}
