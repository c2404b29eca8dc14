package com.tessera.join;

/**
 * Stages of a predictor join. ERROR is reachable from every other state.
 */
public enum JoinState {
    IDENTIFY_SIDES,
    NON_TS_PLAN,
    TS_PLAN,
    FETCH,
    INFER,
    MERGE,
    PERSIST,
    DONE,
    ERROR
}
