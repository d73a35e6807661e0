package com.example.riskintel.domain;

public enum ErrorType {
    /** Malformed or missing required event field. The only type that halts an event. */
    VALIDATION,
    /** A scoring factor's input was missing; the factor was skipped. */
    DATA_UNAVAILABLE,
    /** An edge references an unknown node; the edge was excluded. */
    GRAPH_INCONSISTENCY,
    /** Propagation ran out of its step or time budget; the result is partial. */
    BUDGET_EXCEEDED,
    /** Unexpected scoring failure; the score fell back to the base score. */
    COMPUTATION_FAILURE
}
