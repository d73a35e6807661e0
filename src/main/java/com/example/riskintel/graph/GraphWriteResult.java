package com.example.riskintel.graph;

import com.example.riskintel.domain.ProcessingError;

import java.util.List;

/**
 * Outcome of a graph write. A rejected write leaves the graph and its version unchanged.
 * An accepted bulk load may still carry errors for the items it excluded.
 */
public record GraphWriteResult(boolean accepted, long version, List<ProcessingError> errors) {

    public static GraphWriteResult accepted(long version, List<ProcessingError> errors) {
        return new GraphWriteResult(true, version, List.copyOf(errors));
    }

    public static GraphWriteResult rejected(long version, List<ProcessingError> errors) {
        return new GraphWriteResult(false, version, List.copyOf(errors));
    }
}
