package com.example.riskintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProcessingState {

    @Builder.Default
    EventStatus status = EventStatus.PENDING;

    @Builder.Default
    List<ProcessingError> errorLog = List.of();

    public static ProcessingState pending() {
        return ProcessingState.builder().build();
    }

    /**
     * @throws IllegalStateException when the lifecycle does not allow the move
     */
    public ProcessingState transitionTo(EventStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal event status transition " + status + " -> " + next);
        }
        return toBuilder().status(next).build();
    }

    public ProcessingState withErrors(List<ProcessingError> errors) {
        if (errors == null || errors.isEmpty()) return this;
        List<ProcessingError> merged = new ArrayList<>(errorLog);
        merged.addAll(errors);
        return toBuilder().errorLog(List.copyOf(merged)).build();
    }
}
