package com.example.riskintel.dedup;

import com.example.riskintel.domain.RiskEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the fields every connector must supply before an event may be fingerprinted.
 */
@Component
public class EventValidator {

    public void validate(RiskEvent event) {
        List<String> violations = new ArrayList<>();
        if (event == null) {
            throw new EventValidationException(List.of("event is required"));
        }
        if (isBlank(event.getEventType())) {
            violations.add("eventType is required");
        }
        if (event.getSeverity() == null) {
            violations.add("severity is required");
        } else if (event.getSeverity() < 1 || event.getSeverity() > 4) {
            violations.add("severity must be between 1 and 4, was " + event.getSeverity());
        }
        Double confidence = event.getConfidence();
        if (confidence == null) {
            violations.add("confidence is required");
        } else if (confidence.isNaN() || confidence < 0 || confidence > 100) {
            violations.add("confidence must be between 0 and 100, was " + confidence);
        }
        if (event.getSource() == null) {
            violations.add("source is required");
        } else {
            if (isBlank(event.getSource().system())) violations.add("source.system is required");
            if (isBlank(event.getSource().originalId())) violations.add("source.originalId is required");
        }
        if (event.getOccurredAt() == null) {
            violations.add("occurredAt is required");
        }
        if (!violations.isEmpty()) {
            throw new EventValidationException(violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
