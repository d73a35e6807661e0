package com.example.riskintel.scoring;

import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.RiskContext.DataQuality;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives score confidence from the event's own confidence and the source's data quality.
 * Missing quality indicators are reported as notes, never defaulted silently.
 */
@Component
public class ConfidenceCalculator {

    public record ConfidenceAssessment(double confidence, List<String> notes) {
    }

    public ConfidenceAssessment assess(RiskEvent event, RiskContext context) {
        List<String> notes = new ArrayList<>();
        double confidence = event.getConfidence() != null ? event.getConfidence() : 0.0;
        if (event.getConfidence() == null) {
            notes.add("event confidence unavailable");
        }

        DataQuality quality = context.getDataQuality();
        if (quality == null) {
            notes.add("data quality unavailable");
        } else {
            if (quality.sourceReliability() != null) {
                confidence *= unit(quality.sourceReliability());
            } else {
                notes.add("source reliability unavailable");
            }
            if (quality.completeness() != null) {
                confidence *= unit(quality.completeness());
            } else {
                notes.add("completeness unavailable");
            }
        }
        return new ConfidenceAssessment(Math.max(0.0, Math.min(100.0, confidence)), List.copyOf(notes));
    }

    private static double unit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
