package com.example.riskintel.scoring;

import java.util.Map;
import java.util.TreeMap;

/**
 * What a scoring pass decided, before the engine clamps and records it.
 */
public record PassResult(AdjustmentKind kind, Map<String, Object> inputs, double weight,
                         double rawScoreAfter, String rationale, String dataSource, boolean dataUnavailable) {

    public static final String DATA_UNAVAILABLE = "data unavailable";

    public static PassResult additive(double scoreBefore, double delta, Map<String, Object> inputs,
                                      String rationale, String dataSource) {
        return new PassResult(AdjustmentKind.ADDITIVE, new TreeMap<>(inputs), delta,
                scoreBefore + delta, rationale, dataSource, false);
    }

    public static PassResult multiplicative(double scoreBefore, double multiplier, Map<String, Object> inputs,
                                            String rationale, String dataSource) {
        return new PassResult(AdjustmentKind.MULTIPLICATIVE, new TreeMap<>(inputs), multiplier,
                scoreBefore * multiplier, rationale, dataSource, false);
    }

    /** Required input absent: no change, rationale "data unavailable". */
    public static PassResult unavailable(double scoreBefore, String missing) {
        return new PassResult(AdjustmentKind.INFORMATIONAL, new TreeMap<>(Map.of("missing", missing)), 0.0,
                scoreBefore, DATA_UNAVAILABLE, null, true);
    }

    /** Input present but not enough to act on. */
    public static PassResult noChange(double scoreBefore, Map<String, Object> inputs, String rationale, String dataSource) {
        return new PassResult(AdjustmentKind.INFORMATIONAL, new TreeMap<>(inputs), 0.0,
                scoreBefore, rationale, dataSource, false);
    }
}
