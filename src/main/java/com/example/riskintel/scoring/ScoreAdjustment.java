package com.example.riskintel.scoring;

import java.util.Map;

/**
 * One audit entry in a score breakdown.
 *
 * @param rawScoreAfter   score after the adjustment, before clamping to [0, 100]
 * @param scoreAfter      clamped score handed to the next pass
 * @param contribution    {@code scoreAfter - scoreBefore}
 * @param rawContribution {@code rawScoreAfter - scoreBefore}
 */
public record ScoreAdjustment(String factor,
                              AdjustmentKind kind,
                              Map<String, Object> inputs,
                              double weight,
                              double scoreBefore,
                              double rawScoreAfter,
                              double scoreAfter,
                              double contribution,
                              double rawContribution,
                              String rationale,
                              String dataSource) {

    public boolean changedScore() {
        return contribution != 0.0;
    }
}
