package com.example.riskintel.scoring;

public enum AdjustmentKind {
    ADDITIVE,
    MULTIPLICATIVE,
    /** No score change: skipped factor or a note on the base score. */
    INFORMATIONAL,
    /** Scoring failed and fell back to the base score. */
    COMPUTATION_FAILURE
}
