package com.example.riskintel.dedup;

public enum DedupAction {
    CREATED,
    MERGED
}
