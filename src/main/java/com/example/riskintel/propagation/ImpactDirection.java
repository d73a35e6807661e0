package com.example.riskintel.propagation;

public enum ImpactDirection {
    SOURCE,
    DOWNSTREAM,
    UPSTREAM
}
