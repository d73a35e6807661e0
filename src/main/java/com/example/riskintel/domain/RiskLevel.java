package com.example.riskintel.domain;

public enum RiskLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
