package com.example.riskintel.domain;

public enum DependencyType {
    CRITICAL,
    IMPORTANT,
    OPTIONAL
}
