package com.example.riskintel.propagation;

import java.util.List;

public record CriticalPath(String entityId, List<String> path, double score, int criticality, double businessValue) {
}
