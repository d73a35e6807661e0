package com.example.riskintel.domain;

/**
 * Directed dependency: a problem in {@code parentId} flows downstream to {@code childId}.
 *
 * @param impactMultiplier         0.1 to 5.0, scales downstream propagation
 * @param reliabilityFactor        0 to 1, likelihood the dependency actually transmits impact
 * @param reversePropagationFactor 0 to 1, scales upstream propagation from child to parent
 */
public record DependencyEdge(String parentId, String childId, double impactMultiplier,
                             double reliabilityFactor, double reversePropagationFactor,
                             DependencyType dependencyType) {

    public DependencyEdge {
        if (dependencyType == null) dependencyType = DependencyType.IMPORTANT;
    }

    public String key() {
        return parentId + "->" + childId;
    }
}
