package com.example.riskintel.propagation;

import java.util.List;

/**
 * Impact recorded for one entity, from the strongest path that reached it.
 *
 * @param combinedScore  propagated score weighted by criticality, capped at 100
 * @param businessImpact business value scaled by the propagated score
 */
public record EntityImpact(String entityId,
                           String name,
                           double propagatedScore,
                           int depth,
                           List<String> path,
                           double combinedScore,
                           ImpactDirection direction,
                           int criticality,
                           double businessImpact) {
}
