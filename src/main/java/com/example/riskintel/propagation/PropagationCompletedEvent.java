package com.example.riskintel.propagation;

/**
 * Published when a background traversal has replaced an approximate estimate.
 */
public record PropagationCompletedEvent(String cacheKey, PropagationResult result) {
}
