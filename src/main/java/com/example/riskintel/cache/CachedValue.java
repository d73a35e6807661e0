package com.example.riskintel.cache;

import java.time.Instant;

/**
 * A JSON document read from a tier, with the expiry it was stored under.
 */
public record CachedValue(String json, Instant expiresAt) {
}
