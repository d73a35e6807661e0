package com.example.riskintel.cache;

/**
 * Invalidation pattern: an exact key, or a prefix when it ends in {@code *}.
 * No other wildcards are recognised.
 */
public record CachePattern(String value) {

    public CachePattern {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Cache pattern must not be empty");
        }
    }

    public static CachePattern of(String value) {
        return new CachePattern(value);
    }

    public boolean isPrefix() {
        return value.endsWith("*");
    }

    public String prefix() {
        return isPrefix() ? value.substring(0, value.length() - 1) : value;
    }

    public boolean matches(String key) {
        return isPrefix() ? key.startsWith(prefix()) : key.equals(value);
    }
}
