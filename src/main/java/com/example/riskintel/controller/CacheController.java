package com.example.riskintel.controller;

import com.example.riskintel.cache.TieredCache;
import com.example.riskintel.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final TieredCache cache;
    private final AuditService auditService;

    /**
     * Invalidate an exact key, or every key with a prefix when the pattern ends in '*'.
     */
    @DeleteMapping
    public Map<String, Object> invalidate(@RequestParam String pattern) {
        int removed = cache.invalidate(pattern);
        auditService.log("cache", "CACHE_INVALIDATED", pattern, Map.of("fastTierRemoved", removed));
        return Map.of("pattern", pattern, "fastTierRemoved", removed);
    }

    @GetMapping("/stats")
    public TieredCache.CacheStatistics stats() {
        return cache.statistics();
    }
}
