package com.example.riskintel.service;

import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.RiskContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the latest context pushed by the analytics collaborator, per event type and per
 * entity. Entity-level values override event-type values field by field; among several
 * affected entities the first one (services before assets, sorted) wins.
 */
@Slf4j
@Component
public class InMemoryRiskContextProvider implements RiskContextProvider {

    private final Map<String, RiskContext> byEventType = new ConcurrentHashMap<>();
    private final Map<String, RiskContext> byEntity = new ConcurrentHashMap<>();

    public void putForEventType(String eventType, RiskContext context) {
        byEventType.put(eventType.trim().toLowerCase(Locale.ROOT), context);
        log.debug("Risk context updated for event type {}", eventType);
    }

    public void putForEntity(String entityId, RiskContext context) {
        byEntity.put(entityId.trim(), context);
        log.debug("Risk context updated for entity {}", entityId);
    }

    @Override
    public RiskContext contextFor(RiskEvent event) {
        String eventType = event.getEventType() == null ? "" : event.getEventType().trim().toLowerCase(Locale.ROOT);
        RiskContext merged = byEventType.getOrDefault(eventType, RiskContext.empty());
        if (event.getAffectedEntities() == null) {
            return merged;
        }
        List<String> entityIds = event.getAffectedEntities().graphEntityIds();
        for (int i = entityIds.size() - 1; i >= 0; i--) {
            RiskContext entity = byEntity.get(entityIds.get(i));
            if (entity != null) {
                merged = overlay(merged, entity);
            }
        }
        return merged;
    }

    static RiskContext overlay(RiskContext base, RiskContext override) {
        return base.toBuilder()
                .assetCriticality(pick(override.getAssetCriticality(), base.getAssetCriticality()))
                .knownExploited(pick(override.getKnownExploited(), base.getKnownExploited()))
                .threatIntel(pick(override.getThreatIntel(), base.getThreatIntel()))
                .history(pick(override.getHistory(), base.getHistory()))
                .environment(pick(override.getEnvironment(), base.getEnvironment()))
                .dataQuality(pick(override.getDataQuality(), base.getDataQuality()))
                .build();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
