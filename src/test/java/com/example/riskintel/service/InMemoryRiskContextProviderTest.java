package com.example.riskintel.service;

import com.example.riskintel.domain.AffectedEntities;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.RiskContext;
import com.example.riskintel.scoring.RiskContext.EnvironmentalContext;
import com.example.riskintel.scoring.RiskContext.ThreatIntelSignal;
import com.example.riskintel.support.TestEvents;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRiskContextProviderTest {

    private final InMemoryRiskContextProvider provider = new InMemoryRiskContextProvider();

    @Test
    void unknownEventGetsEmptyContext() {
        assertEquals(RiskContext.empty(), provider.contextFor(TestEvents.scored(2, 50)));
    }

    @Test
    void entityContextOverridesEventTypeFieldByField() {
        provider.putForEventType("Vulnerability", RiskContext.builder()
                .knownExploited(false)
                .threatIntel(new ThreatIntelSignal(1, 2))
                .build());
        provider.putForEntity("payments-api", RiskContext.builder()
                .knownExploited(true)
                .environment(new EnvironmentalContext(true, true, 1))
                .build());

        RiskContext context = provider.contextFor(TestEvents.scored(3, 80));

        assertEquals(Boolean.TRUE, context.getKnownExploited());
        assertEquals(new ThreatIntelSignal(1, 2), context.getThreatIntel());
        assertEquals(new EnvironmentalContext(true, true, 1), context.getEnvironment());
    }

    @Test
    void firstAffectedEntityWins() {
        provider.putForEntity("db-01", RiskContext.builder().assetCriticality(4).knownExploited(true).build());
        provider.putForEntity("payments-api", RiskContext.builder().assetCriticality(9).build());
        RiskEvent event = TestEvents.scored(3, 80).toBuilder()
                .affectedEntities(new AffectedEntities(List.of("payments-api"), List.of("db-01"), List.of(), List.of()))
                .build();

        RiskContext context = provider.contextFor(event);

        assertEquals(9, context.getAssetCriticality());
        assertEquals(Boolean.TRUE, context.getKnownExploited());
    }

    @Test
    void eventTypeLookupIgnoresCaseUnderTurkishLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            provider.putForEventType("VULNERABILITY", RiskContext.builder().knownExploited(true).build());

            RiskContext context = provider.contextFor(TestEvents.scored(3, 80).toBuilder().eventType("Vulnerability").build());

            assertEquals(Boolean.TRUE, context.getKnownExploited());
        } finally {
            Locale.setDefault(saved);
        }
    }
}
