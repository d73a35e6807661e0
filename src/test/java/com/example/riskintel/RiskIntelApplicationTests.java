package com.example.riskintel;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.AffectedEntities;
import com.example.riskintel.domain.DependencyEdge;
import com.example.riskintel.domain.EntityNode;
import com.example.riskintel.domain.EventSource;
import com.example.riskintel.domain.EventStatus;
import com.example.riskintel.domain.NodeType;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.domain.RiskLevel;
import com.example.riskintel.graph.DependencyGraphStore;
import com.example.riskintel.propagation.PropagationResult;
import com.example.riskintel.scoring.RiskContext;
import com.example.riskintel.service.InMemoryRiskContextProvider;
import com.example.riskintel.service.IngestionResult;
import com.example.riskintel.service.RiskEventStore;
import com.example.riskintel.service.RiskIntelligencePipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RiskIntelApplicationTests {

    @Autowired
    private RiskIntelProperties properties;

    @Autowired
    private RiskIntelligencePipeline pipeline;

    @Autowired
    private DependencyGraphStore graphStore;

    @Autowired
    private InMemoryRiskContextProvider contextProvider;

    @Autowired
    private RiskEventStore eventStore;

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void loadGraph() {
        graphStore.replaceGraph(
                List.of(new EntityNode("payments-api", "Payments API", NodeType.SERVICE, 10, 50_000, 1200),
                        new EntityNode("ledger", "Ledger", NodeType.SERVICE, 9, 80_000, 300),
                        new EntityNode("notifications", "Notifications", NodeType.SERVICE, 4, 2_000, 5000)),
                List.of(new DependencyEdge("payments-api", "ledger", 0.8, 1.0, 0.3, null),
                        new DependencyEdge("payments-api", "notifications", 0.5, 1.0, 0.3, null)));
        contextProvider.putForEntity("payments-api", RiskContext.builder().knownExploited(true).build());
    }

    private static RiskEvent vulnerability(String originalId, int severity, double confidence) {
        return vulnerability(originalId, severity, confidence, Instant.now());
    }

    private static RiskEvent vulnerability(String originalId, int severity, double confidence, Instant occurredAt) {
        return RiskEvent.builder()
                .eventType("vulnerability")
                .severity(severity)
                .confidence(confidence)
                .source(new EventSource("scanner", originalId))
                .affectedEntities(new AffectedEntities(List.of("payments-api"), List.of(), List.of(), List.of()))
                .occurredAt(occurredAt)
                .rawPayload(Map.of("cveId", originalId))
                .build();
    }

    @Test
    void configurationIsLoaded() {
        assertEquals(85.0, properties.getScoring().getBands().getCritical());
        assertEquals(3, properties.getPropagation().getMaxDepth());
        assertNotNull(properties.getDedup().policyFor("telemetry"));
    }

    @Test
    void exploitedVulnerabilityIsScoredAndPropagated() {
        IngestionResult result = pipeline.ingest(vulnerability("CVE-" + UUID.randomUUID(), 4, 95.0));

        assertEquals(IngestionResult.Status.CREATED, result.status());
        assertTrue(result.rescored());
        assertTrue(result.score().getFinalScore() > 80);
        assertEquals(RiskLevel.CRITICAL, result.score().getRiskLevel());
        assertEquals(1, result.blastRadius().size());

        PropagationResult blast = result.blastRadius().get(0);
        assertEquals(3, blast.getTotalAffectedServices());
        double sourceScore = blast.getSourceScore();
        assertTrue(blast.getImpacts().get("ledger").propagatedScore() < sourceScore);
        assertTrue(blast.getImpacts().get("notifications").propagatedScore() < sourceScore);

        RiskEvent stored = eventStore.get(result.eventId()).orElseThrow();
        assertEquals(EventStatus.ENRICHED, stored.status());
        assertEquals(1, eventStore.breakdowns(result.eventId()).size());
    }

    @Test
    void duplicateIsMergedAndRescored() {
        String originalId = "CVE-" + UUID.randomUUID();
        Instant occurredAt = Instant.now();
        IngestionResult first = pipeline.ingest(vulnerability(originalId, 3, 60.0, occurredAt));
        IngestionResult second = pipeline.ingest(vulnerability(originalId, 3, 90.0, occurredAt));

        assertEquals(IngestionResult.Status.MERGED, second.status());
        assertEquals(first.eventId(), second.eventId());
        assertEquals(2, second.duplicateCount());
        assertTrue(second.rescored());
        assertEquals(90.0, second.event().getConfidence());
        assertEquals(2, eventStore.breakdowns(first.eventId()).size());
        assertTrue(second.score().getFinalScore() > first.score().getFinalScore());
    }

    @Test
    void invalidEventIsRejected() {
        IngestionResult result = pipeline.ingest(vulnerability("CVE-" + UUID.randomUUID(), 9, 50.0));

        assertTrue(result.isRejected());
        assertNull(result.eventId());
        assertFalse(result.violations().isEmpty());
    }

    @Test
    void eventsApiIngestsAndServesBreakdowns() throws Exception {
        String body = """
                {
                  "eventType": "vulnerability",
                  "severity": 4,
                  "confidence": 95,
                  "source": {"system": "scanner", "originalId": "%s"},
                  "affectedEntities": {"services": ["payments-api"]},
                  "occurredAt": "%s"
                }
                """.formatted("api-" + UUID.randomUUID(), Instant.now());

        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("CREATED"))
                .andExpect(jsonPath("$.blastRadius[0].isApproximate").value(false));

        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\": \"vulnerability\", \"severity\": 0}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("REJECTED"));

        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_JSON"));

        mockMvc.perform(get("/api/events/does-not-exist"))
                .andExpect(status().isNotFound());
    }

    @Test
    void blastRadiusApiUsesTheGraph() throws Exception {
        mockMvc.perform(get("/api/blast-radius").param("source", "payments-api").param("score", "90"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAffectedServices").value(3))
                .andExpect(jsonPath("$.sourceEntityId").value("payments-api"));
    }

    @Test
    void blastRadiusRejectsInvalidOptionOverrides() throws Exception {
        mockMvc.perform(get("/api/blast-radius").param("source", "payments-api").param("score", "90")
                        .param("decayFactor", "-0.5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
        mockMvc.perform(get("/api/blast-radius").param("source", "payments-api").param("score", "90")
                        .param("maxDepth", "-1"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/blast-radius").param("source", "payments-api").param("score", "90")
                        .param("criticalPathLimit", "-3"))
                .andExpect(status().isBadRequest());
    }
}
