package com.example.riskintel.service;

import com.example.riskintel.config.AppConfig;
import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.EventStatus;
import com.example.riskintel.domain.ErrorType;
import com.example.riskintel.domain.ProcessingError;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.domain.RiskEventRecord;
import com.example.riskintel.domain.RiskLevel;
import com.example.riskintel.repository.RiskEventRecordRepository;
import com.example.riskintel.scoring.ScoreBreakdown;
import com.example.riskintel.support.MutableClock;
import com.example.riskintel.support.TestEvents;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RiskEventStoreTest {

    private RiskEventRecordRepository repository;
    private AuditService auditService;
    private RiskIntelProperties properties;
    private MutableClock clock;
    private ObjectMapper objectMapper;
    private RiskEventStore store;

    @BeforeEach
    void setUp() {
        repository = mock(RiskEventRecordRepository.class);
        auditService = mock(AuditService.class);
        properties = new RiskIntelProperties();
        clock = new MutableClock(TestEvents.T0);
        objectMapper = new AppConfig().objectMapper();
        store = new RiskEventStore(repository, objectMapper, properties, auditService, clock);
    }

    private static ScoreBreakdown breakdown(double score) {
        return ScoreBreakdown.builder().eventId("evt-1").finalScore(score).riskLevel(RiskLevel.MEDIUM).build();
    }

    @Test
    void createRegistersAndWritesThrough() {
        Instant closes = TestEvents.T0.plus(Duration.ofHours(24));

        store.create(TestEvents.scored(3, 80), closes);

        assertTrue(store.get("evt-1").isPresent());
        ArgumentCaptor<RiskEventRecord> saved = ArgumentCaptor.forClass(RiskEventRecord.class);
        verify(repository).save(saved.capture());
        assertEquals(EventStatus.PENDING, saved.getValue().getStatus());
        assertEquals(closes, saved.getValue().getWindowClosesAt());
        assertEquals("fp-1", saved.getValue().getFingerprint());
    }

    @Test
    void mergeKeepsRegisterLifecycleState() {
        store.create(TestEvents.scored(3, 80), TestEvents.T0);
        store.transition("evt-1", EventStatus.PROCESSING);
        store.transition("evt-1", EventStatus.ENRICHED);

        RiskEvent merged = TestEvents.scored(3, 80).toBuilder().duplicateCount(2).build();
        RiskEvent updated = store.applyMerge(merged, TestEvents.T0);

        assertEquals(2, updated.getDuplicateCount());
        assertEquals(EventStatus.ENRICHED, updated.status());
    }

    @Test
    void illegalTransitionIsRefused() {
        store.create(TestEvents.scored(3, 80), TestEvents.T0);

        assertTrue(store.transition("evt-1", EventStatus.ENRICHED).isEmpty());
        assertEquals(EventStatus.PENDING, store.get("evt-1").orElseThrow().status());
        assertTrue(store.transition("unknown", EventStatus.PROCESSING).isEmpty());
    }

    @Test
    void errorsAccumulateOnTheEvent() {
        store.create(TestEvents.scored(3, 80), TestEvents.T0);
        ProcessingError error = ProcessingError.of(ErrorType.DATA_UNAVAILABLE, "scoring", "threat intel", TestEvents.T0);

        store.attachErrors("evt-1", List.of(error));
        RiskEvent event = store.attachErrors("evt-1", List.of(error)).orElseThrow();

        assertEquals(2, event.getProcessingState().getErrorLog().size());
    }

    @Test
    void breakdownHistoryIsBoundedNewestFirst() {
        properties.getEvents().setMaxBreakdownHistory(2);
        store.create(TestEvents.scored(3, 80), TestEvents.T0);

        store.recordBreakdown("evt-1", breakdown(10));
        store.recordBreakdown("evt-1", breakdown(20));
        store.recordBreakdown("evt-1", breakdown(30));

        List<ScoreBreakdown> history = store.breakdowns("evt-1");
        assertEquals(2, history.size());
        assertEquals(30.0, history.get(0).getFinalScore());
        assertEquals(20.0, history.get(1).getFinalScore());
        assertEquals(30.0, store.latestBreakdown("evt-1").orElseThrow().getFinalScore());
    }

    @Test
    void listFiltersByStatusNewestFirst() {
        store.create(TestEvents.scored(3, 80), TestEvents.T0);
        store.create(TestEvents.scored(3, 80).toBuilder().id("evt-2").lastSeenAt(TestEvents.T0.plusSeconds(60)).build(),
                TestEvents.T0);
        store.transition("evt-1", EventStatus.PROCESSING);

        assertEquals(List.of("evt-2", "evt-1"), store.list(null).stream().map(RiskEvent::getId).toList());
        assertEquals(List.of("evt-1"), store.list(EventStatus.PROCESSING).stream().map(RiskEvent::getId).toList());
    }

    @Test
    void staleEventsAreArchived() {
        store.create(TestEvents.scored(3, 80), TestEvents.T0);
        store.create(TestEvents.scored(3, 80).toBuilder().id("evt-2").lastSeenAt(TestEvents.T0.plus(Duration.ofDays(20))).build(),
                TestEvents.T0);
        clock.set(TestEvents.T0.plus(Duration.ofDays(31)));

        assertEquals(1, store.archiveExpired());

        assertEquals(EventStatus.ARCHIVED, store.get("evt-1").orElseThrow().status());
        assertEquals(EventStatus.PENDING, store.get("evt-2").orElseThrow().status());
        verify(auditService).log(eq("pipeline"), eq("EVENT_ARCHIVED"), eq("evt-1"), anyMap());
        assertEquals(0, store.archiveExpired());
    }

    @Test
    void registerFailureKeepsInMemoryCopy() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("disk full"));

        store.create(TestEvents.scored(3, 80), TestEvents.T0);

        assertEquals(1, store.size());
        assertTrue(store.get("evt-1").isPresent());
    }

    @Test
    void unknownEventIsLoadedFromTheRegister() throws Exception {
        RiskEvent stored = TestEvents.scored(2, 60).toBuilder().id("evt-old").build();
        RiskEventRecord record = RiskEventRecord.builder()
                .id("evt-old")
                .payload(objectMapper.writeValueAsString(stored))
                .build();
        when(repository.findById("evt-old")).thenReturn(Optional.of(record));

        assertEquals(stored, store.get("evt-old").orElseThrow());
        assertTrue(store.get("evt-missing").isEmpty());
    }
}
