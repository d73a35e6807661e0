package com.example.riskintel.service;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.EventStatus;
import com.example.riskintel.domain.ProcessingError;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.domain.RiskEventRecord;
import com.example.riskintel.repository.RiskEventRecordRepository;
import com.example.riskintel.scoring.ScoreBreakdown;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event register. The in-memory map is authoritative for running events; every change is
 * written through to {@link RiskEventRecord} rows so the register survives a restart.
 * Each event keeps a bounded history of its score breakdowns, newest first.
 */
@Slf4j
@Service
public class RiskEventStore {

    private final Map<String, RiskEvent> events = new ConcurrentHashMap<>();
    private final Map<String, Deque<ScoreBreakdown>> breakdowns = new ConcurrentHashMap<>();

    private final RiskEventRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final RiskIntelProperties properties;
    private final AuditService auditService;
    private final Clock clock;

    public RiskEventStore(RiskEventRecordRepository repository, ObjectMapper objectMapper,
                          RiskIntelProperties properties, AuditService auditService, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.auditService = auditService;
        this.clock = clock;
    }

    /** Registers a newly created event. */
    public RiskEvent create(RiskEvent event, Instant windowClosesAt) {
        events.put(event.getId(), event);
        persist(event, windowClosesAt, null);
        return event;
    }

    /** Re-registers an event loaded from the durable register at startup. */
    public void restore(RiskEvent event) {
        events.putIfAbsent(event.getId(), event);
    }

    /**
     * Takes the merge fields from the dedup index copy and keeps this register's lifecycle
     * state, which the index does not track.
     */
    public RiskEvent applyMerge(RiskEvent merged, Instant windowClosesAt) {
        RiskEvent updated = events.compute(merged.getId(), (id, current) -> current == null
                ? merged
                : merged.toBuilder().processingState(current.getProcessingState()).build());
        persist(updated, windowClosesAt, null);
        return updated;
    }

    /**
     * Moves an event along its lifecycle.
     *
     * @return the updated event, or empty when the move is not allowed from the current state
     */
    public Optional<RiskEvent> transition(String eventId, EventStatus next) {
        RiskEvent[] result = new RiskEvent[1];
        events.computeIfPresent(eventId, (id, current) -> {
            if (!current.status().canTransitionTo(next)) {
                return current;
            }
            result[0] = current.transitionTo(next);
            return result[0];
        });
        if (result[0] != null) {
            persist(result[0], null, null);
        }
        return Optional.ofNullable(result[0]);
    }

    public Optional<RiskEvent> attachErrors(String eventId, List<ProcessingError> errors) {
        if (errors.isEmpty()) return get(eventId);
        RiskEvent updated = events.computeIfPresent(eventId, (id, current) -> current.withErrors(errors));
        if (updated != null) {
            persist(updated, null, null);
        }
        return Optional.ofNullable(updated);
    }

    public void recordBreakdown(String eventId, ScoreBreakdown breakdown) {
        int limit = Math.max(1, properties.getEvents().getMaxBreakdownHistory());
        breakdowns.compute(eventId, (id, history) -> {
            Deque<ScoreBreakdown> next = history == null ? new ArrayDeque<>() : history;
            next.addFirst(breakdown);
            while (next.size() > limit) {
                next.removeLast();
            }
            return next;
        });
        RiskEvent event = events.get(eventId);
        if (event != null) {
            persist(event, null, breakdown);
        }
    }

    public Optional<RiskEvent> get(String eventId) {
        RiskEvent event = events.get(eventId);
        if (event != null) {
            return Optional.of(event);
        }
        return loadRecord(eventId);
    }

    public List<RiskEvent> list(EventStatus status) {
        return events.values().stream()
                .filter(e -> status == null || e.status() == status)
                .sorted(Comparator.comparing(RiskEvent::getLastSeenAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /** Newest first. */
    public List<ScoreBreakdown> breakdowns(String eventId) {
        Deque<ScoreBreakdown> history = breakdowns.get(eventId);
        return history == null ? List.of() : List.copyOf(history);
    }

    public Optional<ScoreBreakdown> latestBreakdown(String eventId) {
        return breakdowns(eventId).stream().findFirst();
    }

    public int size() {
        return events.size();
    }

    /** Archives events not seen for longer than the retention period. */
    @Scheduled(fixedDelayString = "${risk-intel.events.archive-interval-ms:3600000}")
    public int archiveExpired() {
        Instant cutoff = clock.instant().minus(properties.getEvents().getRetention());
        int archived = 0;
        for (RiskEvent event : List.copyOf(events.values())) {
            if (event.status() == EventStatus.ARCHIVED || event.getLastSeenAt() == null
                    || !event.getLastSeenAt().isBefore(cutoff)) {
                continue;
            }
            if (transition(event.getId(), EventStatus.ARCHIVED).isPresent()) {
                archived++;
                auditService.log("pipeline", "EVENT_ARCHIVED", event.getId(),
                        Map.of("lastSeenAt", event.getLastSeenAt().toString()));
            }
        }
        if (archived > 0) {
            log.info("Archived {} events last seen before {}", archived, cutoff);
        }
        return archived;
    }

    private void persist(RiskEvent event, Instant windowClosesAt, ScoreBreakdown breakdown) {
        try {
            RiskEventRecord record = repository.findById(event.getId()).orElseGet(RiskEventRecord::new);
            record.setId(event.getId());
            record.setFingerprint(event.getFingerprint());
            record.setEventType(event.getEventType());
            record.setStatus(event.status());
            record.setSeverity(event.getSeverity());
            record.setDuplicateCount(event.getDuplicateCount());
            record.setFirstSeenAt(event.getFirstSeenAt());
            record.setLastSeenAt(event.getLastSeenAt());
            record.setPayload(objectMapper.writeValueAsString(event));
            if (windowClosesAt != null) {
                record.setWindowClosesAt(windowClosesAt);
            }
            if (breakdown != null) {
                record.setFinalScore(breakdown.getFinalScore());
                record.setRiskLevel(breakdown.getRiskLevel());
                record.setLatestBreakdown(objectMapper.writeValueAsString(breakdown));
            }
            repository.save(record);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize event {} for the register: {}", event.getId(), e.getOriginalMessage());
        } catch (DataAccessException e) {
            log.warn("Register write failed for event {}, keeping in-memory copy: {}", event.getId(), e.getMessage());
        }
    }

    private Optional<RiskEvent> loadRecord(String eventId) {
        try {
            Optional<RiskEventRecord> record = repository.findById(eventId);
            if (record.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(record.get().getPayload(), RiskEvent.class));
        } catch (JsonProcessingException e) {
            log.error("Unreadable register row for event {}: {}", eventId, e.getOriginalMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Register read failed for event {}: {}", eventId, e.getMessage());
            return Optional.empty();
        }
    }
}
