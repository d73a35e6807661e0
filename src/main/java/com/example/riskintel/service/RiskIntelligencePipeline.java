package com.example.riskintel.service;

import com.example.riskintel.dedup.DedupResult;
import com.example.riskintel.dedup.DeduplicationEngine;
import com.example.riskintel.dedup.EventValidationException;
import com.example.riskintel.dedup.EventValidator;
import com.example.riskintel.domain.EntityNode;
import com.example.riskintel.domain.ErrorType;
import com.example.riskintel.domain.EventStatus;
import com.example.riskintel.domain.ProcessingError;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.graph.DependencyGraphStore;
import com.example.riskintel.graph.GraphSnapshot;
import com.example.riskintel.propagation.BlastRadiusService;
import com.example.riskintel.propagation.PropagationOptions;
import com.example.riskintel.propagation.PropagationResult;
import com.example.riskintel.scoring.RiskContext;
import com.example.riskintel.scoring.ScoreBreakdown;
import com.example.riskintel.scoring.ScoringService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;

/**
 * Validation → dedup → scoring → blast radius for each incoming event.
 * <p>
 * Only validation stops an event. Every later problem is attached to the event's error log
 * and the event still reaches ENRICHED. A merge into an enriched event sends it back
 * through scoring with the updated duplicate count and confidence.
 */
@Slf4j
@Service
public class RiskIntelligencePipeline {

    private static final String ACTOR = "pipeline";

    private final EventValidator validator;
    private final DeduplicationEngine deduplicationEngine;
    private final RiskEventStore eventStore;
    private final RiskContextProvider contextProvider;
    private final ScoringService scoringService;
    private final BlastRadiusService blastRadiusService;
    private final DependencyGraphStore graphStore;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Counter createdCounter;
    private final Counter mergedCounter;
    private final Counter rejectedCounter;

    public RiskIntelligencePipeline(EventValidator validator,
                                    DeduplicationEngine deduplicationEngine,
                                    RiskEventStore eventStore,
                                    RiskContextProvider contextProvider,
                                    ScoringService scoringService,
                                    BlastRadiusService blastRadiusService,
                                    DependencyGraphStore graphStore,
                                    AuditService auditService,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.validator = validator;
        this.deduplicationEngine = deduplicationEngine;
        this.eventStore = eventStore;
        this.contextProvider = contextProvider;
        this.scoringService = scoringService;
        this.blastRadiusService = blastRadiusService;
        this.graphStore = graphStore;
        this.auditService = auditService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.createdCounter = Counter.builder("riskintel.events.ingested").tag("action", "created").register(meterRegistry);
        this.mergedCounter = Counter.builder("riskintel.events.ingested").tag("action", "merged").register(meterRegistry);
        this.rejectedCounter = Counter.builder("riskintel.events.rejected").register(meterRegistry);
    }

    public IngestionResult ingest(RiskEvent raw) {
        try {
            validator.validate(raw);
        } catch (EventValidationException e) {
            rejectedCounter.increment();
            log.warn("Rejected event from {}: {}", raw != null && raw.getSource() != null ? raw.getSource().system() : "unknown",
                    e.getViolations());
            auditService.log(ACTOR, "EVENT_REJECTED", raw != null && raw.getSource() != null ? raw.getSource().originalId() : null,
                    Map.of("violations", e.getViolations()), raw != null ? raw.getCorrelationId() : null, false);
            return IngestionResult.rejected(e.getViolations());
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        DedupResult dedup = deduplicationEngine.deduplicate(raw);
        RiskEvent event;
        if (dedup.created()) {
            createdCounter.increment();
            event = eventStore.create(dedup.event(), deduplicationEngine.windowClosesAt(dedup.fingerprint()));
            auditService.log("dedup", "EVENT_CREATED", event.getId(),
                    Map.of("fingerprint", dedup.fingerprint(), "eventType", event.getEventType()),
                    event.getCorrelationId(), true);
        } else {
            mergedCounter.increment();
            event = eventStore.applyMerge(dedup.event(), null);
            auditService.log("dedup", "EVENT_MERGED", event.getId(),
                    Map.of("fingerprint", dedup.fingerprint(), "duplicateCount", dedup.duplicateCount()),
                    event.getCorrelationId(), true);
        }
        IngestionResult.Status status = dedup.created() ? IngestionResult.Status.CREATED : IngestionResult.Status.MERGED;

        Optional<RiskEvent> processing = eventStore.transition(event.getId(), EventStatus.PROCESSING);
        if (processing.isEmpty()) {
            log.debug("Event {} is {}; merge recorded without rescoring", event.getId(), event.status());
            sample.stop(meterRegistry.timer("riskintel.events.processing.duration", "rescored", "false"));
            return new IngestionResult(status, event.getId(), dedup.fingerprint(), dedup.duplicateCount(),
                    List.of(), event, eventStore.latestBreakdown(event.getId()).orElse(null), List.of(), false);
        }

        RiskEvent current = processing.get();
        ScoreBreakdown breakdown = null;
        List<PropagationResult> blastRadius = new ArrayList<>();
        List<ProcessingError> errors = new ArrayList<>();
        try {
            GraphSnapshot graph = graphStore.snapshot();
            RiskContext context = withGraphCriticality(contextProvider.contextFor(current), current, graph);
            breakdown = scoringService.score(current, context);
            eventStore.recordBreakdown(current.getId(), breakdown);
            errors.addAll(breakdown.getExplanation());

            PropagationOptions options = blastRadiusService.defaultOptions();
            for (String entityId : current.getAffectedEntities().graphEntityIds()) {
                if (!graph.containsNode(entityId)) {
                    errors.add(ProcessingError.of(ErrorType.DATA_UNAVAILABLE, "propagation",
                            "affected entity " + entityId + " is not in the dependency graph", clock.instant()));
                    continue;
                }
                PropagationResult result = blastRadiusService
                        .requestBlastRadius(entityId, breakdown.getFinalScore(), options)
                        .immediate();
                blastRadius.add(result);
                errors.addAll(result.getErrors());
            }
        } catch (RuntimeException e) {
            log.error("Processing failed for event {}: {}", current.getId(), e.getMessage());
            errors.add(ProcessingError.of(ErrorType.COMPUTATION_FAILURE, ACTOR, e.getMessage(), clock.instant()));
        }

        eventStore.attachErrors(current.getId(), errors);
        RiskEvent enriched = eventStore.transition(current.getId(), EventStatus.ENRICHED).orElse(current);
        sample.stop(meterRegistry.timer("riskintel.events.processing.duration", "rescored", "true"));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("duplicateCount", enriched.getDuplicateCount());
        details.put("impactedEntities", blastRadius.stream().mapToInt(PropagationResult::getTotalAffectedServices).sum());
        details.put("degradations", errors.size());
        if (breakdown != null) {
            details.put("finalScore", breakdown.getFinalScore());
            details.put("riskLevel", breakdown.getRiskLevel().name());
            details.put("calculationId", breakdown.getCalculationId());
        }
        auditService.log("scoring", "EVENT_SCORED", enriched.getId(), details, enriched.getCorrelationId(), breakdown != null);

        log.info("Event {} {} (x{}) score={} entities={}", enriched.getId(), status, enriched.getDuplicateCount(),
                breakdown != null ? String.format("%.1f", breakdown.getFinalScore()) : "n/a", blastRadius.size());
        return new IngestionResult(status, enriched.getId(), dedup.fingerprint(), dedup.duplicateCount(),
                List.of(), enriched, breakdown, List.copyOf(blastRadius), true);
    }

    @Async("ingestionExecutor")
    public CompletableFuture<IngestionResult> ingestAsync(RiskEvent raw) {
        return CompletableFuture.completedFuture(ingest(raw));
    }

    /** Uses the highest criticality among affected graph entities when the context has none. */
    static RiskContext withGraphCriticality(RiskContext context, RiskEvent event, GraphSnapshot graph) {
        if (context.getAssetCriticality() != null || event.getAffectedEntities() == null) {
            return context;
        }
        OptionalInt highest = event.getAffectedEntities().graphEntityIds().stream()
                .map(graph::getNode)
                .flatMap(Optional::stream)
                .mapToInt(EntityNode::criticality)
                .max();
        return highest.isPresent() ? context.withAssetCriticality(highest.getAsInt()) : context;
    }
}
