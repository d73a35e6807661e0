package com.example.riskintel.controller;

import com.example.riskintel.domain.EventStatus;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.ScoreBreakdown;
import com.example.riskintel.service.IngestionResult;
import com.example.riskintel.service.RiskEventStore;
import com.example.riskintel.service.RiskIntelligencePipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Event ingestion and event register REST API.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final RiskIntelligencePipeline pipeline;
    private final RiskEventStore eventStore;

    /**
     * Ingest one event from a connector. 422 when validation rejects it.
     */
    @PostMapping
    public ResponseEntity<IngestionResult> ingest(@RequestBody RiskEvent event) {
        IngestionResult result = pipeline.ingest(event);
        if (result.isRejected()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        HttpStatus status = result.status() == IngestionResult.Status.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * Ingest a batch in parallel on the ingestion pool. Results keep the request order.
     */
    @PostMapping("/batch")
    public List<IngestionResult> ingestBatch(@RequestBody List<RiskEvent> events) {
        List<CompletableFuture<IngestionResult>> futures = events.stream()
                .map(pipeline::ingestAsync)
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /**
     * List events, optionally filtered by lifecycle status.
     */
    @GetMapping
    public List<RiskEvent> list(@RequestParam(required = false) EventStatus status) {
        return eventStore.list(status);
    }

    @GetMapping("/{id}")
    public ResponseEntity<RiskEvent> get(@PathVariable String id) {
        return eventStore.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Score breakdown history for an event, newest first.
     */
    @GetMapping("/{id}/scores")
    public ResponseEntity<List<ScoreBreakdown>> scores(@PathVariable String id) {
        if (eventStore.get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(eventStore.breakdowns(id));
    }
}
