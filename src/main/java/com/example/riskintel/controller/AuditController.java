package com.example.riskintel.controller;

import com.example.riskintel.domain.AuditLog;
import com.example.riskintel.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Audit Trail REST API Controller.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> getAuditLogs(
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String target,
            @RequestParam(defaultValue = "100") int limit) {
        if (actor == null && action == null && target == null) {
            return ResponseEntity.ok(auditService.getRecent(limit));
        }
        return ResponseEntity.ok(auditService.filter(actor, action, target));
    }

    @GetMapping("/correlation/{correlationId}")
    public ResponseEntity<List<AuditLog>> getByCorrelation(@PathVariable String correlationId) {
        return ResponseEntity.ok(auditService.getByCorrelationId(correlationId));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "events_created", auditService.countByAction("EVENT_CREATED"),
                "events_merged", auditService.countByAction("EVENT_MERGED"),
                "events_rejected", auditService.countByAction("EVENT_REJECTED"),
                "events_scored", auditService.countByAction("EVENT_SCORED"),
                "events_archived", auditService.countByAction("EVENT_ARCHIVED"),
                "graph_changes", auditService.countByAction("GRAPH_CHANGED")
        ));
    }
}
