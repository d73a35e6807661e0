package com.example.riskintel.controller;

import com.example.riskintel.scoring.RiskContext;
import com.example.riskintel.service.InMemoryRiskContextProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Push surface for the analytics collaborator's historical and environmental signals.
 */
@RestController
@RequestMapping("/api/risk-context")
@RequiredArgsConstructor
public class RiskContextController {

    private final InMemoryRiskContextProvider contextProvider;

    @PutMapping("/event-types/{eventType}")
    public ResponseEntity<Void> putForEventType(@PathVariable String eventType, @RequestBody RiskContext context) {
        contextProvider.putForEventType(eventType, context);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/entities/{entityId}")
    public ResponseEntity<Void> putForEntity(@PathVariable String entityId, @RequestBody RiskContext context) {
        contextProvider.putForEntity(entityId, context);
        return ResponseEntity.noContent().build();
    }
}
