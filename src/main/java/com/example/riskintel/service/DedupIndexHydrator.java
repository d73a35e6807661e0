package com.example.riskintel.service;

import com.example.riskintel.dedup.DedupAction;
import com.example.riskintel.dedup.DedupEntry;
import com.example.riskintel.dedup.DedupIndex;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.domain.RiskEventRecord;
import com.example.riskintel.repository.RiskEventRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Rebuilds the dedup index from register rows whose window is still open, so duplicates
 * arriving shortly after a restart still merge.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedupIndexHydrator {

    private final RiskEventRecordRepository repository;
    private final DedupIndex dedupIndex;
    private final RiskEventStore eventStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void hydrate() {
        List<RiskEventRecord> open = repository.findByWindowClosesAtAfter(clock.instant());
        int loaded = 0;
        for (RiskEventRecord record : open) {
            try {
                RiskEvent event = objectMapper.readValue(record.getPayload(), RiskEvent.class);
                if (dedupIndex.putIfAbsent(new DedupEntry(record.getFingerprint(), event,
                        record.getWindowClosesAt(), DedupAction.CREATED))) {
                    eventStore.restore(event);
                    loaded++;
                }
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable register row {}: {}", record.getId(), e.getOriginalMessage());
            }
        }
        log.info("Dedup index hydrated with {} open windows (of {} register rows)", loaded, open.size());
    }
}
