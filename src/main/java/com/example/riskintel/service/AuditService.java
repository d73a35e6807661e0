package com.example.riskintel.service;

import com.example.riskintel.domain.AuditLog;
import com.example.riskintel.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit trail for the pipeline. Writes are asynchronous so ingestion never waits on them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    @Async("auditExecutor")
    public void log(String actor, String action, String target, Map<String, Object> details) {
        log(actor, action, target, details, null, true);
    }

    @Async("auditExecutor")
    public void log(String actor, String action, String target, Map<String, Object> details,
                    String correlationId, boolean success) {
        try {
            String detailsJson = details != null ? objectMapper.writeValueAsString(details) : null;
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .target(target)
                    .details(detailsJson)
                    .correlationId(correlationId)
                    .success(success)
                    .timestamp(Instant.now())
                    .build();
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {} ({})", actor, action, target, success ? "OK" : "FAIL");
        } catch (Exception e) {
            log.error("Failed to write audit log: {}", e.getMessage());
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, limit)).getContent();
    }

    public List<AuditLog> filter(String actor, String action, String target) {
        return auditLogRepository.findFiltered(actor, action, target);
    }

    public List<AuditLog> getByCorrelationId(String correlationId) {
        return auditLogRepository.findByCorrelationIdOrderByTimestampDesc(correlationId);
    }

    public long countByAction(String action) {
        return auditLogRepository.countByAction(action);
    }
}
