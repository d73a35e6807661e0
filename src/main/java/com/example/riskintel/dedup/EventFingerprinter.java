package com.example.riskintel.dedup;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.config.RiskIntelProperties.EventTypePolicy;
import com.example.riskintel.domain.AffectedEntities;
import com.example.riskintel.domain.EventSource;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.util.CanonicalJson;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes events and derives their SHA-256 fingerprint from a canonical record of
 * the identifying fields plus the time bucket of {@code occurredAt}.
 */
@Component
@RequiredArgsConstructor
public class EventFingerprinter {

    private final RiskIntelProperties properties;

    public RiskEvent normalize(RiskEvent event) {
        EventSource source = event.getSource();
        AffectedEntities entities = event.getAffectedEntities() == null
                ? AffectedEntities.none()
                : event.getAffectedEntities().normalized();
        return event.toBuilder()
                .eventType(event.getEventType().trim().toLowerCase(Locale.ROOT))
                .source(new EventSource(source.system().trim().toLowerCase(Locale.ROOT), source.originalId().trim()))
                .affectedEntities(entities)
                .rawPayload(event.getRawPayload() == null ? Map.of() : event.getRawPayload())
                .build();
    }

    /** Expects an event already passed through {@link #normalize}. */
    public String fingerprint(RiskEvent normalized) {
        return CanonicalJson.sha256Hex(CanonicalJson.write(canonicalRecord(normalized)));
    }

    Map<String, Object> canonicalRecord(RiskEvent event) {
        EventTypePolicy policy = properties.getDedup().policyFor(event.getEventType());
        AffectedEntities entities = event.getAffectedEntities();

        Map<String, Object> keyMetadata = new TreeMap<>();
        for (String field : policy.getKeyMetadataFields()) {
            Object value = event.getRawPayload().get(field);
            keyMetadata.put(field, value instanceof String s ? s.trim() : value);
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("eventType", event.getEventType());
        record.put("severity", event.getSeverity());
        record.put("sourceSystem", event.getSource().system());
        record.put("sourceOriginalId", event.getSource().originalId());
        record.put("services", entities.services());
        record.put("assets", entities.assets());
        record.put("risks", entities.risks());
        record.put("controls", entities.controls());
        record.put("keyMetadata", keyMetadata);
        record.put("timeBucket", bucketStart(event.getOccurredAt(), policy.getBucketWidth()));
        return record;
    }

    static Instant bucketStart(Instant occurredAt, Duration width) {
        long widthMs = Math.max(1, width.toMillis());
        return Instant.ofEpochMilli(Math.floorDiv(occurredAt.toEpochMilli(), widthMs) * widthMs);
    }
}
