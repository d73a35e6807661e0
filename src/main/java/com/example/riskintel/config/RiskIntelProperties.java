package com.example.riskintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the risk intelligence pipeline.
 * Maps to the 'risk-intel' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "risk-intel")
public class RiskIntelProperties {

    private DedupConfig dedup = new DedupConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private PropagationConfig propagation = new PropagationConfig();
    private CacheConfig cache = new CacheConfig();
    private EventsConfig events = new EventsConfig();

    @Data
    public static class DedupConfig {
        /** Policy applied to event types with no entry in {@link #policies}. */
        private EventTypePolicy defaultPolicy = new EventTypePolicy(Duration.ofHours(1), Duration.ofHours(1));
        /** Keyed by lower-cased event type. */
        private Map<String, EventTypePolicy> policies = defaultPolicies();
        private long purgeIntervalMs = 60_000;

        public EventTypePolicy policyFor(String eventType) {
            if (eventType == null) return defaultPolicy;
            return policies.getOrDefault(eventType.trim().toLowerCase(Locale.ROOT), defaultPolicy);
        }

        private static Map<String, EventTypePolicy> defaultPolicies() {
            Map<String, EventTypePolicy> defaults = new HashMap<>();
            defaults.put("telemetry", new EventTypePolicy(Duration.ofMinutes(5), Duration.ofMinutes(30)));
            EventTypePolicy vulnerability = new EventTypePolicy(Duration.ofHours(24), Duration.ofHours(24));
            vulnerability.setKeyMetadataFields(new ArrayList<>(List.of("cveId")));
            defaults.put("vulnerability", vulnerability);
            return defaults;
        }
    }

    @Data
    public static class EventTypePolicy {
        private Duration bucketWidth = Duration.ofHours(1);
        private Duration window = Duration.ofHours(1);
        /** rawPayload fields that take part in the fingerprint. */
        private List<String> keyMetadataFields = new ArrayList<>();

        public EventTypePolicy() {
        }

        public EventTypePolicy(Duration bucketWidth, Duration window) {
            this.bucketWidth = bucketWidth;
            this.window = window;
        }
    }

    @Data
    public static class ScoringConfig {
        private double severityWeight = 0.6;
        private double criticalityWeight = 0.4;
        private double knownExploitedBonus = 20.0;
        private double threatIntelCap = 25.0;
        private double threatIntelPerMatch = 5.0;
        private int historicalMinObservations = 3;
        private double historicalSensitivity = 0.4;
        private double internetFacingMultiplier = 1.15;
        private double nonProductionMultiplier = 0.8;
        private double controlDiscountPerControl = 0.03;
        private double controlDiscountCap = 0.30;
        private double confidenceDiscountWeight = 0.2;
        private double fallbackConfidence = 30.0;
        private RiskBands bands = new RiskBands();
    }

    @Data
    public static class RiskBands {
        private double critical = 85.0;
        private double high = 65.0;
        private double medium = 40.0;
    }

    @Data
    public static class PropagationConfig {
        private int maxDepth = 3;
        private double decayFactor = 0.3;
        private double minimumPropagationScore = 0.1;
        private boolean includeUpstream = true;
        private boolean includeDownstream = true;
        private int stepBudget = 10_000;
        private long timeBudgetMs = 250;
        private int criticalPathLimit = 10;
        private int criticalCriticality = 8;
        private double criticalPathScore = 50.0;
        /** Reachable-node count above which the precise traversal runs in the background. */
        private int asyncReachThreshold = 500;
        private Duration resultTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class CacheConfig {
        private long fastMaximumSize = 10_000;
        private Duration fastMaxTtl = Duration.ofMinutes(10);
        private boolean durableEnabled = true;
        private long purgeIntervalMs = 300_000;
        private Duration scoreTtl = Duration.ofMinutes(30);
    }

    @Data
    public static class EventsConfig {
        private Duration retention = Duration.ofDays(30);
        private long archiveIntervalMs = 3_600_000;
        private int maxBreakdownHistory = 20;
    }
}
