package com.example.riskintel.scoring;

import com.example.riskintel.cache.TieredCache;
import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.RiskEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Caches score breakdowns by calculation id. Scoring is deterministic, so a cached
 * breakdown for the same id is the breakdown a fresh run would produce.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {

    static final String CACHE_PREFIX = "score:";

    private final TransparentScoringEngine engine;
    private final TieredCache cache;
    private final RiskIntelProperties properties;
    private final MeterRegistry meterRegistry;

    public ScoreBreakdown score(RiskEvent event, RiskContext context) {
        String calculationId = engine.calculationId(event, context);
        String key = CACHE_PREFIX + calculationId;
        Optional<ScoreBreakdown> cached = cache.get(key, ScoreBreakdown.class);
        if (cached.isPresent()) {
            log.debug("Score cache hit for event {} ({})", event.getId(), calculationId);
            return cached.get();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        ScoreBreakdown breakdown = engine.score(event, context);
        sample.stop(Timer.builder("riskintel.scoring.duration")
                .tag("fallback", String.valueOf(breakdown.isFallback()))
                .register(meterRegistry));

        if (!breakdown.isFallback()) {
            cache.set(key, breakdown, properties.getCache().getScoreTtl());
        }
        return breakdown;
    }
}
