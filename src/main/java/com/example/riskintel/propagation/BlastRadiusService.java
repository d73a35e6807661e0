package com.example.riskintel.propagation;

import com.example.riskintel.cache.TieredCache;
import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.ErrorType;
import com.example.riskintel.domain.ProcessingError;
import com.example.riskintel.graph.DependencyGraphStore;
import com.example.riskintel.graph.GraphChangedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Cached front door to the {@link BlastRadiusEngine}.
 * <p>
 * Results are cached per (source, score, options). Sources whose reach exceeds the async
 * threshold get an approximate estimate straight away while the precise traversal runs on
 * the propagation executor and then replaces the cached estimate. At most one precise
 * traversal per cache key is in flight. Any graph change drops every cached propagation, and
 * a cached result built on an older graph version is never served.
 */
@Slf4j
@Service
public class BlastRadiusService {

    static final String CACHE_PREFIX = "propagation:";

    private final BlastRadiusEngine engine;
    private final DependencyGraphStore graphStore;
    private final TieredCache cache;
    private final RiskIntelProperties properties;
    private final Executor propagationExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, CompletableFuture<PropagationResult>> inFlight = new ConcurrentHashMap<>();

    public BlastRadiusService(BlastRadiusEngine engine,
                              DependencyGraphStore graphStore,
                              TieredCache cache,
                              RiskIntelProperties properties,
                              @Qualifier("propagationExecutor") Executor propagationExecutor,
                              ApplicationEventPublisher eventPublisher,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.engine = engine;
        this.graphStore = graphStore;
        this.cache = cache;
        this.properties = properties;
        this.propagationExecutor = propagationExecutor;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public PropagationOptions defaultOptions() {
        return PropagationOptions.from(properties.getPropagation());
    }

    /** Synchronous, cached traversal. */
    public PropagationResult computeBlastRadius(String sourceEntityId, double riskScore, PropagationOptions options) {
        options.validate();
        String key = cacheKey(sourceEntityId, riskScore, options);
        Optional<PropagationResult> cached = cachedForCurrentGraph(key);
        if (cached.isPresent() && !cached.get().isApproximate()) {
            return cached.get();
        }
        return computeAndCache(key, sourceEntityId, riskScore, options);
    }

    /**
     * Returns at once. Large reach gets an approximate answer now and the precise one later;
     * everything else is computed inline.
     */
    public BlastRadiusTicket requestBlastRadius(String sourceEntityId, double riskScore, PropagationOptions options) {
        options.validate();
        String key = cacheKey(sourceEntityId, riskScore, options);
        Optional<PropagationResult> cached = cachedForCurrentGraph(key);
        if (cached.isPresent() && !cached.get().isApproximate()) {
            return BlastRadiusTicket.completed(cached.get());
        }

        int reach = graphStore.snapshot().aggregate(sourceEntityId).totalReach();
        if (reach <= properties.getPropagation().getAsyncReachThreshold()) {
            return BlastRadiusTicket.completed(computeAndCache(key, sourceEntityId, riskScore, options));
        }

        PropagationResult estimate = cached.orElseGet(() -> {
            PropagationResult approx = engine.estimate(sourceEntityId, riskScore, options);
            cache.set(key, approx, properties.getPropagation().getResultTtl());
            return approx;
        });
        CompletableFuture<PropagationResult> running = inFlight.get(key);
        if (running != null) {
            return new BlastRadiusTicket(estimate, running);
        }
        CompletableFuture<PropagationResult> precise = new CompletableFuture<>();
        running = inFlight.putIfAbsent(key, precise);
        if (running != null) {
            return new BlastRadiusTicket(estimate, running);
        }

        log.info("Blast radius from {} reaches {} entities; returning estimate, precise traversal deferred",
                sourceEntityId, reach);
        try {
            propagationExecutor.execute(() -> runPrecise(key, sourceEntityId, riskScore, options, precise));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, precise);
            log.warn("Propagation executor saturated, serving estimate only for {}: {}", key, e.getMessage());
            List<ProcessingError> errors = new ArrayList<>(estimate.getErrors());
            errors.add(ProcessingError.of(ErrorType.BUDGET_EXCEEDED, BlastRadiusEngine.COMPONENT,
                    "precise traversal not scheduled: propagation executor saturated", clock.instant()));
            PropagationResult degraded = estimate.toBuilder().errors(List.copyOf(errors)).build();
            precise.complete(degraded);
            return BlastRadiusTicket.completed(degraded);
        }
        return new BlastRadiusTicket(estimate, precise);
    }

    @EventListener
    public void onGraphChanged(GraphChangedEvent event) {
        int removed = cache.invalidate(CACHE_PREFIX + "*");
        log.debug("Graph v{} ({}): dropped {} cached propagations", event.version(), event.change(), removed);
    }

    public static String cacheKey(String sourceEntityId, double riskScore, PropagationOptions options) {
        return CACHE_PREFIX + sourceEntityId + ":" + String.format(Locale.ROOT, "%.4f", riskScore) + ":" + options.cacheKey();
    }

    private void runPrecise(String key, String sourceEntityId, double riskScore, PropagationOptions options,
                            CompletableFuture<PropagationResult> precise) {
        try {
            PropagationResult result = computeAndCache(key, sourceEntityId, riskScore, options);
            inFlight.remove(key, precise);
            precise.complete(result);
            eventPublisher.publishEvent(new PropagationCompletedEvent(key, result));
        } catch (RuntimeException e) {
            inFlight.remove(key, precise);
            log.error("Precise traversal failed for {}", key, e);
            precise.completeExceptionally(e);
        }
    }

    private Optional<PropagationResult> cachedForCurrentGraph(String key) {
        long version = graphStore.snapshot().version();
        return cache.get(key, PropagationResult.class).filter(result -> result.getGraphVersion() == version);
    }

    private PropagationResult computeAndCache(String key, String sourceEntityId, double riskScore, PropagationOptions options) {
        Timer.Sample sample = Timer.start(meterRegistry);
        PropagationResult result = engine.computeBlastRadius(sourceEntityId, riskScore, options);
        sample.stop(Timer.builder("riskintel.propagation.duration")
                .tag("approximate", String.valueOf(result.isApproximate()))
                .register(meterRegistry));

        // A graph write during the traversal makes the result stale; serve it but do not cache it.
        if (result.getGraphVersion() == graphStore.snapshot().version()) {
            cache.set(key, result, properties.getPropagation().getResultTtl());
        }
        return result;
    }
}
