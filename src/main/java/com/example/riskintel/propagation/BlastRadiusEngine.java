package com.example.riskintel.propagation;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.DependencyEdge;
import com.example.riskintel.domain.EntityNode;
import com.example.riskintel.domain.ErrorType;
import com.example.riskintel.domain.ProcessingError;
import com.example.riskintel.graph.DependencyGraphStore;
import com.example.riskintel.graph.GraphSnapshot;
import com.example.riskintel.graph.NodeAggregate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Blast Radius Propagation Engine.
 * <p>
 * Best-first traversal from the scored entity: frames leave the queue strongest first, so
 * the first time a node is reached is through its highest-scoring path. Each hop decays the
 * score and can never exceed {@code parent × e^-decay}, which keeps scores strictly falling
 * along a path. A per-call visited set makes cycles harmless. Running out of budget yields a
 * partial result flagged approximate.
 */
@Slf4j
@Service
public class BlastRadiusEngine {

    static final String COMPONENT = "propagation";

    private record Frame(String entityId, double score, int depth, List<String> path, ImpactDirection direction) {
    }

    private static final Comparator<Frame> STRONGEST_FIRST = Comparator
            .comparingDouble(Frame::score).reversed()
            .thenComparingInt(Frame::depth)
            .thenComparing(Frame::entityId);

    private final DependencyGraphStore graphStore;
    private final RiskIntelProperties properties;
    private final Clock clock;

    public BlastRadiusEngine(DependencyGraphStore graphStore, RiskIntelProperties properties, Clock clock) {
        this.graphStore = graphStore;
        this.properties = properties;
        this.clock = clock;
    }

    public PropagationResult computeBlastRadius(String sourceEntityId, double riskScore, PropagationOptions options) {
        GraphSnapshot graph = graphStore.snapshot();
        Instant now = clock.instant();
        double sourceScore = Math.max(0.0, Math.min(100.0, riskScore));
        List<ProcessingError> errors = new ArrayList<>();

        if (!graph.containsNode(sourceEntityId)) {
            errors.add(ProcessingError.of(ErrorType.GRAPH_INCONSISTENCY, COMPONENT,
                    "source entity " + sourceEntityId + " is not in the dependency graph", now));
            return assemble(sourceEntityId, sourceScore, new LinkedHashMap<>(), options, graph, 0, false, errors, now);
        }

        TraversalBudget budget = new TraversalBudget(options.getStepBudget(), options.getTimeBudgetMs());
        Map<String, EntityImpact> impacts = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Set<String> reportedEdges = new HashSet<>();
        PriorityQueue<Frame> queue = new PriorityQueue<>(STRONGEST_FIRST);
        queue.add(new Frame(sourceEntityId, sourceScore, 0, List.of(sourceEntityId), ImpactDirection.SOURCE));
        boolean approximate = false;

        while (!queue.isEmpty()) {
            if (!budget.tryConsume()) {
                approximate = true;
                errors.add(ProcessingError.of(ErrorType.BUDGET_EXCEEDED, COMPONENT,
                        budget.exhaustedReason() + "; " + queue.size() + " frames left unexpanded", now));
                log.warn("Blast radius from {} cut short: {}", sourceEntityId, budget.exhaustedReason());
                break;
            }
            Frame frame = queue.poll();
            if (visited.contains(frame.entityId()) || frame.depth() > options.getMaxDepth()) {
                continue;
            }
            if (frame.score() < options.getMinimumPropagationScore()) {
                continue;
            }
            EntityNode node = graph.getNode(frame.entityId()).orElse(null);
            if (node == null) {
                continue;
            }

            visited.add(frame.entityId());
            impacts.put(frame.entityId(), impact(node, frame));

            if (frame.depth() >= options.getMaxDepth()) {
                continue;
            }
            int childDepth = frame.depth() + 1;
            if (options.isIncludeDownstream()) {
                for (DependencyEdge edge : graph.getOutgoingEdges(frame.entityId())) {
                    double incoming = frame.score() * edge.impactMultiplier() * edge.reliabilityFactor();
                    enqueue(queue, graph, visited, reportedEdges, errors, edge, edge.childId(), incoming,
                            frame, childDepth, ImpactDirection.DOWNSTREAM, options, now);
                }
            }
            if (options.isIncludeUpstream()) {
                for (DependencyEdge edge : graph.getIncomingEdges(frame.entityId())) {
                    double incoming = frame.score() * edge.reversePropagationFactor();
                    enqueue(queue, graph, visited, reportedEdges, errors, edge, edge.parentId(), incoming,
                            frame, childDepth, ImpactDirection.UPSTREAM, options, now);
                }
            }
        }

        return assemble(sourceEntityId, sourceScore, impacts, options, graph, budget.stepsUsed(), approximate, errors, now);
    }

    /**
     * Cheap estimate from the snapshot's memoized reach counts. Only the source is listed in
     * the impacts; the aggregate figures extrapolate from the reachable set.
     */
    public PropagationResult estimate(String sourceEntityId, double riskScore, PropagationOptions options) {
        GraphSnapshot graph = graphStore.snapshot();
        Instant now = clock.instant();
        double sourceScore = Math.max(0.0, Math.min(100.0, riskScore));
        EntityNode source = graph.getNode(sourceEntityId).orElse(null);
        if (source == null) {
            return computeBlastRadius(sourceEntityId, riskScore, options);
        }
        NodeAggregate aggregate = graph.aggregate(sourceEntityId);
        int reach = (options.isIncludeDownstream() ? aggregate.downstreamReach() : 0)
                + (options.isIncludeUpstream() ? aggregate.upstreamReach() : 0);
        double firstHopFactor = Math.exp(-options.getDecayFactor());
        double downstreamImpact = options.isIncludeDownstream()
                ? aggregate.downstreamBusinessValue() * sourceScore * firstHopFactor / 100.0 : 0.0;

        Map<String, EntityImpact> impacts = new LinkedHashMap<>();
        Frame sourceFrame = new Frame(sourceEntityId, sourceScore, 0, List.of(sourceEntityId), ImpactDirection.SOURCE);
        EntityImpact sourceImpact = impact(source, sourceFrame);
        impacts.put(sourceEntityId, sourceImpact);

        return PropagationResult.builder()
                .sourceEntityId(sourceEntityId)
                .sourceScore(sourceScore)
                .impacts(impacts)
                .criticalPaths(criticalPaths(impacts, options, graph))
                .totalAffectedServices(1 + reach)
                .criticalServicesAffected(source.criticality() >= properties.getPropagation().getCriticalCriticality() ? 1 : 0)
                .estimatedBusinessImpact(sourceImpact.businessImpact() + downstreamImpact)
                .maxPropagationDepth(reach > 0 ? options.getMaxDepth() : 0)
                .approximate(true)
                .stepsUsed(0)
                .graphVersion(graph.version())
                .computedAt(now)
                .expiresAt(now.plus(properties.getPropagation().getResultTtl()))
                .errors(List.of())
                .build();
    }

    private void enqueue(PriorityQueue<Frame> queue, GraphSnapshot graph, Set<String> visited, Set<String> reportedEdges,
                         List<ProcessingError> errors, DependencyEdge edge, String target, double incoming,
                         Frame parent, int depth, ImpactDirection direction, PropagationOptions options, Instant now) {
        if (!graph.containsNode(target)) {
            if (reportedEdges.add(edge.key())) {
                errors.add(ProcessingError.of(ErrorType.GRAPH_INCONSISTENCY, COMPONENT,
                        "edge " + edge.key() + " references unknown node " + target + "; excluded", now));
            }
            return;
        }
        if (visited.contains(target)) {
            return;
        }
        double decay = options.getDecayFactor();
        double score = Math.min(incoming * Math.exp(-depth * decay), parent.score() * Math.exp(-decay));
        if (score < options.getMinimumPropagationScore()) {
            return;
        }
        List<String> path = new ArrayList<>(parent.path());
        path.add(target);
        queue.add(new Frame(target, score, depth, List.copyOf(path), direction));
    }

    private EntityImpact impact(EntityNode node, Frame frame) {
        double combined = Math.min(100.0, frame.score() * (0.5 + node.criticality() / 20.0));
        double businessImpact = node.businessValue() * frame.score() / 100.0;
        return new EntityImpact(node.id(), node.name(), frame.score(), frame.depth(), frame.path(),
                combined, frame.direction(), node.criticality(), businessImpact);
    }

    private PropagationResult assemble(String sourceEntityId, double sourceScore, Map<String, EntityImpact> impacts,
                                       PropagationOptions options, GraphSnapshot graph, int steps, boolean approximate,
                                       List<ProcessingError> errors, Instant now) {
        int criticalThreshold = properties.getPropagation().getCriticalCriticality();
        int critical = (int) impacts.values().stream().filter(i -> i.criticality() >= criticalThreshold).count();
        double businessImpact = impacts.values().stream().mapToDouble(EntityImpact::businessImpact).sum();
        int maxDepth = impacts.values().stream().mapToInt(EntityImpact::depth).max().orElse(0);

        return PropagationResult.builder()
                .sourceEntityId(sourceEntityId)
                .sourceScore(sourceScore)
                .impacts(impacts)
                .criticalPaths(criticalPaths(impacts, options, graph))
                .totalAffectedServices(impacts.size())
                .criticalServicesAffected(critical)
                .estimatedBusinessImpact(businessImpact)
                .maxPropagationDepth(maxDepth)
                .approximate(approximate)
                .stepsUsed(steps)
                .graphVersion(graph.version())
                .computedAt(now)
                .expiresAt(now.plus(properties.getPropagation().getResultTtl()))
                .errors(List.copyOf(new LinkedHashSet<>(errors)))
                .build();
    }

    private List<CriticalPath> criticalPaths(Map<String, EntityImpact> impacts, PropagationOptions options,
                                             GraphSnapshot graph) {
        RiskIntelProperties.PropagationConfig cfg = properties.getPropagation();
        return impacts.values().stream()
                .filter(i -> i.propagatedScore() > cfg.getCriticalPathScore() || i.criticality() >= cfg.getCriticalCriticality())
                .sorted(Comparator.comparingDouble(EntityImpact::propagatedScore).reversed()
                        .thenComparing(EntityImpact::entityId))
                .limit(Math.max(0, options.getCriticalPathLimit()))
                .map(i -> new CriticalPath(i.entityId(), i.path(), i.propagatedScore(), i.criticality(),
                        graph.getNode(i.entityId()).map(EntityNode::businessValue).orElse(0.0)))
                .toList();
    }
}
