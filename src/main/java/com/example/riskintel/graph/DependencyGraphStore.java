package com.example.riskintel.graph;

import com.example.riskintel.domain.DependencyEdge;
import com.example.riskintel.domain.EntityNode;
import com.example.riskintel.domain.ErrorType;
import com.example.riskintel.domain.ProcessingError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service Dependency Graph Store.
 * <p>
 * Reads go to the current {@link GraphSnapshot} without locking. Writes are serialized,
 * validated, and publish a whole new snapshot. Cycles are allowed; traversal handles them.
 */
@Slf4j
@Service
public class DependencyGraphStore {

    static final String COMPONENT = "graph";
    static final double MIN_IMPACT_MULTIPLIER = 0.1;
    static final double MAX_IMPACT_MULTIPLIER = 5.0;

    private final AtomicReference<GraphSnapshot> current = new AtomicReference<>(GraphSnapshot.empty());
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public DependencyGraphStore(ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    // ── Read ──

    public GraphSnapshot snapshot() {
        return current.get();
    }

    public Optional<EntityNode> getNode(String id) {
        return snapshot().getNode(id);
    }

    public List<DependencyEdge> getOutgoingEdges(String id) {
        return snapshot().getOutgoingEdges(id);
    }

    public List<DependencyEdge> getIncomingEdges(String id) {
        return snapshot().getIncomingEdges(id);
    }

    // ── Write ──

    /** Insert or replace a node. */
    public synchronized GraphWriteResult addNode(EntityNode node) {
        GraphSnapshot snap = current.get();
        List<ProcessingError> errors = validateNode(node);
        if (!errors.isEmpty()) {
            return reject(snap, "addNode", errors);
        }
        Map<String, EntityNode> nodes = new LinkedHashMap<>(snap.nodeMap());
        nodes.put(node.id(), node);
        return publish(snap, nodes, snap.edgeMap(), "addNode", Set.of(node.id()), List.of());
    }

    /** Insert or replace the edge between two existing nodes. */
    public synchronized GraphWriteResult addEdge(DependencyEdge edge) {
        GraphSnapshot snap = current.get();
        List<ProcessingError> errors = validateEdge(edge, snap.nodeMap());
        if (!errors.isEmpty()) {
            return reject(snap, "addEdge", errors);
        }
        Map<String, DependencyEdge> edges = new LinkedHashMap<>(snap.edgeMap());
        edges.put(edge.key(), edge);
        return publish(snap, snap.nodeMap(), edges, "addEdge", Set.of(edge.parentId(), edge.childId()), List.of());
    }

    public synchronized GraphWriteResult removeEdge(String parentId, String childId) {
        GraphSnapshot snap = current.get();
        if (snap.getEdge(parentId, childId).isEmpty()) {
            return reject(snap, "removeEdge", List.of(error(ErrorType.VALIDATION,
                    "edge " + parentId + " -> " + childId + " does not exist")));
        }
        Map<String, DependencyEdge> edges = new LinkedHashMap<>(snap.edgeMap());
        edges.remove(parentId + "->" + childId);
        return publish(snap, snap.nodeMap(), edges, "removeEdge", Set.of(parentId, childId), List.of());
    }

    /** Removes the node and every edge touching it. */
    public synchronized GraphWriteResult removeNode(String id) {
        GraphSnapshot snap = current.get();
        if (!snap.containsNode(id)) {
            return reject(snap, "removeNode", List.of(error(ErrorType.VALIDATION, "node " + id + " does not exist")));
        }
        Map<String, EntityNode> nodes = new LinkedHashMap<>(snap.nodeMap());
        nodes.remove(id);
        Map<String, DependencyEdge> edges = new LinkedHashMap<>(snap.edgeMap());
        edges.values().removeIf(e -> e.parentId().equals(id) || e.childId().equals(id));
        return publish(snap, nodes, edges, "removeNode", Set.of(id), List.of());
    }

    /**
     * Bulk load from the inventory. Invalid nodes and invalid or dangling edges are left out
     * and reported; everything else replaces the current graph.
     */
    public synchronized GraphWriteResult replaceGraph(Collection<EntityNode> newNodes, Collection<DependencyEdge> newEdges) {
        GraphSnapshot snap = current.get();
        List<ProcessingError> errors = new ArrayList<>();

        Map<String, EntityNode> nodes = new LinkedHashMap<>();
        for (EntityNode node : newNodes == null ? List.<EntityNode>of() : newNodes) {
            List<ProcessingError> nodeErrors = validateNode(node);
            if (nodeErrors.isEmpty()) {
                nodes.put(node.id(), node);
            } else {
                errors.addAll(nodeErrors);
            }
        }
        Map<String, DependencyEdge> edges = new LinkedHashMap<>();
        for (DependencyEdge edge : newEdges == null ? List.<DependencyEdge>of() : newEdges) {
            List<ProcessingError> edgeErrors = validateEdge(edge, nodes);
            if (edgeErrors.isEmpty()) {
                edges.put(edge.key(), edge);
            } else {
                errors.addAll(edgeErrors);
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Graph replace excluded {} invalid items", errors.size());
        }
        return publish(snap, nodes, edges, "replaceGraph", Set.of(), errors);
    }

    // ── Internals ──

    private GraphWriteResult publish(GraphSnapshot previous, Map<String, EntityNode> nodes,
                                     Map<String, DependencyEdge> edges, String change,
                                     Set<String> touched, List<ProcessingError> errors) {
        GraphSnapshot next = GraphSnapshot.of(previous.version() + 1, nodes, edges);
        current.set(next);
        log.info("Graph {} -> v{} ({} nodes, {} edges)", change, next.version(), next.nodeCount(), next.edgeCount());
        eventPublisher.publishEvent(new GraphChangedEvent(next.version(), change, touched));
        return GraphWriteResult.accepted(next.version(), errors);
    }

    private GraphWriteResult reject(GraphSnapshot snap, String change, List<ProcessingError> errors) {
        log.warn("Graph {} rejected: {}", change, errors.stream().map(ProcessingError::message).toList());
        return GraphWriteResult.rejected(snap.version(), errors);
    }

    private List<ProcessingError> validateNode(EntityNode node) {
        List<ProcessingError> errors = new ArrayList<>();
        if (node == null || node.id() == null || node.id().isBlank()) {
            errors.add(error(ErrorType.VALIDATION, "node id is required"));
            return errors;
        }
        if (node.criticality() < 1 || node.criticality() > 10) {
            errors.add(error(ErrorType.VALIDATION, "node " + node.id() + ": criticality must be 1-10, was " + node.criticality()));
        }
        if (node.businessValue() < 0 || !Double.isFinite(node.businessValue())) {
            errors.add(error(ErrorType.VALIDATION, "node " + node.id() + ": businessValue must be a non-negative number"));
        }
        if (node.userCount() < 0) {
            errors.add(error(ErrorType.VALIDATION, "node " + node.id() + ": userCount must not be negative"));
        }
        return errors;
    }

    private List<ProcessingError> validateEdge(DependencyEdge edge, Map<String, EntityNode> nodes) {
        List<ProcessingError> errors = new ArrayList<>();
        if (edge == null || edge.parentId() == null || edge.childId() == null) {
            errors.add(error(ErrorType.VALIDATION, "edge parentId and childId are required"));
            return errors;
        }
        String label = "edge " + edge.parentId() + " -> " + edge.childId();
        if (edge.parentId().equals(edge.childId())) {
            errors.add(error(ErrorType.VALIDATION, label + ": self-loops are not allowed"));
        }
        if (!nodes.containsKey(edge.parentId())) {
            errors.add(error(ErrorType.GRAPH_INCONSISTENCY, label + ": unknown parent node " + edge.parentId()));
        }
        if (!nodes.containsKey(edge.childId())) {
            errors.add(error(ErrorType.GRAPH_INCONSISTENCY, label + ": unknown child node " + edge.childId()));
        }
        if (!(edge.impactMultiplier() >= MIN_IMPACT_MULTIPLIER && edge.impactMultiplier() <= MAX_IMPACT_MULTIPLIER)) {
            errors.add(error(ErrorType.VALIDATION, label + ": impactMultiplier must be 0.1-5.0, was " + edge.impactMultiplier()));
        }
        if (!(edge.reliabilityFactor() >= 0 && edge.reliabilityFactor() <= 1)) {
            errors.add(error(ErrorType.VALIDATION, label + ": reliabilityFactor must be 0-1, was " + edge.reliabilityFactor()));
        }
        if (!(edge.reversePropagationFactor() >= 0 && edge.reversePropagationFactor() <= 1)) {
            errors.add(error(ErrorType.VALIDATION, label + ": reversePropagationFactor must be 0-1, was " + edge.reversePropagationFactor()));
        }
        return errors;
    }

    private ProcessingError error(ErrorType type, String message) {
        return ProcessingError.of(type, COMPONENT, message, clock.instant());
    }
}
