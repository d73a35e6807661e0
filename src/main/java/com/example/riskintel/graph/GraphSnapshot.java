package com.example.riskintel.graph;

import com.example.riskintel.domain.DependencyEdge;
import com.example.riskintel.domain.EntityNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Immutable, versioned view of the dependency graph. Traversals hold one snapshot for
 * their whole run, so concurrent writes never show them a half-applied change.
 */
public final class GraphSnapshot {

    private final long version;
    private final Map<String, EntityNode> nodes;
    private final Map<String, DependencyEdge> edges;
    private final Map<String, List<DependencyEdge>> outgoing;
    private final Map<String, List<DependencyEdge>> incoming;
    private final Map<String, NodeAggregate> aggregates = new ConcurrentHashMap<>();

    private GraphSnapshot(long version, Map<String, EntityNode> nodes, Map<String, DependencyEdge> edges) {
        this.version = version;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));

        Map<String, List<DependencyEdge>> out = new LinkedHashMap<>();
        Map<String, List<DependencyEdge>> in = new LinkedHashMap<>();
        for (DependencyEdge edge : edges.values()) {
            out.computeIfAbsent(edge.parentId(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.childId(), k -> new ArrayList<>()).add(edge);
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        in.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
    }

    public static GraphSnapshot empty() {
        return new GraphSnapshot(0, Map.of(), Map.of());
    }

    static GraphSnapshot of(long version, Map<String, EntityNode> nodes, Map<String, DependencyEdge> edges) {
        return new GraphSnapshot(version, nodes, edges);
    }

    public long version() {
        return version;
    }

    public Optional<EntityNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /** Edges to downstream dependents of {@code id}. */
    public List<DependencyEdge> getOutgoingEdges(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /** Edges from upstream dependencies of {@code id}. */
    public List<DependencyEdge> getIncomingEdges(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    public Optional<DependencyEdge> getEdge(String parentId, String childId) {
        return Optional.ofNullable(edges.get(parentId + "->" + childId));
    }

    public Collection<EntityNode> nodes() {
        return nodes.values();
    }

    public Collection<DependencyEdge> edges() {
        return edges.values();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    Map<String, EntityNode> nodeMap() {
        return nodes;
    }

    Map<String, DependencyEdge> edgeMap() {
        return edges;
    }

    /** Memoized per snapshot; computed on first request. */
    public NodeAggregate aggregate(String id) {
        if (!containsNode(id)) {
            return new NodeAggregate(0, 0, 0.0);
        }
        return aggregates.computeIfAbsent(id, this::computeAggregate);
    }

    private NodeAggregate computeAggregate(String id) {
        Set<String> downstream = reach(id, this::getOutgoingEdges, DependencyEdge::childId);
        Set<String> upstream = reach(id, this::getIncomingEdges, DependencyEdge::parentId);
        double value = downstream.stream()
                .map(nodes::get)
                .mapToDouble(EntityNode::businessValue)
                .sum();
        return new NodeAggregate(downstream.size(), upstream.size(), value);
    }

    private Set<String> reach(String start, Function<String, List<DependencyEdge>> neighbours,
                              Function<DependencyEdge, String> next) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            for (DependencyEdge edge : neighbours.apply(queue.poll())) {
                String target = next.apply(edge);
                if (nodes.containsKey(target) && seen.add(target)) {
                    queue.add(target);
                }
            }
        }
        seen.remove(start);
        return seen;
    }
}
