package com.example.riskintel.controller;

import com.example.riskintel.domain.DependencyEdge;
import com.example.riskintel.domain.EntityNode;
import com.example.riskintel.graph.DependencyGraphStore;
import com.example.riskintel.graph.GraphSnapshot;
import com.example.riskintel.graph.GraphWriteResult;
import com.example.riskintel.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Write surface for the graph-configuration collaborator, plus read-back.
 */
@RestController
@RequestMapping("/api/graph")
@RequiredArgsConstructor
public class GraphController {

    private final DependencyGraphStore graphStore;
    private final AuditService auditService;

    public record GraphDefinition(List<EntityNode> nodes, List<DependencyEdge> edges) {
    }

    public record NodeView(EntityNode node, List<DependencyEdge> outgoing, List<DependencyEdge> incoming) {
    }

    /**
     * Replace the whole graph from an inventory export.
     */
    @PutMapping
    public ResponseEntity<GraphWriteResult> replace(@RequestBody GraphDefinition definition) {
        return respond("replaceGraph", "*", graphStore.replaceGraph(definition.nodes(), definition.edges()));
    }

    @PostMapping("/nodes")
    public ResponseEntity<GraphWriteResult> addNode(@RequestBody EntityNode node) {
        return respond("addNode", node.id(), graphStore.addNode(node));
    }

    @DeleteMapping("/nodes/{id}")
    public ResponseEntity<GraphWriteResult> removeNode(@PathVariable String id) {
        return respond("removeNode", id, graphStore.removeNode(id));
    }

    @PostMapping("/edges")
    public ResponseEntity<GraphWriteResult> addEdge(@RequestBody DependencyEdge edge) {
        return respond("addEdge", edge.key(), graphStore.addEdge(edge));
    }

    @DeleteMapping("/edges")
    public ResponseEntity<GraphWriteResult> removeEdge(@RequestParam String parentId, @RequestParam String childId) {
        return respond("removeEdge", parentId + "->" + childId, graphStore.removeEdge(parentId, childId));
    }

    /**
     * A node with its downstream (outgoing) and upstream (incoming) edges.
     */
    @GetMapping("/nodes/{id}")
    public ResponseEntity<NodeView> getNode(@PathVariable String id) {
        GraphSnapshot snapshot = graphStore.snapshot();
        return snapshot.getNode(id)
                .map(node -> ResponseEntity.ok(new NodeView(node, snapshot.getOutgoingEdges(id), snapshot.getIncomingEdges(id))))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/version")
    public Map<String, Object> version() {
        GraphSnapshot snapshot = graphStore.snapshot();
        return Map.of(
                "version", snapshot.version(),
                "nodes", snapshot.nodeCount(),
                "edges", snapshot.edgeCount());
    }

    private ResponseEntity<GraphWriteResult> respond(String change, String target, GraphWriteResult result) {
        auditService.log("graph", result.accepted() ? "GRAPH_CHANGED" : "GRAPH_WRITE_REJECTED", target,
                Map.of("change", change, "version", result.version(), "errors", result.errors().size()));
        return result.accepted()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
}
