package com.example.riskintel.domain;

/**
 * A service or asset in the dependency graph, as supplied by the inventory.
 *
 * @param criticality   1 to 10
 * @param businessValue monetary or relative value lost when the entity is fully impacted
 */
public record EntityNode(String id, String name, NodeType type, int criticality,
                         double businessValue, long userCount) {

    public EntityNode {
        if (type == null) type = NodeType.SERVICE;
        if (name == null) name = id;
    }
}
