package com.example.riskintel.graph;

import java.util.Set;

/**
 * Published after every accepted graph write.
 *
 * @param touchedNodeIds nodes whose attributes or edges changed; empty for a full replace
 */
public record GraphChangedEvent(long version, String change, Set<String> touchedNodeIds) {
}
