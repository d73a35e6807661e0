package com.example.riskintel.graph;

/**
 * Unbounded reachability counts for one node, used for fast blast-radius estimates.
 *
 * @param downstreamReach         distinct nodes reachable along outgoing edges
 * @param upstreamReach           distinct nodes reachable along incoming edges
 * @param downstreamBusinessValue summed business value of the downstream reach
 */
public record NodeAggregate(int downstreamReach, int upstreamReach, double downstreamBusinessValue) {

    public int totalReach() {
        return downstreamReach + upstreamReach;
    }
}
