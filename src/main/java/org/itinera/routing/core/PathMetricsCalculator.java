package org.itinera.routing.core;

import org.itinera.routing.graph.EdgeVariant;
import org.itinera.routing.graph.RoadNetwork;

import java.util.Objects;

/**
 * Replays a node path and sums the figures of each link's representative variant.
 *
 * <p>The representative variant of a link is the one with minimal travel time, the earliest
 * inserted winning ties. Its length is summed even when another variant of the same link is
 * shorter.</p>
 */
public final class PathMetricsCalculator {
    public static final String REASON_EDGE_NOT_FOUND = "EDGE_NOT_FOUND";
    public static final String REASON_NODE_NOT_FOUND = BidirectionalDijkstraEngine.REASON_NODE_NOT_FOUND;

    /**
     * Computes metrics for {@code nodePath}.
     *
     * @throws IllegalArgumentException when the path is empty.
     * @throws RouteException with kind GRAPH when a node is unknown or two consecutive nodes
     *                        are not linked.
     */
    public PathMetrics measure(RoadNetwork network, int[] nodePath) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(nodePath, "nodePath");
        if (nodePath.length == 0) {
            throw new IllegalArgumentException("nodePath must contain at least one node");
        }
        for (int node : nodePath) {
            if (!network.containsNode(node)) {
                throw new RouteException(
                        RouteErrorKind.GRAPH,
                        REASON_NODE_NOT_FOUND,
                        "path node " + node + " is not part of the network"
                );
            }
        }

        double distance = 0.0d;
        double duration = 0.0d;
        double northernmost = network.latitude(nodePath[0]);
        for (int i = 0; i + 1 < nodePath.length; i++) {
            int from = nodePath[i];
            int to = nodePath[i + 1];
            int link = network.findLink(from, to);
            if (link == RoadNetwork.NO_LINK) {
                throw new RouteException(
                        RouteErrorKind.GRAPH,
                        REASON_EDGE_NOT_FOUND,
                        "no link between consecutive path nodes "
                                + network.externalId(from) + " -> " + network.externalId(to)
                );
            }
            EdgeVariant representative = network.representativeVariant(link);
            distance += representative.getLengthMeters();
            duration += representative.travelTimeOrZero();
            northernmost = Math.max(northernmost, network.latitude(to));
        }

        return PathMetrics.builder()
                .distanceMeters(distance)
                .durationSeconds(duration)
                .northernmostLatitude(northernmost)
                .linkCount(nodePath.length - 1)
                .build();
    }
}
