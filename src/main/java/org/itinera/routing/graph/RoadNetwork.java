package org.itinera.routing.graph;

import java.util.List;

/**
 * Read-only view over a directed, possibly multi-edged road graph.
 *
 * <p>Nodes are addressed by dense internal ids in {@code [0, nodeCount)}. All parallel
 * variants between one ordered node pair are grouped under a single link id. Implementations
 * must be immutable so that concurrent searches can share one snapshot without locking.</p>
 */
public interface RoadNetwork {
    int NO_LINK = -1;
    int NO_NODE = -1;

    int nodeCount();

    int linkCount();

    /**
     * Returns whether the internal node id belongs to this network.
     */
    default boolean containsNode(int nodeId) {
        return nodeId >= 0 && nodeId < nodeCount();
    }

    double latitude(int nodeId);

    double longitude(int nodeId);

    default Coordinate coordinateOf(int nodeId) {
        return new Coordinate(latitude(nodeId), longitude(nodeId));
    }

    /**
     * Client-facing id of one node.
     */
    String externalId(int nodeId);

    /**
     * Internal id for a client-facing node id, or {@link #NO_NODE} when unknown.
     */
    int internalId(String externalId);

    /**
     * Cursor over links leaving {@code nodeId}.
     */
    LinkCursor outgoing(int nodeId);

    /**
     * Cursor over links entering {@code nodeId}.
     */
    LinkCursor incoming(int nodeId);

    int linkOrigin(int linkId);

    int linkTarget(int linkId);

    /**
     * Finds the link from {@code fromNode} to {@code toNode}, or {@link #NO_LINK}.
     */
    int findLink(int fromNode, int toNode);

    /**
     * Parallel variants of one link in insertion order.
     */
    List<EdgeVariant> variants(int linkId);

    /**
     * Minimum of {@code field} across the variants of one link.
     */
    double minWeight(int linkId, WeightField field);

    /**
     * Variant with minimal travel time (earliest inserted on ties).
     */
    EdgeVariant representativeVariant(int linkId);

    /**
     * Node nearest to the coordinate in degree space.
     *
     * @throws IllegalStateException when the network has no nodes.
     */
    int nearestNode(Coordinate coordinate);

    /**
     * Forward-only cursor over link ids.
     */
    interface LinkCursor {
        boolean hasNext();

        int next();
    }
}
