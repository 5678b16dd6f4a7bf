package org.itinera.routing.core;

import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.itinera.routing.graph.RoadNetwork;

import java.util.PriorityQueue;

/**
 * Thread-confined mutable state for one bidirectional query.
 *
 * <p>One instance per lane pair is reused per thread and cleared before each query.</p>
 */
final class SearchQueryContext {
    private static final double INF = Double.POSITIVE_INFINITY;

    private final Lane forward = new Lane();
    private final Lane backward = new Lane();

    /**
     * Resets both lanes for a new query.
     */
    void reset() {
        forward.clear();
        backward.clear();
    }

    Lane forward() {
        return forward;
    }

    Lane backward() {
        return backward;
    }

    int frontierSize() {
        return forward.frontier.size() + backward.frontier.size();
    }

    int settledCount() {
        return forward.settled.size() + backward.settled.size();
    }

    /**
     * State of one search direction. {@code parent} holds predecessors for the forward
     * lane and successors for the backward lane.
     */
    static final class Lane {
        private final Int2DoubleOpenHashMap bestCost = new Int2DoubleOpenHashMap();
        private final Int2IntOpenHashMap parent = new Int2IntOpenHashMap();
        private final IntOpenHashSet settled = new IntOpenHashSet();
        private final PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();

        Lane() {
            bestCost.defaultReturnValue(INF);
            parent.defaultReturnValue(RoadNetwork.NO_NODE);
        }

        void clear() {
            bestCost.clear();
            parent.clear();
            settled.clear();
            frontier.clear();
        }

        double bestCost(int nodeId) {
            return bestCost.get(nodeId);
        }

        void seed(int nodeId) {
            bestCost.put(nodeId, 0.0d);
            frontier.add(new FrontierEntry(nodeId, 0.0d));
        }

        /**
         * Records an improved cost reached through {@code via} and enqueues the node.
         */
        void improve(int nodeId, double cost, int via) {
            bestCost.put(nodeId, cost);
            parent.put(nodeId, via);
            frontier.add(new FrontierEntry(nodeId, cost));
        }

        int parent(int nodeId) {
            return parent.get(nodeId);
        }

        boolean isSettled(int nodeId) {
            return settled.contains(nodeId);
        }

        void markSettled(int nodeId) {
            settled.add(nodeId);
        }

        PriorityQueue<FrontierEntry> frontier() {
            return frontier;
        }
    }
}
