package org.itinera.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.itinera.routing.exclusion.ExclusionSet;
import org.itinera.routing.graph.RoadNetwork;
import org.itinera.routing.graph.WeightField;

import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Bidirectional Dijkstra with runtime node exclusion.
 *
 * <p>Execution model:</p>
 * <ul>
 * <li>The forward lane expands outgoing links from the start, the backward lane incoming links
 * from the end. Both alternate one settle per round.</li>
 * <li>A step costs the minimum of the selected weight field across the link's variants.</li>
 * <li>Whenever a relaxed node already has a cost on the opposite lane, the sum is offered as the
 * best meeting cost.</li>
 * <li>The search stops when the two frontier minima together reach the best meeting cost, as
 * decided by {@link TerminationPolicy}.</li>
 * <li>Excluded nodes are never settled and never entered.</li>
 * </ul>
 */
public final class BidirectionalDijkstraEngine implements ShortestPathEngine {
    public static final String REASON_NODE_NOT_FOUND = "NODE_NOT_FOUND";
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "SEARCH_BUDGET_EXCEEDED";
    public static final String REASON_SEARCH_CANCELLED = "SEARCH_CANCELLED";

    private static final int NO_MEETING = RoadNetwork.NO_NODE;

    private final SearchBudget searchBudget;
    private final TerminationPolicy terminationPolicy;
    private final ThreadLocal<SearchQueryContext> queryContext =
            ThreadLocal.withInitial(SearchQueryContext::new);

    public BidirectionalDijkstraEngine() {
        this(SearchBudget.defaults());
    }

    public BidirectionalDijkstraEngine(SearchBudget searchBudget) {
        this(searchBudget, TerminationPolicy.defaults());
    }

    BidirectionalDijkstraEngine(SearchBudget searchBudget, TerminationPolicy terminationPolicy) {
        this.searchBudget = Objects.requireNonNull(searchBudget, "searchBudget");
        this.terminationPolicy = Objects.requireNonNull(terminationPolicy, "terminationPolicy");
    }

    @Override
    public SearchResult search(
            RoadNetwork network,
            int start,
            int end,
            WeightField weightField,
            ExclusionSet exclusions,
            SearchCancellation cancellation
    ) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(weightField, "weightField");
        ExclusionSet excluded = exclusions == null ? ExclusionSet.empty() : exclusions;
        SearchCancellation token = cancellation == null ? SearchCancellation.NONE : cancellation;
        requireNode(network, start, "start");
        requireNode(network, end, "end");

        if (start == end) {
            return SearchResult.found(new int[]{start}, 0.0d, 0);
        }

        SearchQueryContext context = queryContext.get();
        context.reset();
        try {
            return run(network, start, end, weightField, excluded, token, context);
        } catch (SearchBudget.BudgetExceededException ex) {
            throw new RouteException(
                    RouteErrorKind.GRAPH,
                    REASON_SEARCH_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        } finally {
            context.reset();
        }
    }

    private SearchResult run(
            RoadNetwork network,
            int start,
            int end,
            WeightField weightField,
            ExclusionSet excluded,
            SearchCancellation cancellation,
            SearchQueryContext context
    ) {
        SearchQueryContext.Lane forward = context.forward();
        SearchQueryContext.Lane backward = context.backward();
        forward.seed(start);
        backward.seed(end);

        Meeting meeting = new Meeting();
        PriorityQueue<FrontierEntry> forwardFrontier = forward.frontier();
        PriorityQueue<FrontierEntry> backwardFrontier = backward.frontier();

        while (!forwardFrontier.isEmpty() && !backwardFrontier.isEmpty()) {
            if (terminationPolicy.shouldTerminate(
                    forwardFrontier.peek().cost(),
                    backwardFrontier.peek().cost(),
                    meeting.cost)) {
                break;
            }
            if (cancellation.isCancelled()) {
                throw new RouteException(
                        RouteErrorKind.CANCELLED,
                        REASON_SEARCH_CANCELLED,
                        "search from " + network.externalId(start) + " to " + network.externalId(end) + " was cancelled"
                );
            }

            expandOne(network, weightField, excluded, forward, backward, meeting, true, context);
            if (backwardFrontier.isEmpty()) {
                break;
            }
            expandOne(network, weightField, excluded, backward, forward, meeting, false, context);
        }

        int settled = context.settledCount();
        if (meeting.node == NO_MEETING) {
            return SearchResult.noPath(settled);
        }
        return SearchResult.found(buildPath(forward, backward, meeting.node), meeting.cost, settled);
    }

    /**
     * Settles the cheapest entry of {@code lane}, skipping it when stale or excluded, and
     * relaxes its links in the lane's direction.
     */
    private void expandOne(
            RoadNetwork network,
            WeightField weightField,
            ExclusionSet excluded,
            SearchQueryContext.Lane lane,
            SearchQueryContext.Lane opposite,
            Meeting meeting,
            boolean outgoing,
            SearchQueryContext context
    ) {
        FrontierEntry entry = lane.frontier().poll();
        int node = entry.nodeId();
        if (lane.isSettled(node) || excluded.contains(node)) {
            return;
        }
        lane.markSettled(node);
        searchBudget.checkSettledNodes(context.settledCount());

        double nodeCost = entry.cost();
        RoadNetwork.LinkCursor links = outgoing ? network.outgoing(node) : network.incoming(node);
        while (links.hasNext()) {
            int link = links.next();
            int neighbor = outgoing ? network.linkTarget(link) : network.linkOrigin(link);
            if (excluded.contains(neighbor)) {
                continue;
            }
            double weight = network.minWeight(link, weightField);
            if (!Double.isFinite(weight)) {
                continue;
            }
            double candidate = nodeCost + weight;
            if (candidate < lane.bestCost(neighbor)) {
                lane.improve(neighbor, candidate, node);
                searchBudget.checkFrontierSize(context.frontierSize());

                double oppositeCost = opposite.bestCost(neighbor);
                if (Double.isFinite(oppositeCost)) {
                    meeting.offer(neighbor, candidate + oppositeCost);
                }
            }
        }
    }

    /**
     * Joins the predecessor chain up to the meeting node with the successor chain after it.
     */
    private static int[] buildPath(SearchQueryContext.Lane forward, SearchQueryContext.Lane backward, int meetingNode) {
        IntArrayList head = new IntArrayList();
        for (int cursor = meetingNode; cursor != RoadNetwork.NO_NODE; cursor = forward.parent(cursor)) {
            head.add(cursor);
        }
        IntArrayList path = new IntArrayList(head.size() * 2);
        for (int i = head.size() - 1; i >= 0; i--) {
            path.add(head.getInt(i));
        }
        for (int cursor = backward.parent(meetingNode); cursor != RoadNetwork.NO_NODE; cursor = backward.parent(cursor)) {
            path.add(cursor);
        }
        return path.toIntArray();
    }

    private static void requireNode(RoadNetwork network, int nodeId, String role) {
        if (!network.containsNode(nodeId)) {
            throw new RouteException(
                    RouteErrorKind.GRAPH,
                    REASON_NODE_NOT_FOUND,
                    role + " node " + nodeId + " is not part of the network (nodeCount=" + network.nodeCount() + ")"
            );
        }
    }

    /**
     * Best meeting node seen so far.
     */
    private static final class Meeting {
        private int node = NO_MEETING;
        private double cost = Double.POSITIVE_INFINITY;

        void offer(int candidateNode, double candidateCost) {
            if (candidateCost < cost) {
                cost = candidateCost;
                node = candidateNode;
            }
        }
    }
}
