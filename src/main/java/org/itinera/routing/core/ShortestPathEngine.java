package org.itinera.routing.core;

import org.itinera.routing.exclusion.ExclusionSet;
import org.itinera.routing.graph.RoadNetwork;
import org.itinera.routing.graph.WeightField;

/**
 * Point-to-point shortest-path search over a {@link RoadNetwork}.
 *
 * <p>Implementations must be safe for concurrent calls on a shared network and throw
 * {@link RouteException} for contract failures.</p>
 */
public interface ShortestPathEngine {
    /**
     * Finds a lowest-cost path that never expands an excluded node.
     *
     * @param network graph to search.
     * @param start internal start node id.
     * @param end internal end node id.
     * @param weightField edge attribute minimized by the search.
     * @param exclusions nodes that must not be expanded.
     * @param cancellation token polled once per round.
     * @return found or no-path result.
     * @throws RouteException with kind GRAPH when an endpoint is unknown or a budget is
     *                        exceeded, or kind CANCELLED when the token fires.
     */
    SearchResult search(
            RoadNetwork network,
            int start,
            int end,
            WeightField weightField,
            ExclusionSet exclusions,
            SearchCancellation cancellation
    );

    default SearchResult search(RoadNetwork network, int start, int end, WeightField weightField, ExclusionSet exclusions) {
        return search(network, start, end, weightField, exclusions, SearchCancellation.NONE);
    }
}
