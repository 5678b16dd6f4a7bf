package org.itinera.routing.core;

/**
 * Public route computation contract.
 *
 * <p>Implementations validate queries deterministically and throw {@link RouteException}
 * with a stable reason code for every failure.</p>
 */
public interface ItineraryService {
    /**
     * Computes one route between two named places.
     *
     * @param query client query.
     * @return displayable route.
     * @throws RouteException on invalid input, graph failures, missing path or cancellation.
     */
    RouteResult computeRoute(RouteQuery query);
}
