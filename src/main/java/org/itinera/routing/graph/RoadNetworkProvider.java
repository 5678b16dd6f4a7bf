package org.itinera.routing.graph;

/**
 * Supplies the road network used by route computations.
 */
public interface RoadNetworkProvider {
    /**
     * Returns the network snapshot.
     *
     * @throws GraphUnavailableException when the network cannot be produced.
     */
    RoadNetwork network();

    /**
     * Failure to obtain a network snapshot.
     */
    final class GraphUnavailableException extends RuntimeException {
        public GraphUnavailableException(String message) {
            super(message);
        }

        public GraphUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
