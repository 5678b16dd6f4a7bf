package org.itinera.routing.core;

import org.itinera.routing.exclusion.ExclusionSet;
import org.itinera.routing.graph.EdgeVariant;
import org.itinera.routing.graph.RoadGraph;
import org.itinera.routing.graph.WeightField;
import org.itinera.routing.testutil.RoadNetworkFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path Metrics Calculator Tests")
class PathMetricsCalculatorTest {
    private final PathMetricsCalculator calculator = new PathMetricsCalculator();

    @Test
    @DisplayName("Metrics on the corridor sum lengths and times along the path")
    void testCorridorMetrics() {
        RoadGraph graph = RoadNetworkFixtures.beninCorridor();
        int[] path = {
                graph.internalId("cotonou"),
                graph.internalId("calavi"),
                graph.internalId("allada"),
                graph.internalId("bohicon")
        };

        PathMetrics metrics = calculator.measure(graph, path);

        assertEquals(108_000.0d, metrics.getDistanceMeters(), 1e-9);
        assertEquals(108.0d, metrics.distanceKm(), 1e-9);
        assertEquals(125 * 60.0d, metrics.getDurationSeconds(), 1e-9);
        assertEquals(7.1782d, metrics.getNorthernmostLatitude(), 1e-12);
        assertEquals(3, metrics.getLinkCount());
    }

    @Test
    @DisplayName("Distance of a searched path equals the sum of shortest variants when the fastest is also shortest")
    void testDistanceMatchesShortestVariants() {
        RoadGraph graph = RoadNetworkFixtures.aToE();
        SearchResult result = new BidirectionalDijkstraEngine(SearchBudget.unbounded())
                .search(graph, 0, 3, WeightField.DURATION, ExclusionSet.empty());

        PathMetrics metrics = calculator.measure(graph, result.nodePath());
        double shortest = 0.0d;
        int[] path = result.nodePath();
        for (int i = 0; i + 1 < path.length; i++) {
            shortest += graph.minWeight(graph.findLink(path[i], path[i + 1]), WeightField.DISTANCE);
        }
        assertEquals(shortest, metrics.getDistanceMeters(), 1e-9);
        assertEquals(result.cost(), metrics.getDurationSeconds(), 1e-9);
    }

    @Test
    @DisplayName("Both totals come from the fastest variant, not the shortest")
    void testFastestVariantDrivesBothTotals() {
        RoadGraph graph = RoadGraph.builder()
                .addNode("a", 6.0, 2.0)
                .addNode("b", 6.1, 2.0)
                .addEdge("a", "b", EdgeVariant.of(5_000, 600, "old road"))
                .addEdge("a", "b", EdgeVariant.of(7_000, 300, "highway"))
                .build();

        PathMetrics metrics = calculator.measure(graph, new int[]{0, 1});
        assertEquals(7_000.0d, metrics.getDistanceMeters());
        assertEquals(300.0d, metrics.getDurationSeconds());
    }

    @Test
    @DisplayName("Links without travel time add distance but no time")
    void testMissingTravelTimeCountsAsZero() {
        RoadGraph graph = RoadGraph.builder()
                .addNode("a", 0, 0)
                .addNode("b", 0, 1)
                .addNode("c", 0, 2)
                .addEdge("a", "b", EdgeVariant.ofLength(400))
                .addEdge("b", "c", 600, 50)
                .build();

        PathMetrics metrics = calculator.measure(graph, new int[]{0, 1, 2});
        assertEquals(1_000.0d, metrics.getDistanceMeters());
        assertEquals(50.0d, metrics.getDurationSeconds());
    }

    @Test
    @DisplayName("Single-node path has zero totals")
    void testSingleNodePath() {
        RoadGraph graph = RoadNetworkFixtures.aToE();
        PathMetrics metrics = calculator.measure(graph, new int[]{4});

        assertEquals(0.0d, metrics.getDistanceMeters());
        assertEquals(0.0d, metrics.getDurationSeconds());
        assertEquals(1.0d, metrics.getNorthernmostLatitude());
        assertEquals(0, metrics.getLinkCount());
    }

    @Test
    @DisplayName("Missing link between consecutive nodes is a graph failure")
    void testMissingLink() {
        RoadGraph graph = RoadNetworkFixtures.aToE();
        RouteException ex = assertThrows(RouteException.class, () -> calculator.measure(graph, new int[]{0, 2}));
        assertEquals(RouteErrorKind.GRAPH, ex.getKind());
        assertEquals(PathMetricsCalculator.REASON_EDGE_NOT_FOUND, ex.getReasonCode());
    }

    @Test
    @DisplayName("Unknown node and empty path are rejected")
    void testInvalidPaths() {
        RoadGraph graph = RoadNetworkFixtures.aToE();
        RouteException ex = assertThrows(RouteException.class, () -> calculator.measure(graph, new int[]{0, 42}));
        assertEquals(PathMetricsCalculator.REASON_NODE_NOT_FOUND, ex.getReasonCode());
        assertThrows(IllegalArgumentException.class, () -> calculator.measure(graph, new int[0]));
    }
}
