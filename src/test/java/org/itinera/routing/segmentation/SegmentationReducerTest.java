package org.itinera.routing.segmentation;

import org.itinera.routing.collaborator.PlaceResolution;
import org.itinera.routing.core.RouteException;
import org.itinera.routing.graph.EdgeVariant;
import org.itinera.routing.graph.RoadGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Segmentation Reducer Tests")
class SegmentationReducerTest {
    private static final String BJ = "BJ";

    private final SegmentationReducer reducer = new SegmentationReducer();

    /**
     * Chain n0 -> n1 -> ... with one kilometer per link.
     */
    private static RoadGraph chain(int nodes) {
        RoadGraph.Builder builder = RoadGraph.builder();
        for (int i = 0; i < nodes; i++) {
            builder.addNode("n" + i, 6.0 + i * 0.01, 2.0);
        }
        for (int i = 0; i + 1 < nodes; i++) {
            builder.addEdge("n" + i, "n" + (i + 1), 1_000, 60);
        }
        return builder.build();
    }

    private static int[] path(int nodes) {
        int[] path = new int[nodes];
        for (int i = 0; i < nodes; i++) {
            path[i] = i;
        }
        return path;
    }

    private static PlaceResolution bj(String name) {
        return new PlaceResolution(name, BJ);
    }

    @Test
    @DisplayName("Each change of town opens a leg with the distance since the previous one")
    void testLegsPerTownChange() {
        List<PlaceResolution> places = List.of(
                bj("Cotonou"), bj("Cotonou"), bj("Calavi"), bj("Calavi"), bj("Calavi"), bj("Allada"), bj("Bohicon"));

        Segmentation segmentation = reducer.reduce(chain(7), path(7), places, BJ);

        assertEquals(List.of(new Leg("Calavi", 2.0), new Leg("Allada", 3.0)), segmentation.legs());
        assertEquals(1_000.0d, segmentation.trailingMeters());
        assertEquals("Bohicon", segmentation.finalPlaceName());
        assertEquals(6.0d, segmentation.totalKm(), 1e-9);
    }

    @Test
    @DisplayName("Out-of-region nodes never open a leg but their distance is kept")
    void testOutOfRegionNodesSkipped() {
        List<PlaceResolution> places = List.of(
                bj("Cotonou"),
                new PlaceResolution("Badagry", "NG"),
                new PlaceResolution("Badagry", "NG"),
                bj("Porto-Novo"),
                bj("Pobe"));

        Segmentation segmentation = reducer.reduce(chain(5), path(5), places, BJ);

        assertEquals(List.of(new Leg("Porto-Novo", 3.0)), segmentation.legs());
        assertEquals(1_000.0d, segmentation.trailingMeters());
    }

    @Test
    @DisplayName("Final place is the last in-region name, and entering it folds into the destination")
    void testFinalPlaceFolding() {
        List<PlaceResolution> places = List.of(
                bj("Malanville"), bj("Malanville"), bj("Gaya"), new PlaceResolution("Gaya", "NE"));

        Segmentation segmentation = reducer.reduce(chain(4), path(4), places, BJ);

        assertEquals("Gaya", segmentation.finalPlaceName());
        assertTrue(segmentation.legs().isEmpty());
        assertEquals(3_000.0d, segmentation.trailingMeters());
    }

    @Test
    @DisplayName("Without any in-region place the last name is final")
    void testFinalPlaceFallsBackToLastName() {
        List<PlaceResolution> places = List.of(
                new PlaceResolution("Lome", "TG"), new PlaceResolution("Aneho", "TG"));

        Segmentation segmentation = reducer.reduce(chain(2), path(2), places, BJ);

        assertEquals("Aneho", segmentation.finalPlaceName());
        assertTrue(segmentation.legs().isEmpty());
        assertEquals(1_000.0d, segmentation.trailingMeters());
    }

    @Test
    @DisplayName("Passing through the final town mid-route does not emit a leg for it")
    void testFinalTownCrossedMidRoute() {
        List<PlaceResolution> places = List.of(
                bj("Abomey"), bj("Bohicon"), bj("Zogbodomey"), bj("Bohicon"));

        Segmentation segmentation = reducer.reduce(chain(4), path(4), places, BJ);

        assertEquals(List.of(new Leg("Zogbodomey", 2.0)), segmentation.legs());
        assertEquals(1_000.0d, segmentation.trailingMeters());
        assertEquals("Bohicon", segmentation.finalPlaceName());
    }

    @Test
    @DisplayName("Accumulation uses the shortest variant of each link")
    void testShortestVariantLength() {
        RoadGraph graph = RoadGraph.builder()
                .addNode("a", 6.0, 2.0)
                .addNode("b", 6.1, 2.0)
                .addNode("c", 6.2, 2.0)
                .addEdge("a", "b", EdgeVariant.of(4_000, 100))
                .addEdge("a", "b", EdgeVariant.of(2_500, 400))
                .addEdge("b", "c", EdgeVariant.ofLength(1_500))
                .build();

        Segmentation segmentation = reducer.reduce(
                graph, new int[]{0, 1, 2}, List.of(bj("A"), bj("B"), bj("C")), BJ);

        assertEquals(List.of(new Leg("B", 2.5)), segmentation.legs());
        assertEquals(1_500.0d, segmentation.trailingMeters());
    }

    @Test
    @DisplayName("Re-running on the same input yields the same legs")
    void testDeterministic() {
        List<PlaceResolution> places = List.of(
                bj("Cotonou"), bj("Calavi"), bj("Ze"), bj("Allada"), bj("Toffo"), bj("Bohicon"));
        RoadGraph graph = chain(6);

        Segmentation first = reducer.reduce(graph, path(6), places, BJ);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, reducer.reduce(graph, path(6), places, BJ));
        }
    }

    @Test
    @DisplayName("Single-node path has no legs and no trailing distance")
    void testSingleNodePath() {
        Segmentation segmentation = reducer.reduce(chain(1), new int[]{0}, List.of(bj("Cotonou")), BJ);

        assertTrue(segmentation.legs().isEmpty());
        assertEquals(0.0d, segmentation.trailingMeters());
        assertEquals("Cotonou", segmentation.finalPlaceName());
    }

    @Test
    @DisplayName("Place list must match the path length")
    void testSizeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> reducer.reduce(chain(3), path(3), List.of(bj("A"), bj("B")), BJ));
        assertThrows(IllegalArgumentException.class,
                () -> reducer.reduce(chain(1), new int[0], List.of(), BJ));
    }

    @Test
    @DisplayName("Unlinked consecutive nodes are a graph failure")
    void testMissingLink() {
        assertThrows(RouteException.class,
                () -> reducer.reduce(chain(3), new int[]{2, 1}, List.of(bj("A"), bj("B")), BJ));
    }

    @Test
    @DisplayName("Legs render with one decimal")
    void testLegFormat() {
        assertEquals("Allada - 30.0km", new Leg("Allada", 30.0).format());
        assertEquals("Bohicon - 0.3km", new Leg("Bohicon", 0.25).format());
        assertThrows(IllegalArgumentException.class, () -> new Leg("x", -1.0));
    }
}
