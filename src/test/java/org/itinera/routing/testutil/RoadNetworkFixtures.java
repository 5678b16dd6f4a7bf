package org.itinera.routing.testutil;

import org.itinera.routing.graph.EdgeVariant;
import org.itinera.routing.graph.RoadGraph;

/**
 * Shared road networks for routing tests.
 */
public final class RoadNetworkFixtures {
    public static final double MINUTE = 60.0d;

    private RoadNetworkFixtures() {
    }

    /**
     * Five nodes where A-E-D (length 10) beats A-B-C-D (length 30). Travel time equals length.
     */
    public static RoadGraph aToE() {
        return RoadGraph.builder()
                .addNode("A", 0.0, 0.0)
                .addNode("B", 0.0, 1.0)
                .addNode("C", 0.0, 2.0)
                .addNode("D", 0.0, 3.0)
                .addNode("E", 1.0, 1.5)
                .addEdge("A", "B", 10, 10)
                .addEdge("B", "C", 10, 10)
                .addEdge("C", "D", 10, 10)
                .addEdge("A", "E", 5, 5)
                .addEdge("E", "D", 5, 5)
                .build();
    }

    /**
     * Two-way corridor through Beninese towns, one node per town placed on the town's
     * gazetteer coordinate.
     *
     * <p>Cotonou reaches Bohicon either through Allada (108 km, 125 min) or along the
     * coast through Ouidah, Lokossa and Abomey (159 km, 177 min). The northern branch
     * continues through Dassa-Zoume, Parakou and Djougou to Natitingou.</p>
     */
    public static RoadGraph beninCorridor() {
        RoadGraph.Builder builder = RoadGraph.builder()
                .addNode("cotonou", 6.3654, 2.4183)
                .addNode("calavi", 6.4485, 2.3557)
                .addNode("allada", 6.6658, 2.1511)
                .addNode("bohicon", 7.1782, 2.0667)
                .addNode("ouidah", 6.3631, 2.0853)
                .addNode("lokossa", 6.6387, 1.7167)
                .addNode("abomey", 7.1829, 1.9912)
                .addNode("dassa", 7.7500, 2.1833)
                .addNode("parakou", 9.3372, 2.6303)
                .addNode("djougou", 9.7085, 1.6660)
                .addNode("natitingou", 10.3042, 1.3796);
        road(builder, "cotonou", "calavi", 18, 30, "RNIE2");
        road(builder, "calavi", "allada", 30, 35, "RNIE2");
        road(builder, "allada", "bohicon", 60, 60, "RNIE2");
        road(builder, "cotonou", "ouidah", 40, 45, "RNIE1");
        road(builder, "ouidah", "lokossa", 45, 50, "RNIE1");
        road(builder, "lokossa", "abomey", 65, 70, "RNIE4");
        road(builder, "abomey", "bohicon", 9, 12, "RNIE4");
        road(builder, "bohicon", "dassa", 65, 60, "RNIE2");
        road(builder, "dassa", "parakou", 170, 200, "RNIE2");
        road(builder, "parakou", "djougou", 130, 120, "RNIE3");
        road(builder, "djougou", "natitingou", 80, 80, "RNIE3");
        return builder.build();
    }

    private static void road(RoadGraph.Builder builder, String from, String to, double km, double minutes, String name) {
        builder.addTwoWayEdge(from, to, EdgeVariant.of(km * 1000.0d, minutes * MINUTE, name));
    }
}
