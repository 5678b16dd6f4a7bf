package org.itinera.routing.segmentation;

import org.itinera.routing.collaborator.PlaceResolution;
import org.itinera.routing.core.RouteErrorKind;
import org.itinera.routing.core.RouteException;
import org.itinera.routing.core.PathMetricsCalculator;
import org.itinera.routing.graph.RoadNetwork;
import org.itinera.routing.graph.WeightField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collapses a node path into city-level legs.
 *
 * <p>Walks the path accumulating the shortest variant length of each link. Each time the
 * path enters a new in-region place, the accumulated distance is emitted as a leg to that
 * place. Out-of-region nodes never open a leg. Entering the final place emits nothing; its
 * distance stays in the trailing accumulator for the destination leg.</p>
 */
public final class SegmentationReducer {

    /**
     * Reduces {@code nodePath} using one resolved place per node.
     *
     * @param network graph the path belongs to.
     * @param nodePath internal node ids, start first.
     * @param places one resolution per path node, same order.
     * @param coveredRegionCode region code whose places may open legs.
     * @throws IllegalArgumentException when the path is empty or sizes differ.
     * @throws RouteException with kind GRAPH when consecutive path nodes are not linked.
     */
    public Segmentation reduce(
            RoadNetwork network,
            int[] nodePath,
            List<PlaceResolution> places,
            String coveredRegionCode
    ) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(nodePath, "nodePath");
        Objects.requireNonNull(places, "places");
        Objects.requireNonNull(coveredRegionCode, "coveredRegionCode");
        if (nodePath.length == 0) {
            throw new IllegalArgumentException("nodePath must contain at least one node");
        }
        if (places.size() != nodePath.length) {
            throw new IllegalArgumentException(
                    "expected one place per path node: " + places.size() + " places for " + nodePath.length + " nodes"
            );
        }

        String finalPlace = finalPlaceName(places, coveredRegionCode);
        String current = places.get(0).placeName();
        double accumulatedMeters = 0.0d;
        List<Leg> legs = new ArrayList<>();

        for (int i = 0; i + 1 < nodePath.length; i++) {
            accumulatedMeters += shortestLength(network, nodePath[i], nodePath[i + 1]);

            PlaceResolution next = places.get(i + 1);
            if (!next.isInRegion(coveredRegionCode)) {
                continue;
            }
            String name = next.placeName();
            if (name.equals(current)) {
                continue;
            }
            current = name;
            if (name.equals(finalPlace)) {
                continue;
            }
            legs.add(new Leg(name, accumulatedMeters / 1000.0d));
            accumulatedMeters = 0.0d;
        }
        return new Segmentation(legs, accumulatedMeters, finalPlace);
    }

    private static String finalPlaceName(List<PlaceResolution> places, String coveredRegionCode) {
        for (int i = places.size() - 1; i >= 0; i--) {
            if (places.get(i).isInRegion(coveredRegionCode)) {
                return places.get(i).placeName();
            }
        }
        return places.get(places.size() - 1).placeName();
    }

    private static double shortestLength(RoadNetwork network, int from, int to) {
        int link = network.findLink(from, to);
        if (link == RoadNetwork.NO_LINK) {
            throw new RouteException(
                    RouteErrorKind.GRAPH,
                    PathMetricsCalculator.REASON_EDGE_NOT_FOUND,
                    "no link between consecutive path nodes " + network.externalId(from) + " -> " + network.externalId(to)
            );
        }
        return network.minWeight(link, WeightField.DISTANCE);
    }
}
