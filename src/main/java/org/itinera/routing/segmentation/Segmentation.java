package org.itinera.routing.segmentation;

import java.util.List;
import java.util.Objects;

/**
 * Intermediate legs of a path plus the distance left for the destination leg.
 *
 * @param legs ordered intermediate legs.
 * @param trailingMeters distance accumulated after the last emitted leg.
 * @param finalPlaceName name of the last in-region place on the path.
 */
public record Segmentation(List<Leg> legs, double trailingMeters, String finalPlaceName) {
    public Segmentation {
        legs = List.copyOf(legs);
        Objects.requireNonNull(finalPlaceName, "finalPlaceName");
    }

    public double trailingKm() {
        return trailingMeters / 1000.0d;
    }

    /**
     * Sum of all leg distances and the trailing distance, in kilometers.
     */
    public double totalKm() {
        double total = trailingKm();
        for (Leg leg : legs) {
            total += leg.distanceKm();
        }
        return total;
    }
}
