package org.itinera.routing.segmentation;

import java.util.Locale;
import java.util.Objects;

/**
 * City-level leg: a place reached and the distance covered since the previous leg.
 *
 * @param placeName name of the place reached.
 * @param distanceKm distance in kilometers.
 */
public record Leg(String placeName, double distanceKm) {
    public Leg {
        Objects.requireNonNull(placeName, "placeName");
        if (!Double.isFinite(distanceKm) || distanceKm < 0.0d) {
            throw new IllegalArgumentException("distanceKm must be finite and >= 0, got " + distanceKm);
        }
    }

    /**
     * Same leg under another display name.
     */
    public Leg withPlaceName(String name) {
        return new Leg(name, distanceKm);
    }

    /**
     * Renders {@code "<name> - <km>km"} with one decimal.
     */
    public String format() {
        return String.format(Locale.ROOT, "%s - %.1fkm", placeName, distanceKm);
    }
}
