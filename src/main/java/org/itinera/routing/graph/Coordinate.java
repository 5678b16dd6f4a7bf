package org.itinera.routing.graph;

import java.util.Locale;

/**
 * Geographic coordinate in decimal degrees.
 *
 * @param latitude latitude in degrees.
 * @param longitude longitude in degrees.
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException(
                    "coordinate components must be finite, got (" + latitude + ", " + longitude + ")");
        }
    }

    /**
     * Squared euclidean distance in degree space.
     */
    public double squaredDegreeDistance(double otherLatitude, double otherLongitude) {
        double dLat = otherLatitude - latitude;
        double dLon = otherLongitude - longitude;
        return dLat * dLat + dLon * dLon;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.6f, %.6f)", latitude, longitude);
    }
}
