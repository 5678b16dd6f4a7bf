package org.itinera.routing.graph;

/**
 * Edge attribute minimized by a shortest-path search.
 */
public enum WeightField {
    /** Variant length in meters. */
    DISTANCE,
    /** Variant travel time in seconds. */
    DURATION;

    /**
     * Reads this field from one edge variant.
     *
     * <p>A variant without travel time reads as {@code +INF} for {@link #DURATION}.</p>
     */
    public double read(EdgeVariant variant) {
        return switch (this) {
            case DISTANCE -> variant.getLengthMeters();
            case DURATION -> variant.getTravelTimeSeconds();
        };
    }
}
