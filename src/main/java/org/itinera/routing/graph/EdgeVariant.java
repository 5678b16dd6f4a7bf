package org.itinera.routing.graph;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * One physical road segment between two intersections.
 *
 * <p>Several variants may connect the same ordered node pair. Travel time is optional;
 * when absent it is stored as {@code +INF} so it never wins a minimum-time selection
 * against a variant that carries one.</p>
 */
@Value
public class EdgeVariant {
    double lengthMeters;
    double travelTimeSeconds;
    List<String> names;

    private EdgeVariant(double lengthMeters, double travelTimeSeconds, List<String> names) {
        if (!Double.isFinite(lengthMeters) || lengthMeters < 0.0d) {
            throw new IllegalArgumentException("length must be finite and >= 0, got " + lengthMeters);
        }
        if (Double.isNaN(travelTimeSeconds) || travelTimeSeconds < 0.0d) {
            throw new IllegalArgumentException("travel time must be >= 0 when present, got " + travelTimeSeconds);
        }
        this.lengthMeters = lengthMeters;
        this.travelTimeSeconds = travelTimeSeconds;
        this.names = names;
    }

    /**
     * Creates a variant without travel time.
     */
    public static EdgeVariant ofLength(double lengthMeters, String... names) {
        return new EdgeVariant(lengthMeters, Double.POSITIVE_INFINITY, copyNames(names));
    }

    /**
     * Creates a variant with both length and travel time.
     */
    public static EdgeVariant of(double lengthMeters, double travelTimeSeconds, String... names) {
        return new EdgeVariant(lengthMeters, travelTimeSeconds, copyNames(names));
    }

    public boolean hasTravelTime() {
        return travelTimeSeconds != Double.POSITIVE_INFINITY;
    }

    /**
     * Travel time contribution used for path totals: absent time counts as zero.
     */
    public double travelTimeOrZero() {
        return hasTravelTime() ? travelTimeSeconds : 0.0d;
    }

    private static List<String> copyNames(String[] names) {
        if (names == null || names.length == 0) {
            return List.of();
        }
        return List.copyOf(Arrays.asList(names));
    }
}
