package org.itinera.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate figures for one node path.
 */
@Value
@Builder
public class PathMetrics {
    /** Sum of representative-variant lengths in meters. */
    double distanceMeters;
    /** Sum of representative-variant travel times in seconds; absent times count as zero. */
    double durationSeconds;
    /** Largest latitude of any node on the path. */
    double northernmostLatitude;
    /** Number of traversed links. */
    int linkCount;

    public double distanceKm() {
        return distanceMeters / 1000.0d;
    }
}
