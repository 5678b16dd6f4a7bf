package org.itinera.routing.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable nearest-node match.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SpatialMatch {
    private final int nodeId;
    private final double latitude;
    private final double longitude;
    private final double distanceSquared;
}
