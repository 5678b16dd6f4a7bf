package org.itinera.routing.exclusion;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.itinera.routing.collaborator.CollaboratorResult;
import org.itinera.routing.collaborator.Geocoder;
import org.itinera.routing.graph.Coordinate;
import org.itinera.routing.graph.RoadNetwork;

import java.util.Objects;

/**
 * Builds the set of nodes lying inside a circular zone around a named place.
 *
 * <p>The zone is a disc in raw degree space: one degree is taken as 111 km on both axes,
 * and longitude is not scaled by latitude. Exclusion is best-effort; a place that cannot
 * be resolved yields an empty set.</p>
 */
@Slf4j
public final class ExclusionFilter {
    static final double KM_PER_DEGREE = 111.0d;

    private final Geocoder geocoder;
    private final String regionName;

    /**
     * @param geocoder place resolver.
     * @param regionName qualifier appended to place queries, or {@code null} for none.
     */
    public ExclusionFilter(Geocoder geocoder, String regionName) {
        this.geocoder = Objects.requireNonNull(geocoder, "geocoder");
        this.regionName = regionName;
    }

    /**
     * Resolves {@code placeName} and returns every node within {@code radiusKm} of it.
     *
     * @throws IllegalArgumentException when the radius is negative or not finite.
     */
    public ExclusionSet exclusionZone(RoadNetwork network, String placeName, double radiusKm) {
        Objects.requireNonNull(network, "network");
        validateRadius(radiusKm);
        if (placeName == null || placeName.isBlank()) {
            return ExclusionSet.empty();
        }

        String query = qualify(placeName.trim());
        CollaboratorResult<Coordinate> center;
        try {
            center = geocoder.resolvePlace(query);
        } catch (RuntimeException ex) {
            center = CollaboratorResult.failure("geocoder threw " + ex.getClass().getSimpleName(), ex);
        }
        if (center == null) {
            center = CollaboratorResult.failure("geocoder returned no result");
        }
        if (!center.isSuccess()) {
            log.warn("Cannot resolve avoid place '{}': {}. Continuing without exclusion", query, center.failureReason());
            return ExclusionSet.empty();
        }

        ExclusionSet zone = nodesWithin(network, center.value(), radiusKm);
        log.debug("Avoid zone around '{}' at {} (r={} km) covers {} nodes", query, center.value(), radiusKm, zone.size());
        return zone;
    }

    /**
     * Full scan selecting nodes strictly inside the disc of {@code radiusKm} around {@code center}.
     */
    public static ExclusionSet nodesWithin(RoadNetwork network, Coordinate center, double radiusKm) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(center, "center");
        validateRadius(radiusKm);

        double threshold = radiusKm / KM_PER_DEGREE;
        double thresholdSquared = threshold * threshold;
        IntOpenHashSet excluded = new IntOpenHashSet();
        for (int node = 0; node < network.nodeCount(); node++) {
            if (center.squaredDegreeDistance(network.latitude(node), network.longitude(node)) < thresholdSquared) {
                excluded.add(node);
            }
        }
        return ExclusionSet.copyOf(excluded);
    }

    private String qualify(String placeName) {
        if (regionName == null || regionName.isBlank()) {
            return placeName;
        }
        return placeName + ", " + regionName;
    }

    private static void validateRadius(double radiusKm) {
        if (!Double.isFinite(radiusKm) || radiusKm < 0.0d) {
            throw new IllegalArgumentException("radiusKm must be finite and >= 0, got " + radiusKm);
        }
    }
}
