package org.itinera.routing.collaborator;

import org.itinera.routing.graph.Coordinate;

import java.util.List;

/**
 * Resolves coordinates to place names and region codes.
 */
@FunctionalInterface
public interface ReverseGeocoder {
    /**
     * Resolves a batch of coordinates.
     *
     * <p>A successful result has exactly one entry per input coordinate, in input order.</p>
     */
    CollaboratorResult<List<PlaceResolution>> reverseResolve(List<Coordinate> coordinates);
}
