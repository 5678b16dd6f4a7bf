package org.itinera.routing.collaborator;

import org.itinera.routing.graph.Coordinate;

/**
 * Resolves a free-text place name to a coordinate.
 */
@FunctionalInterface
public interface Geocoder {
    CollaboratorResult<Coordinate> resolvePlace(String query);
}
