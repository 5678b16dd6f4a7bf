package org.itinera.routing.core;

import lombok.Builder;
import lombok.Value;
import org.itinera.routing.graph.WeightField;
import org.itinera.routing.narrative.Season;

/**
 * Client route query in place-name space.
 */
@Value
@Builder
public class RouteQuery {
    /** Departure place name. */
    String startPlace;
    /** Destination place name. */
    String endPlace;
    /** Place whose surroundings must be avoided, or {@code null}. */
    String avoidPlace;
    /** Field to minimize; {@code null} selects the configured default. */
    WeightField weightField;
    /** Travel season; {@code null} means dry season. */
    Season season;
    /** Optional cancellation token. */
    SearchCancellation cancellation;

    public boolean hasAvoidPlace() {
        return avoidPlace != null && !avoidPlace.isBlank();
    }
}
