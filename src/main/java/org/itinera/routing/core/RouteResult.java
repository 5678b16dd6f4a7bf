package org.itinera.routing.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.itinera.routing.segmentation.Leg;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable route with its aggregate figures.
 *
 * <p>Leg and place labels are already localized. Season and summary are kept both in the
 * source language and translated.</p>
 */
@Value
@Builder
public class RouteResult {
    public static final String FIELD_DEPARTURE = "departure";
    public static final String FIELD_STEP_PREFIX = "step_";
    public static final String FIELD_DESTINATION = "destination";
    public static final String FIELD_AVOID_CITY = "avoid_city";
    public static final String FIELD_SEASON = "season";
    public static final String FIELD_INFO = "info_sup";

    /** Localized departure label. */
    @NonNull
    String departure;
    /** Intermediate legs in path order. */
    @Singular
    List<Leg> legs;
    /** Leg ending at the destination. */
    @NonNull
    Leg destination;
    /** Localized avoided place, or {@code null} when nothing was avoided. */
    String avoidedPlace;
    @NonNull
    String seasonLabel;
    @NonNull
    String translatedSeasonLabel;
    /** Summary line in the source language. */
    @NonNull
    String summary;
    @NonNull
    String translatedSummary;
    @NonNull
    PathMetrics metrics;
    /** Travel time including weather delay, in seconds. */
    double adjustedDurationSeconds;
    /** Path in external node ids. */
    @Singular("pathNode")
    List<String> pathExternalIds;
    /** Search cost in units of the weight field used. */
    double searchCost;

    /**
     * Ordered display fields: departure, step_1..step_n, destination, optional avoid_city,
     * season and info_sup.
     */
    public Map<String, String> asFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_DEPARTURE, departure);
        for (int i = 0; i < legs.size(); i++) {
            fields.put(FIELD_STEP_PREFIX + (i + 1), legs.get(i).format());
        }
        fields.put(FIELD_DESTINATION, destination.format());
        if (avoidedPlace != null) {
            fields.put(FIELD_AVOID_CITY, avoidedPlace);
        }
        fields.put(FIELD_SEASON, translatedSeasonLabel);
        fields.put(FIELD_INFO, translatedSummary);
        return Collections.unmodifiableMap(fields);
    }
}
