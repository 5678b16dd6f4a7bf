package org.itinera.routing.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.itinera.routing.graph.WeightField;

import java.util.Locale;

/**
 * Runtime settings for route computation and narrative heuristics.
 */
@Value
@Builder(toBuilder = true)
public class RoutingRuntimeConfig {
    static final String PROPERTY_PREFIX = "itinera.routing.";

    /** ISO code of the country the service covers. */
    @NonNull
    @Builder.Default
    String coveredRegionCode = "BJ";

    /** Country name appended to place queries that fail on their own. */
    @Builder.Default
    String regionName = "Benin";

    /** Radius of the zone removed around an avoided place. */
    @Builder.Default
    double avoidRadiusKm = 3.0d;

    /** Bus fare in CFA francs per kilometer. */
    @Builder.Default
    double busFarePerKm = 18.0d;

    /** Taxi fare in CFA francs per kilometer. */
    @Builder.Default
    double taxiFarePerKm = 30.0d;

    /**
     * Latitude above which rainy-season routes are slowed down.
     */
    @Builder.Default
    double rainyLatitudeThreshold = 9.8d;

    /** Delay added to rainy-season routes crossing the threshold latitude. */
    @Builder.Default
    long rainyDelaySeconds = 1800L;

    /** Trips lasting at least this many hours get a split suggestion. */
    @Builder.Default
    int longTripHours = 10;

    /** Weight field used when a query does not name one. */
    @NonNull
    @Builder.Default
    WeightField defaultWeightField = WeightField.DURATION;

    @NonNull
    @Builder.Default
    SearchBudget searchBudget = SearchBudget.unbounded();

    public static RoutingRuntimeConfig defaults() {
        return RoutingRuntimeConfig.builder().build();
    }

    /**
     * Defaults overridden by {@code itinera.routing.*} system properties.
     *
     * <p>Missing or malformed values keep the default. The search budget is read from
     * {@link SearchBudget#defaults()}.</p>
     */
    public static RoutingRuntimeConfig fromSystemProperties() {
        RoutingRuntimeConfig base = defaults();
        return base.toBuilder()
                .coveredRegionCode(readString("coveredRegionCode", base.getCoveredRegionCode()).toUpperCase(Locale.ROOT))
                .regionName(readString("regionName", base.getRegionName()))
                .avoidRadiusKm(readNonNegative("avoidRadiusKm", base.getAvoidRadiusKm()))
                .busFarePerKm(readNonNegative("busFarePerKm", base.getBusFarePerKm()))
                .taxiFarePerKm(readNonNegative("taxiFarePerKm", base.getTaxiFarePerKm()))
                .rainyLatitudeThreshold(readDouble("rainyLatitudeThreshold", base.getRainyLatitudeThreshold()))
                .rainyDelaySeconds((long) readNonNegative("rainyDelaySeconds", base.getRainyDelaySeconds()))
                .longTripHours((int) readNonNegative("longTripHours", base.getLongTripHours()))
                .defaultWeightField(readWeightField("defaultWeightField", base.getDefaultWeightField()))
                .searchBudget(SearchBudget.defaults())
                .build();
    }

    private static String readString(String key, String fallback) {
        String raw = System.getProperty(PROPERTY_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static double readDouble(String key, double fallback) {
        String raw = System.getProperty(PROPERTY_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readNonNegative(String key, double fallback) {
        double value = readDouble(key, fallback);
        return value < 0.0d ? fallback : value;
    }

    private static WeightField readWeightField(String key, WeightField fallback) {
        String raw = System.getProperty(PROPERTY_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return WeightField.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
