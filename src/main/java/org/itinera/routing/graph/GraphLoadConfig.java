package org.itinera.routing.graph;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Explicit settings handed to a graph loader.
 *
 * <p>Replaces process-wide loader switches: each provider is constructed with its own
 * immutable copy.</p>
 */
@Value
@Builder(toBuilder = true)
public class GraphLoadConfig {
    /** Area whose drivable network should be loaded. */
    @NonNull
    String placeName;
    /** Optional road-class filter understood by the loader. */
    String highwayFilter;
    /** Whether the provider may memoize the loaded snapshot. */
    @Builder.Default
    boolean cacheEnabled = true;
    /** Upper bound on one remote fetch, when the loader performs one. */
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(180);

    /**
     * Defaults for one place name.
     */
    public static GraphLoadConfig forPlace(String placeName) {
        return GraphLoadConfig.builder().placeName(placeName).build();
    }
}
