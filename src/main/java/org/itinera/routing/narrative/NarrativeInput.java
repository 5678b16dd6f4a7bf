package org.itinera.routing.narrative;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.itinera.routing.core.PathMetrics;
import org.itinera.routing.segmentation.Segmentation;

import java.util.List;

/**
 * Everything the narrative needs about one computed route.
 */
@Value
@Builder
public class NarrativeInput {
    /** Start place as typed by the caller. */
    @NonNull
    String startLabel;
    /** End place as typed by the caller. */
    @NonNull
    String endLabel;
    /** Avoided place as typed by the caller, or {@code null}. */
    String avoidLabel;
    @NonNull
    @Builder.Default
    Season season = Season.DRY;
    @NonNull
    PathMetrics metrics;
    @NonNull
    Segmentation segmentation;
    /** Path in external node ids. */
    @Singular("pathNode")
    List<String> pathExternalIds;
    /** Search cost in units of the weight field used. */
    double searchCost;
}
