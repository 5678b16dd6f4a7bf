package org.itinera.routing.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.itinera.routing.collaborator.CollaboratorResult;
import org.itinera.routing.collaborator.Geocoder;
import org.itinera.routing.collaborator.PlaceResolution;
import org.itinera.routing.collaborator.ReverseGeocoder;
import org.itinera.routing.collaborator.Translator;
import org.itinera.routing.exclusion.ExclusionFilter;
import org.itinera.routing.exclusion.ExclusionSet;
import org.itinera.routing.graph.Coordinate;
import org.itinera.routing.graph.RoadNetwork;
import org.itinera.routing.graph.RoadNetworkProvider;
import org.itinera.routing.graph.WeightField;
import org.itinera.routing.narrative.NarrativeAssembler;
import org.itinera.routing.narrative.NarrativeInput;
import org.itinera.routing.narrative.PlaceNameLocalizer;
import org.itinera.routing.narrative.Season;
import org.itinera.routing.segmentation.Segmentation;
import org.itinera.routing.segmentation.SegmentationReducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Main route orchestration entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the query.</li>
 * <li>Obtain the network snapshot from the provider.</li>
 * <li>Geocode both places, trying the raw text first and the region-qualified text second.</li>
 * <li>Reject endpoints outside the covered region.</li>
 * <li>Snap both points to their nearest nodes and build the optional avoid zone.</li>
 * <li>Search, then measure, segment and narrate the path.</li>
 * </ul>
 * <p>Collaborator failures while naming the path or translating degrade the output instead
 * of failing the route. Geocoding and region-check failures are input errors.</p>
 */
@Slf4j
public final class ItineraryCore implements ItineraryService {
    public static final String REASON_QUERY_REQUIRED = "QUERY_REQUIRED";
    public static final String REASON_PLACE_REQUIRED = "PLACE_REQUIRED";
    public static final String REASON_SAME_ENDPOINTS = "SAME_ENDPOINTS";
    public static final String REASON_START_UNRESOLVED = "START_UNRESOLVED";
    public static final String REASON_END_UNRESOLVED = "END_UNRESOLVED";
    public static final String REASON_REGION_CHECK_FAILED = "REGION_CHECK_FAILED";
    public static final String REASON_START_OUTSIDE_REGION = "START_OUTSIDE_REGION";
    public static final String REASON_END_OUTSIDE_REGION = "END_OUTSIDE_REGION";
    public static final String REASON_GRAPH_UNAVAILABLE = "GRAPH_UNAVAILABLE";
    public static final String REASON_NO_PATH = "NO_PATH";

    private final RoadNetworkProvider networkProvider;
    private final Geocoder geocoder;
    private final ReverseGeocoder reverseGeocoder;
    private final RoutingRuntimeConfig config;
    private final ShortestPathEngine engine;
    private final ExclusionFilter exclusionFilter;
    private final PathMetricsCalculator metricsCalculator;
    private final SegmentationReducer segmentationReducer;
    private final NarrativeAssembler narrativeAssembler;

    /**
     * Creates the route facade.
     *
     * @param networkProvider road network source.
     * @param geocoder place-name resolver.
     * @param reverseGeocoder coordinate-to-place resolver.
     * @param translator optional translator, identity when absent.
     * @param localizer optional place-name localizer, Fon table when absent.
     * @param engine optional search engine, bidirectional Dijkstra when absent.
     * @param config optional runtime config, defaults when absent.
     */
    @Builder
    public ItineraryCore(
            RoadNetworkProvider networkProvider,
            Geocoder geocoder,
            ReverseGeocoder reverseGeocoder,
            Translator translator,
            PlaceNameLocalizer localizer,
            ShortestPathEngine engine,
            RoutingRuntimeConfig config
    ) {
        this.networkProvider = Objects.requireNonNull(networkProvider, "networkProvider");
        this.geocoder = Objects.requireNonNull(geocoder, "geocoder");
        this.reverseGeocoder = Objects.requireNonNull(reverseGeocoder, "reverseGeocoder");
        this.config = config == null ? RoutingRuntimeConfig.defaults() : config;
        this.engine = engine == null ? new BidirectionalDijkstraEngine(this.config.getSearchBudget()) : engine;
        this.exclusionFilter = new ExclusionFilter(geocoder, this.config.getRegionName());
        this.metricsCalculator = new PathMetricsCalculator();
        this.segmentationReducer = new SegmentationReducer();
        this.narrativeAssembler = new NarrativeAssembler(
                this.config,
                translator == null ? Translator.identity() : translator,
                localizer == null ? PlaceNameLocalizer.fon() : localizer
        );
    }

    @Override
    public RouteResult computeRoute(RouteQuery query) {
        validate(query);
        String start = query.getStartPlace().trim();
        String end = query.getEndPlace().trim();
        WeightField weightField = query.getWeightField() == null ? config.getDefaultWeightField() : query.getWeightField();
        Season season = query.getSeason() == null ? Season.DRY : query.getSeason();

        RoadNetwork network = loadNetwork();

        Coordinate startPoint = geocodeOrThrow(start, REASON_START_UNRESOLVED, "departure");
        Coordinate endPoint = geocodeOrThrow(end, REASON_END_UNRESOLVED, "destination");
        checkCoveredRegion(startPoint, endPoint);

        int startNode = network.nearestNode(startPoint);
        int endNode = network.nearestNode(endPoint);

        ExclusionSet exclusions = ExclusionSet.empty();
        if (query.hasAvoidPlace()) {
            exclusions = exclusionFilter.exclusionZone(network, query.getAvoidPlace().trim(), config.getAvoidRadiusKm());
            log.debug("Avoiding {} nodes around '{}'", exclusions.size(), query.getAvoidPlace());
        }

        SearchResult searchResult = engine.search(network, startNode, endNode, weightField, exclusions, query.getCancellation());
        log.debug("Search {} -> {} settled {} nodes", network.externalId(startNode), network.externalId(endNode),
                searchResult.settledNodes());
        if (!searchResult.found()) {
            throw new RouteException(
                    RouteErrorKind.NO_PATH,
                    REASON_NO_PATH,
                    "no path from '" + start + "' to '" + end + "'"
                            + (exclusions.isEmpty() ? "" : " avoiding " + exclusions.size() + " nodes")
            );
        }

        int[] path = searchResult.nodePath();
        PathMetrics metrics = metricsCalculator.measure(network, path);
        Segmentation segmentation = segmentationReducer.reduce(
                network,
                path,
                namePath(network, path),
                config.getCoveredRegionCode()
        );

        List<String> externalPath = new ArrayList<>(path.length);
        for (int node : path) {
            externalPath.add(network.externalId(node));
        }

        RouteResult result = narrativeAssembler.assemble(NarrativeInput.builder()
                .startLabel(start)
                .endLabel(end)
                .avoidLabel(query.hasAvoidPlace() ? query.getAvoidPlace().trim() : null)
                .season(season)
                .metrics(metrics)
                .segmentation(segmentation)
                .pathExternalIds(externalPath)
                .searchCost(searchResult.cost())
                .build());

        log.info("Route '{}' -> '{}': {} nodes, {} intermediate legs, cost={} ({})",
                start, end, path.length, result.getLegs().size(), searchResult.cost(), weightField);
        return result;
    }

    private static void validate(RouteQuery query) {
        if (query == null) {
            throw new RouteException(RouteErrorKind.INPUT, REASON_QUERY_REQUIRED, "route query must be provided");
        }
        requirePlace(query.getStartPlace(), "startPlace");
        requirePlace(query.getEndPlace(), "endPlace");
        String start = query.getStartPlace().trim();
        String end = query.getEndPlace().trim();
        if (start.toLowerCase(Locale.ROOT).equals(end.toLowerCase(Locale.ROOT))) {
            throw new RouteException(
                    RouteErrorKind.INPUT,
                    REASON_SAME_ENDPOINTS,
                    "departure and destination are the same place (" + start + ")"
            );
        }
    }

    private static void requirePlace(String place, String fieldName) {
        if (place == null || place.isBlank()) {
            throw new RouteException(RouteErrorKind.INPUT, REASON_PLACE_REQUIRED, fieldName + " must be non-blank");
        }
    }

    private RoadNetwork loadNetwork() {
        RoadNetwork network;
        try {
            network = networkProvider.network();
        } catch (RuntimeException ex) {
            throw new RouteException(
                    RouteErrorKind.GRAPH,
                    REASON_GRAPH_UNAVAILABLE,
                    "road network could not be loaded: " + ex.getMessage(),
                    ex
            );
        }
        if (network == null || network.nodeCount() == 0) {
            throw new RouteException(RouteErrorKind.GRAPH, REASON_GRAPH_UNAVAILABLE, "road network is empty");
        }
        return network;
    }

    /**
     * Resolves the raw place text, then the region-qualified text.
     */
    CollaboratorResult<Coordinate> smartGeocode(String place) {
        CollaboratorResult<Coordinate> direct = callGeocoder(place);
        if (direct.isSuccess() || config.getRegionName() == null || config.getRegionName().isBlank()) {
            return direct;
        }
        return callGeocoder(place + ", " + config.getRegionName());
    }

    private CollaboratorResult<Coordinate> callGeocoder(String query) {
        try {
            CollaboratorResult<Coordinate> result = geocoder.resolvePlace(query);
            return result == null ? CollaboratorResult.failure("geocoder returned no result") : result;
        } catch (RuntimeException ex) {
            return CollaboratorResult.failure("geocoder threw " + ex.getClass().getSimpleName(), ex);
        }
    }

    private Coordinate geocodeOrThrow(String place, String reasonCode, String role) {
        CollaboratorResult<Coordinate> resolved = smartGeocode(place);
        if (!resolved.isSuccess()) {
            throw new RouteException(
                    RouteErrorKind.INPUT,
                    reasonCode,
                    role + " '" + place + "' could not be located",
                    resolved.failureReason(),
                    resolved.cause().orElse(null)
            );
        }
        return resolved.value();
    }

    private void checkCoveredRegion(Coordinate startPoint, Coordinate endPoint) {
        CollaboratorResult<List<PlaceResolution>> resolved = reverseResolve(List.of(startPoint, endPoint));
        if (!resolved.isSuccess()) {
            throw new RouteException(
                    RouteErrorKind.INPUT,
                    REASON_REGION_CHECK_FAILED,
                    "could not verify the region of the endpoints",
                    resolved.failureReason(),
                    resolved.cause().orElse(null)
            );
        }
        PlaceResolution startPlace = resolved.value().get(0);
        PlaceResolution endPlace = resolved.value().get(1);
        String covered = config.getCoveredRegionCode();
        if (!startPlace.isInRegion(covered)) {
            throw new RouteException(
                    RouteErrorKind.INPUT,
                    REASON_START_OUTSIDE_REGION,
                    "departure outside covered region (" + startPlace.placeName() + ", " + startPlace.regionCode() + ")",
                    "coverage is limited to " + describeRegion(),
                    null
            );
        }
        if (!endPlace.isInRegion(covered)) {
            throw new RouteException(
                    RouteErrorKind.INPUT,
                    REASON_END_OUTSIDE_REGION,
                    "destination outside covered region (" + endPlace.placeName() + ", " + endPlace.regionCode() + ")",
                    "only routes inside " + describeRegion() + " are supported",
                    null
            );
        }
    }

    /**
     * Names every path node in one batch. A failed batch degrades to unnamed in-region
     * nodes, which yields no intermediate legs.
     */
    private List<PlaceResolution> namePath(RoadNetwork network, int[] path) {
        List<Coordinate> coordinates = new ArrayList<>(path.length);
        for (int node : path) {
            coordinates.add(network.coordinateOf(node));
        }
        CollaboratorResult<List<PlaceResolution>> resolved = reverseResolve(coordinates);
        if (resolved.isSuccess()) {
            return resolved.value();
        }
        log.warn("Reverse geocoding of {} path nodes failed ({}); route will have no intermediate legs",
                path.length, resolved.failureReason());
        return Collections.nCopies(path.length, PlaceResolution.unnamed(config.getCoveredRegionCode()));
    }

    private CollaboratorResult<List<PlaceResolution>> reverseResolve(List<Coordinate> coordinates) {
        CollaboratorResult<List<PlaceResolution>> resolved;
        try {
            resolved = reverseGeocoder.reverseResolve(coordinates);
        } catch (RuntimeException ex) {
            return CollaboratorResult.failure("reverse geocoder threw " + ex.getClass().getSimpleName(), ex);
        }
        if (resolved == null) {
            return CollaboratorResult.failure("reverse geocoder returned no result");
        }
        if (resolved.isSuccess() && resolved.value().size() != coordinates.size()) {
            return CollaboratorResult.failure(
                    "reverse geocoder returned " + resolved.value().size() + " places for " + coordinates.size() + " points"
            );
        }
        if (resolved.isSuccess() && resolved.value().stream().anyMatch(Objects::isNull)) {
            return CollaboratorResult.failure("reverse geocoder returned a null place");
        }
        return resolved;
    }

    private String describeRegion() {
        String name = config.getRegionName();
        return name == null || name.isBlank() ? config.getCoveredRegionCode() : name;
    }
}
