package org.itinera.routing.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Provider that delegates to a loader and memoizes the snapshot when caching is enabled.
 *
 * <p>Concurrent first calls trigger exactly one load. A failed load is not cached, so a
 * later call retries.</p>
 */
@Slf4j
public final class CachingRoadNetworkProvider implements RoadNetworkProvider {
    @Getter
    @Accessors(fluent = true)
    private final GraphLoadConfig config;
    private final Function<GraphLoadConfig, ? extends RoadNetwork> loader;
    private final ConcurrentMap<GraphLoadConfig, RoadNetwork> snapshots = new ConcurrentHashMap<>();

    public CachingRoadNetworkProvider(GraphLoadConfig config, Function<GraphLoadConfig, ? extends RoadNetwork> loader) {
        this.config = Objects.requireNonNull(config, "config");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Wraps an already built network.
     */
    public static CachingRoadNetworkProvider of(RoadNetwork network) {
        Objects.requireNonNull(network, "network");
        return new CachingRoadNetworkProvider(GraphLoadConfig.forPlace("in-memory"), ignored -> network);
    }

    @Override
    public RoadNetwork network() {
        if (!config.isCacheEnabled()) {
            return load(config);
        }
        return snapshots.computeIfAbsent(config, this::load);
    }

    /**
     * Drops the memoized snapshot so the next call reloads.
     */
    public void invalidate() {
        snapshots.clear();
    }

    public boolean isLoaded() {
        return snapshots.containsKey(config);
    }

    private RoadNetwork load(GraphLoadConfig loadConfig) {
        log.info("Loading road network for '{}' (filter={}, timeout={})",
                loadConfig.getPlaceName(), loadConfig.getHighwayFilter(), loadConfig.getRequestTimeout());
        RoadNetwork network;
        try {
            network = loader.apply(loadConfig);
        } catch (GraphUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new GraphUnavailableException("failed to load road network for '" + loadConfig.getPlaceName() + "'", ex);
        }
        if (network == null) {
            throw new GraphUnavailableException("loader returned no network for '" + loadConfig.getPlaceName() + "'");
        }
        log.info("Loaded road network: {} nodes, {} links", network.nodeCount(), network.linkCount());
        return network;
    }
}
