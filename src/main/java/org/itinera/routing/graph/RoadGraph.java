package org.itinera.routing.graph;

import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.itinera.routing.spatial.SpatialIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable in-memory road graph.
 * <p>
 * Layout:
 * <ul>
 * <li>SoA node arrays: external ids, latitudes, longitudes.</li>
 * <li>CSR outgoing links: {@code firstLink[node]..firstLink[node + 1]}, sorted by target id.</li>
 * <li>CSR incoming index over the same link ids for backward traversal.</li>
 * <li>Variants of link {@code l} live in {@code variants[firstVariant[l]..firstVariant[l + 1]]}.</li>
 * <li>Per-link minimum length and travel time are precomputed at build time.</li>
 * </ul>
 * Safe for concurrent reads once built.
 */
public final class RoadGraph implements RoadNetwork {

    private final int nodeCount;
    private final int linkCount;

    private final String[] externalIds;
    private final Object2IntOpenHashMap<String> internalIds;
    private final double[] latitudes;
    private final double[] longitudes;

    private final int[] firstLink;
    private final int[] linkOrigin;
    private final int[] linkTarget;

    private final int[] firstIncoming;
    private final int[] incomingLinkIds;

    private final int[] firstVariant;
    private final EdgeVariant[] variants;
    private final double[] minLength;
    private final double[] minTravelTime;
    private final int[] representativeVariant;

    private final SpatialIndex spatialIndex;

    private RoadGraph(
            String[] externalIds,
            Object2IntOpenHashMap<String> internalIds,
            double[] latitudes,
            double[] longitudes,
            int[] firstLink,
            int[] linkOrigin,
            int[] linkTarget,
            int[] firstVariant,
            EdgeVariant[] variants
    ) {
        this.nodeCount = externalIds.length;
        this.linkCount = linkOrigin.length;
        this.externalIds = externalIds;
        this.internalIds = internalIds;
        this.latitudes = latitudes;
        this.longitudes = longitudes;
        this.firstLink = firstLink;
        this.linkOrigin = linkOrigin;
        this.linkTarget = linkTarget;
        this.firstVariant = firstVariant;
        this.variants = variants;

        this.minLength = new double[linkCount];
        this.minTravelTime = new double[linkCount];
        this.representativeVariant = new int[linkCount];
        summarizeLinks();

        this.firstIncoming = new int[nodeCount + 1];
        this.incomingLinkIds = new int[linkCount];
        buildIncomingIndex();

        this.spatialIndex = nodeCount == 0 ? null : SpatialIndex.build(latitudes, longitudes);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // NODES
    // ========================================================================

    @Override
    public int nodeCount() {
        return nodeCount;
    }

    @Override
    public int linkCount() {
        return linkCount;
    }

    public int variantCount() {
        return variants.length;
    }

    @Override
    public double latitude(int nodeId) {
        checkNode(nodeId);
        return latitudes[nodeId];
    }

    @Override
    public double longitude(int nodeId) {
        checkNode(nodeId);
        return longitudes[nodeId];
    }

    @Override
    public String externalId(int nodeId) {
        checkNode(nodeId);
        return externalIds[nodeId];
    }

    @Override
    public int internalId(String externalId) {
        if (externalId == null) {
            return NO_NODE;
        }
        return internalIds.getInt(externalId);
    }

    @Override
    public int nearestNode(Coordinate coordinate) {
        Objects.requireNonNull(coordinate, "coordinate");
        if (spatialIndex == null) {
            throw new IllegalStateException("nearest-node lookup on an empty graph");
        }
        return spatialIndex.nearestNodeId(coordinate.latitude(), coordinate.longitude());
    }

    // ========================================================================
    // LINKS
    // ========================================================================

    @Override
    public LinkCursor outgoing(int nodeId) {
        checkNode(nodeId);
        return new RangeCursor(null, firstLink[nodeId], firstLink[nodeId + 1]);
    }

    @Override
    public LinkCursor incoming(int nodeId) {
        checkNode(nodeId);
        return new RangeCursor(incomingLinkIds, firstIncoming[nodeId], firstIncoming[nodeId + 1]);
    }

    @Override
    public int linkOrigin(int linkId) {
        checkLink(linkId);
        return linkOrigin[linkId];
    }

    @Override
    public int linkTarget(int linkId) {
        checkLink(linkId);
        return linkTarget[linkId];
    }

    @Override
    public int findLink(int fromNode, int toNode) {
        if (!containsNode(fromNode) || !containsNode(toNode)) {
            return NO_LINK;
        }
        int position = Arrays.binarySearch(linkTarget, firstLink[fromNode], firstLink[fromNode + 1], toNode);
        return position >= 0 ? position : NO_LINK;
    }

    @Override
    public List<EdgeVariant> variants(int linkId) {
        checkLink(linkId);
        return List.of(Arrays.copyOfRange(variants, firstVariant[linkId], firstVariant[linkId + 1]));
    }

    @Override
    public double minWeight(int linkId, WeightField field) {
        checkLink(linkId);
        return switch (field) {
            case DISTANCE -> minLength[linkId];
            case DURATION -> minTravelTime[linkId];
        };
    }

    @Override
    public EdgeVariant representativeVariant(int linkId) {
        checkLink(linkId);
        return variants[representativeVariant[linkId]];
    }

    // ========================================================================
    // DEBUG & VALIDATION
    // ========================================================================

    @Override
    public String toString() {
        return String.format("RoadGraph[nodes=%d, links=%d, variants=%d, avgDegree=%.2f]",
                nodeCount, linkCount, variants.length, nodeCount > 0 ? (double) linkCount / nodeCount : 0.0d);
    }

    public record ValidationResult(boolean isValid, List<String> errors, List<String> warnings) {}

    /**
     * Reports structural problems and isolated nodes.
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (int link = 0; link < linkCount; link++) {
            if (firstVariant[link] >= firstVariant[link + 1]) {
                errors.add("Link " + link + " has no variants");
            }
            if (linkOrigin[link] == linkTarget[link]) {
                warnings.add("Link " + link + " is a self-loop on node " + externalIds[linkOrigin[link]]);
            }
        }

        int isolatedNodes = 0;
        int withoutTravelTime = 0;
        for (int n = 0; n < nodeCount; n++) {
            if (firstLink[n] == firstLink[n + 1] && firstIncoming[n] == firstIncoming[n + 1]) {
                isolatedNodes++;
            }
        }
        for (int link = 0; link < linkCount; link++) {
            if (minTravelTime[link] == Double.POSITIVE_INFINITY) {
                withoutTravelTime++;
            }
        }
        if (isolatedNodes > 0) {
            warnings.add("Graph contains " + isolatedNodes + " isolated nodes");
        }
        if (withoutTravelTime > 0) {
            warnings.add(withoutTravelTime + " links carry no travel time and are unusable for DURATION routing");
        }
        return new ValidationResult(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }

    // ========================================================================
    // CONSTRUCTION HELPERS
    // ========================================================================

    private void summarizeLinks() {
        for (int link = 0; link < linkCount; link++) {
            double bestLength = Double.POSITIVE_INFINITY;
            double bestTime = Double.POSITIVE_INFINITY;
            int representative = firstVariant[link];
            for (int v = firstVariant[link]; v < firstVariant[link + 1]; v++) {
                EdgeVariant variant = variants[v];
                bestLength = Math.min(bestLength, WeightField.DISTANCE.read(variant));
                double time = WeightField.DURATION.read(variant);
                if (time < bestTime) {
                    bestTime = time;
                    representative = v;
                }
            }
            minLength[link] = bestLength;
            minTravelTime[link] = bestTime;
            representativeVariant[link] = representative;
        }
    }

    private void buildIncomingIndex() {
        int[] incomingDegree = new int[nodeCount];
        for (int link = 0; link < linkCount; link++) {
            incomingDegree[linkTarget[link]]++;
        }
        int cursor = 0;
        for (int node = 0; node < nodeCount; node++) {
            firstIncoming[node] = cursor;
            cursor += incomingDegree[node];
        }
        firstIncoming[nodeCount] = linkCount;

        int[] fillCursor = Arrays.copyOf(firstIncoming, firstIncoming.length);
        for (int link = 0; link < linkCount; link++) {
            incomingLinkIds[fillCursor[linkTarget[link]]++] = link;
        }
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + nodeCount + ")");
        }
    }

    private void checkLink(int linkId) {
        if (linkId < 0 || linkId >= linkCount) {
            throw new IndexOutOfBoundsException("Link " + linkId + " out of bounds [0, " + linkCount + ")");
        }
    }

    /**
     * Cursor over a contiguous range, optionally indirected through an id array.
     */
    private static final class RangeCursor implements LinkCursor {
        private final int[] indirection;
        private int current;
        private final int end;

        RangeCursor(int[] indirection, int start, int end) {
            this.indirection = indirection;
            this.current = start;
            this.end = end;
        }

        @Override
        public boolean hasNext() {
            return current < end;
        }

        @Override
        public int next() {
            if (current >= end) {
                throw new NoSuchElementException();
            }
            int position = current++;
            return indirection == null ? position : indirection[position];
        }
    }

    /**
     * Collects nodes and edge variants, then freezes them into a {@link RoadGraph}.
     *
     * <p>Node internal ids follow insertion order. Variants added for the same ordered
     * node pair are grouped under one link and keep their insertion order.</p>
     */
    public static final class Builder {
        private final List<String> externalIds = new ArrayList<>();
        private final Object2IntOpenHashMap<String> internalIds = new Object2IntOpenHashMap<>();
        private final List<double[]> coordinates = new ArrayList<>();
        private final List<PendingEdge> edges = new ArrayList<>();

        private Builder() {
            internalIds.defaultReturnValue(NO_NODE);
        }

        /**
         * Adds a node with its coordinate.
         *
         * @throws IllegalArgumentException on blank or duplicate ids.
         */
        public Builder addNode(String externalId, double latitude, double longitude) {
            if (externalId == null || externalId.isBlank()) {
                throw new IllegalArgumentException("node id must be non-blank");
            }
            if (internalIds.containsKey(externalId)) {
                throw new IllegalArgumentException("duplicate node id: " + externalId);
            }
            Coordinate coordinate = new Coordinate(latitude, longitude);
            internalIds.put(externalId, externalIds.size());
            externalIds.add(externalId);
            coordinates.add(new double[]{coordinate.latitude(), coordinate.longitude()});
            return this;
        }

        /**
         * Adds one directed variant between two existing nodes.
         */
        public Builder addEdge(String fromId, String toId, EdgeVariant variant) {
            Objects.requireNonNull(variant, "variant");
            int from = requireNode(fromId);
            int to = requireNode(toId);
            edges.add(new PendingEdge(from, to, edges.size(), variant));
            return this;
        }

        /**
         * Adds one directed variant with length and travel time.
         */
        public Builder addEdge(String fromId, String toId, double lengthMeters, double travelTimeSeconds, String... names) {
            return addEdge(fromId, toId, EdgeVariant.of(lengthMeters, travelTimeSeconds, names));
        }

        /**
         * Adds the same variant in both directions.
         */
        public Builder addTwoWayEdge(String firstId, String secondId, EdgeVariant variant) {
            addEdge(firstId, secondId, variant);
            return addEdge(secondId, firstId, variant);
        }

        public RoadGraph build() {
            int nodeCount = externalIds.size();
            double[] latitudes = new double[nodeCount];
            double[] longitudes = new double[nodeCount];
            for (int i = 0; i < nodeCount; i++) {
                latitudes[i] = coordinates.get(i)[0];
                longitudes[i] = coordinates.get(i)[1];
            }

            int edgeCount = edges.size();
            int[] order = new int[edgeCount];
            for (int i = 0; i < edgeCount; i++) {
                order[i] = i;
            }
            IntArrays.quickSort(order, (a, b) -> {
                PendingEdge left = edges.get(a);
                PendingEdge right = edges.get(b);
                int byOrigin = Integer.compare(left.from(), right.from());
                if (byOrigin != 0) {
                    return byOrigin;
                }
                int byTarget = Integer.compare(left.to(), right.to());
                if (byTarget != 0) {
                    return byTarget;
                }
                return Integer.compare(left.sequence(), right.sequence());
            });

            EdgeVariant[] variants = new EdgeVariant[edgeCount];
            List<int[]> links = new ArrayList<>();
            int[] firstVariantScratch = new int[edgeCount + 1];
            int previousFrom = -1;
            int previousTo = -1;
            for (int i = 0; i < edgeCount; i++) {
                PendingEdge edge = edges.get(order[i]);
                variants[i] = edge.variant();
                if (edge.from() != previousFrom || edge.to() != previousTo) {
                    firstVariantScratch[links.size()] = i;
                    links.add(new int[]{edge.from(), edge.to()});
                    previousFrom = edge.from();
                    previousTo = edge.to();
                }
            }

            int linkCount = links.size();
            int[] firstVariant = Arrays.copyOf(firstVariantScratch, linkCount + 1);
            firstVariant[linkCount] = edgeCount;
            int[] linkOrigin = new int[linkCount];
            int[] linkTarget = new int[linkCount];
            int[] firstLink = new int[nodeCount + 1];
            for (int link = 0; link < linkCount; link++) {
                linkOrigin[link] = links.get(link)[0];
                linkTarget[link] = links.get(link)[1];
                firstLink[linkOrigin[link] + 1]++;
            }
            for (int node = 0; node < nodeCount; node++) {
                firstLink[node + 1] += firstLink[node];
            }

            Object2IntOpenHashMap<String> frozenIds = new Object2IntOpenHashMap<>(internalIds);
            frozenIds.defaultReturnValue(NO_NODE);
            frozenIds.trim();
            return new RoadGraph(
                    externalIds.toArray(new String[0]),
                    frozenIds,
                    latitudes,
                    longitudes,
                    firstLink,
                    linkOrigin,
                    linkTarget,
                    firstVariant,
                    variants
            );
        }

        private int requireNode(String externalId) {
            int nodeId = externalId == null ? NO_NODE : internalIds.getInt(externalId);
            if (nodeId == NO_NODE) {
                throw new IllegalArgumentException("edge references unknown node: " + externalId);
            }
            return nodeId;
        }

        private record PendingEdge(int from, int to, int sequence, EdgeVariant variant) {
        }
    }
}
