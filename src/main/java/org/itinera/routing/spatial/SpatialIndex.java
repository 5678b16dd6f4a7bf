package org.itinera.routing.spatial;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;

import java.util.Arrays;
import java.util.Objects;

/**
 * In-memory KD tree over node coordinates, used for nearest-node snapping.
 * <p>
 * Axis 0 splits on latitude, axis 1 on longitude. Distances are squared euclidean
 * distances in degree space. The tree is immutable after {@link #build(double[], double[])}
 * and safe for concurrent reads.
 * </p>
 */
public final class SpatialIndex {
    static final int LEAF_CAPACITY = 8;

    private final double[] latitudes;
    private final double[] longitudes;

    private final int rootIndex;
    private final double[] splitValues;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final int[] itemStartIndices;
    private final int[] itemCounts;
    private final byte[] splitAxes;
    private final byte[] leafFlags;
    private final int[] leafItems;

    private SpatialIndex(
            double[] latitudes,
            double[] longitudes,
            int rootIndex,
            double[] splitValues,
            int[] leftChildren,
            int[] rightChildren,
            int[] itemStartIndices,
            int[] itemCounts,
            byte[] splitAxes,
            byte[] leafFlags,
            int[] leafItems
    ) {
        this.latitudes = latitudes;
        this.longitudes = longitudes;
        this.rootIndex = rootIndex;
        this.splitValues = splitValues;
        this.leftChildren = leftChildren;
        this.rightChildren = rightChildren;
        this.itemStartIndices = itemStartIndices;
        this.itemCounts = itemCounts;
        this.splitAxes = splitAxes;
        this.leafFlags = leafFlags;
        this.leafItems = leafItems;
    }

    /**
     * Builds a tree over parallel coordinate arrays indexed by node id.
     *
     * <p>The arrays are retained, not copied; callers must not mutate them afterwards.</p>
     */
    public static SpatialIndex build(double[] latitudes, double[] longitudes) {
        Objects.requireNonNull(latitudes, "latitudes");
        Objects.requireNonNull(longitudes, "longitudes");
        if (latitudes.length != longitudes.length) {
            throw new IllegalArgumentException(
                    "coordinate arrays differ in length: " + latitudes.length + " vs " + longitudes.length);
        }
        if (latitudes.length == 0) {
            throw new IllegalArgumentException("spatial index requires at least one node");
        }

        int[] items = new int[latitudes.length];
        for (int i = 0; i < items.length; i++) {
            items[i] = i;
        }
        TreeBuilder builder = new TreeBuilder(latitudes, longitudes, items);
        int root = builder.buildNode(0, items.length, 0);

        return new SpatialIndex(
                latitudes,
                longitudes,
                root,
                builder.splitValues.toDoubleArray(),
                builder.leftChildren.toIntArray(),
                builder.rightChildren.toIntArray(),
                builder.itemStarts.toIntArray(),
                builder.itemCounts.toIntArray(),
                builder.splitAxes.toByteArray(),
                builder.leafFlags.toByteArray(),
                items
        );
    }

    public int treeNodeCount() {
        return splitValues.length;
    }

    /**
     * Finds the node nearest to the query coordinate.
     */
    public SpatialMatch nearest(double latitude, double longitude) {
        int nodeId = nearestNodeId(latitude, longitude);
        double dLat = latitudes[nodeId] - latitude;
        double dLon = longitudes[nodeId] - longitude;
        return new SpatialMatch(nodeId, latitudes[nodeId], longitudes[nodeId], dLat * dLat + dLon * dLon);
    }

    /**
     * Finds the nearest node id. Lower node id wins when distances are equal.
     */
    public int nearestNodeId(double latitude, double longitude) {
        validateQueryCoordinate(latitude, "latitude");
        validateQueryCoordinate(longitude, "longitude");

        int bestNode = -1;
        double bestDistanceSquared = Double.POSITIVE_INFINITY;

        int[] stack = new int[Math.max(4, Math.min(64, splitValues.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int nodeIndex = stack[--top];

            if (leafFlags[nodeIndex] != 0) {
                int start = itemStartIndices[nodeIndex];
                int end = start + itemCounts[nodeIndex];
                for (int i = start; i < end; i++) {
                    int candidate = leafItems[i];
                    double dLat = latitudes[candidate] - latitude;
                    double dLon = longitudes[candidate] - longitude;
                    double distanceSquared = dLat * dLat + dLon * dLon;
                    if (distanceSquared < bestDistanceSquared
                            || (distanceSquared == bestDistanceSquared && candidate < bestNode)) {
                        bestDistanceSquared = distanceSquared;
                        bestNode = candidate;
                    }
                }
                continue;
            }

            double queryValue = splitAxes[nodeIndex] == 0 ? latitude : longitude;
            double delta = queryValue - splitValues[nodeIndex];
            int nearChild = delta <= 0.0d ? leftChildren[nodeIndex] : rightChildren[nodeIndex];
            int farChild = delta <= 0.0d ? rightChildren[nodeIndex] : leftChildren[nodeIndex];

            if (farChild >= 0 && delta * delta <= bestDistanceSquared) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = farChild;
            }
            if (nearChild >= 0) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = nearChild;
            }
        }

        if (bestNode < 0) {
            throw new IllegalStateException("Spatial index contains no reachable leaf items");
        }
        return bestNode;
    }

    @Override
    public String toString() {
        return "SpatialIndex[treeNodes=" + splitValues.length + ", items=" + leafItems.length + "]";
    }

    private static void validateQueryCoordinate(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite");
        }
    }

    /**
     * Median-split builder. Items are partitioned in place so leaves reference
     * contiguous slices of the final item array.
     */
    private static final class TreeBuilder {
        private final double[] latitudes;
        private final double[] longitudes;
        private final int[] items;

        private final DoubleArrayList splitValues = new DoubleArrayList();
        private final IntArrayList leftChildren = new IntArrayList();
        private final IntArrayList rightChildren = new IntArrayList();
        private final IntArrayList itemStarts = new IntArrayList();
        private final IntArrayList itemCounts = new IntArrayList();
        private final ByteArrayList splitAxes = new ByteArrayList();
        private final ByteArrayList leafFlags = new ByteArrayList();

        TreeBuilder(double[] latitudes, double[] longitudes, int[] items) {
            this.latitudes = latitudes;
            this.longitudes = longitudes;
            this.items = items;
        }

        int buildNode(int from, int to, int depth) {
            int nodeIndex = allocate();
            if (to - from <= LEAF_CAPACITY) {
                leafFlags.set(nodeIndex, (byte) 1);
                itemStarts.set(nodeIndex, from);
                itemCounts.set(nodeIndex, to - from);
                return nodeIndex;
            }

            byte axis = (byte) (depth & 1);
            double[] values = axis == 0 ? latitudes : longitudes;
            IntArrays.quickSort(items, from, to, (a, b) -> {
                int byValue = Double.compare(values[a], values[b]);
                return byValue != 0 ? byValue : Integer.compare(a, b);
            });

            int mid = (from + to) >>> 1;
            splitAxes.set(nodeIndex, axis);
            splitValues.set(nodeIndex, values[items[mid]]);
            int left = buildNode(from, mid, depth + 1);
            int right = buildNode(mid, to, depth + 1);
            leftChildren.set(nodeIndex, left);
            rightChildren.set(nodeIndex, right);
            return nodeIndex;
        }

        private int allocate() {
            splitValues.add(0.0d);
            leftChildren.add(-1);
            rightChildren.add(-1);
            itemStarts.add(0);
            itemCounts.add(0);
            splitAxes.add((byte) 0);
            leafFlags.add((byte) 0);
            return splitValues.size() - 1;
        }
    }
}
