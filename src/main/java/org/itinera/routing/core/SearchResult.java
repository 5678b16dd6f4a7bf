package org.itinera.routing.core;

import java.util.Arrays;

/**
 * Outcome of one shortest-path search.
 *
 * @param found whether a path connects start and end.
 * @param nodePath internal node ids from start to end inclusive, empty when not found.
 * @param cost total cost in units of the selected weight field, {@code +INF} when not found.
 * @param settledNodes nodes settled across both search lanes.
 */
public record SearchResult(boolean found, int[] nodePath, double cost, int settledNodes) {
    private static final int[] NO_NODES = new int[0];

    public SearchResult {
        nodePath = nodePath == null ? NO_NODES : nodePath.clone();
    }

    static SearchResult found(int[] nodePath, double cost, int settledNodes) {
        return new SearchResult(true, nodePath, cost, settledNodes);
    }

    static SearchResult noPath(int settledNodes) {
        return new SearchResult(false, NO_NODES, Double.POSITIVE_INFINITY, settledNodes);
    }

    @Override
    public int[] nodePath() {
        return nodePath.clone();
    }

    public int pathLength() {
        return nodePath.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SearchResult other
                && found == other.found
                && Double.compare(cost, other.cost) == 0
                && settledNodes == other.settledNodes
                && Arrays.equals(nodePath, other.nodePath);
    }

    @Override
    public int hashCode() {
        int result = Boolean.hashCode(found);
        result = 31 * result + Arrays.hashCode(nodePath);
        result = 31 * result + Double.hashCode(cost);
        return 31 * result + settledNodes;
    }

    @Override
    public String toString() {
        return "SearchResult[found=" + found + ", cost=" + cost + ", settledNodes=" + settledNodes
                + ", nodePath=" + Arrays.toString(nodePath) + "]";
    }
}
