package org.itinera.routing.core;

/**
 * Queue entry for either search lane. Orders by cost, then node id.
 */
record FrontierEntry(int nodeId, double cost) implements Comparable<FrontierEntry> {
    @Override
    public int compareTo(FrontierEntry other) {
        int byCost = Double.compare(this.cost, other.cost);
        if (byCost != 0) {
            return byCost;
        }
        return Integer.compare(this.nodeId, other.nodeId);
    }
}
