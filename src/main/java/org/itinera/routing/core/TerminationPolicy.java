package org.itinera.routing.core;

/**
 * Stop rule for the bidirectional search.
 */
final class TerminationPolicy {

    static TerminationPolicy defaults() {
        return new TerminationPolicy();
    }

    /**
     * Returns whether no unexplored meeting can beat {@code bestMeetingCost}.
     *
     * <p>Every path not yet seen crosses one unsettled node on each side, so its cost is at
     * least the sum of both frontier minima.</p>
     */
    boolean shouldTerminate(double forwardTop, double backwardTop, double bestMeetingCost) {
        if (!Double.isFinite(bestMeetingCost)) {
            return false;
        }
        return Double.compare(forwardTop + backwardTop, bestMeetingCost) >= 0;
    }
}
