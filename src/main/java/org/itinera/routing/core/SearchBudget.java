package org.itinera.routing.core;

/**
 * Per-query bounds on search work and frontier growth.
 *
 * <p>Non-positive bounds mean unbounded.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_SETTLED_EXCEEDED = "BUDGET_SETTLED_EXCEEDED";
    static final String REASON_FRONTIER_EXCEEDED = "BUDGET_FRONTIER_EXCEEDED";

    static final String PROP_MAX_SETTLED = "itinera.routing.search.maxSettledNodes";
    static final String PROP_MAX_FRONTIER = "itinera.routing.search.maxFrontierSize";

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED, UNBOUNDED);

    private final int maxSettledNodes;
    private final int maxFrontierSize;

    private SearchBudget(int maxSettledNodes, int maxFrontierSize) {
        this.maxSettledNodes = normalizeBound(maxSettledNodes);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static SearchBudget of(int maxSettledNodes, int maxFrontierSize) {
        return new SearchBudget(maxSettledNodes, maxFrontierSize);
    }

    public static SearchBudget unbounded() {
        return UNLIMITED;
    }

    /**
     * Loads bounds from system properties. Missing or malformed values are unbounded.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_SETTLED), readBound(PROP_MAX_FRONTIER));
    }

    public int maxSettledNodes() {
        return maxSettledNodes;
    }

    public int maxFrontierSize() {
        return maxFrontierSize;
    }

    /**
     * Validates the settled-node count of both lanes.
     */
    void checkSettledNodes(int settledNodes) {
        if (settledNodes > maxSettledNodes) {
            throw new BudgetExceededException(
                    REASON_SETTLED_EXCEEDED,
                    "settled-node budget exceeded: " + settledNodes + " > " + maxSettledNodes
            );
        }
    }

    /**
     * Validates the combined size of both frontiers.
     */
    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchBudget)) {
            return false;
        }
        SearchBudget other = (SearchBudget) o;
        return maxSettledNodes == other.maxSettledNodes && maxFrontierSize == other.maxFrontierSize;
    }

    @Override
    public int hashCode() {
        return 31 * maxSettledNodes + maxFrontierSize;
    }

    @Override
    public String toString() {
        return "SearchBudget[maxSettledNodes=" + describe(maxSettledNodes)
                + ", maxFrontierSize=" + describe(maxFrontierSize) + "]";
    }

    private static String describe(int bound) {
        return bound == UNBOUNDED ? "unbounded" : Integer.toString(bound);
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Budget overrun raised inside the engine and translated at its boundary.
     */
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        String reasonCode() {
            return reasonCode;
        }
    }
}
