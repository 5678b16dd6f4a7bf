package org.itinera.routing.core;

/**
 * Coarse classification of route failures.
 */
public enum RouteErrorKind {
    /** Caller supplied an unusable query or unresolvable places. */
    INPUT,
    /** Graph data is missing, inconsistent, or the search exceeded its budget. */
    GRAPH,
    /** Both endpoints are valid but no path connects them. */
    NO_PATH,
    /** The caller cancelled the search. */
    CANCELLED
}
