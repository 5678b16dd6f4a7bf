package org.itinera.routing.core;

/**
 * Cooperative cancellation token polled once per search round.
 */
@FunctionalInterface
public interface SearchCancellation {
    SearchCancellation NONE = () -> false;

    boolean isCancelled();
}
