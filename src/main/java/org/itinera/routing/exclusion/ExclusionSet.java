package org.itinera.routing.exclusion;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

/**
 * Immutable set of internal node ids that a search must not expand.
 */
public final class ExclusionSet {
    private static final ExclusionSet EMPTY = new ExclusionSet(new IntOpenHashSet());

    private final IntOpenHashSet nodes;

    private ExclusionSet(IntOpenHashSet nodes) {
        this.nodes = nodes;
    }

    public static ExclusionSet empty() {
        return EMPTY;
    }

    public static ExclusionSet of(int... nodeIds) {
        if (nodeIds.length == 0) {
            return EMPTY;
        }
        return new ExclusionSet(new IntOpenHashSet(nodeIds));
    }

    /**
     * Copies the given ids; later changes to {@code nodeIds} are not observed.
     */
    public static ExclusionSet copyOf(IntSet nodeIds) {
        if (nodeIds.isEmpty()) {
            return EMPTY;
        }
        IntOpenHashSet copy = new IntOpenHashSet(nodeIds);
        copy.trim();
        return new ExclusionSet(copy);
    }

    public boolean contains(int nodeId) {
        return nodes.contains(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Read-only view of the excluded ids.
     */
    public IntSet asIntSet() {
        return IntSets.unmodifiable(nodes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ExclusionSet other && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "ExclusionSet[size=" + nodes.size() + "]";
    }
}
