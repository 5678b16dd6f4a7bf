package org.itinera.routing.narrative;

/**
 * Travel season, which drives the weather heuristic.
 */
public enum Season {
    DRY("Saison Sèche"),
    RAINY("Saison des Pluies");

    private final String label;

    Season(String label) {
        this.label = label;
    }

    /**
     * Source-language display label.
     */
    public String label() {
        return label;
    }

    public static Season of(boolean raining) {
        return raining ? RAINY : DRY;
    }
}
