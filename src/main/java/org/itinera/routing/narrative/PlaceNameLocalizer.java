package org.itinera.routing.narrative;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders place names with their local-language name where one is known.
 *
 * <p>A known place renders as {@code "<local> (<canonical>)"}. Matching is case-insensitive
 * and only considers the text before the first comma. Unknown names are returned as given.</p>
 */
public final class PlaceNameLocalizer {
    private final Map<String, Entry> entriesByKey;

    private PlaceNameLocalizer(Map<String, String> localByCanonical) {
        Map<String, Entry> entries = new LinkedHashMap<>();
        localByCanonical.forEach((canonical, local) -> {
            Objects.requireNonNull(canonical, "canonical");
            Objects.requireNonNull(local, "local");
            entries.putIfAbsent(key(canonical), new Entry(canonical, local));
        });
        this.entriesByKey = Map.copyOf(entries);
    }

    /**
     * Localizer over an explicit canonical-to-local table.
     */
    public static PlaceNameLocalizer of(Map<String, String> localByCanonical) {
        return new PlaceNameLocalizer(Objects.requireNonNull(localByCanonical, "localByCanonical"));
    }

    /**
     * Fon names of the main southern Beninese towns.
     */
    public static PlaceNameLocalizer fon() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("Cotonou", "Kutɔnu");
        table.put("Porto-Novo", "Xɔgbonu");
        table.put("Abomey", "Agbomɛ");
        table.put("Ouidah", "Glexwé");
        table.put("Bohicon", "Bɔxikɔn");
        table.put("Allada", "Alada");
        return new PlaceNameLocalizer(table);
    }

    public static PlaceNameLocalizer none() {
        return new PlaceNameLocalizer(Map.of());
    }

    public String localize(String placeName) {
        if (placeName == null) {
            return null;
        }
        Entry entry = entriesByKey.get(key(placeName));
        if (entry == null) {
            return placeName;
        }
        return entry.local() + " (" + entry.canonical() + ")";
    }

    public boolean isKnown(String placeName) {
        return placeName != null && entriesByKey.containsKey(key(placeName));
    }

    private static String key(String placeName) {
        int comma = placeName.indexOf(',');
        String base = comma >= 0 ? placeName.substring(0, comma) : placeName;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    private record Entry(String canonical, String local) {
    }
}
