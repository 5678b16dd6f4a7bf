package org.itinera.routing.collaborator;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.itinera.routing.graph.Coordinate;
import org.itinera.routing.spatial.SpatialIndex;
import org.itinera.routing.spatial.SpatialMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Offline, table-backed {@link Geocoder} and {@link ReverseGeocoder}.
 *
 * <p>Forward lookups match a place name case-insensitively, either bare or qualified
 * with its region name ({@code "Ouidah, Benin"}). Reverse lookups return the nearest
 * table entry in degree space, like a nearest-city database would.</p>
 */
public final class StaticGazetteer implements Geocoder, ReverseGeocoder {
    private static final int NOT_FOUND = -1;

    private final List<Entry> entries;
    private final Object2IntOpenHashMap<String> entryByKey;
    private final SpatialIndex spatialIndex;

    private StaticGazetteer(List<Entry> entries) {
        this.entries = List.copyOf(entries);
        this.entryByKey = new Object2IntOpenHashMap<>();
        this.entryByKey.defaultReturnValue(NOT_FOUND);

        double[] latitudes = new double[entries.size()];
        double[] longitudes = new double[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            latitudes[i] = entry.coordinate().latitude();
            longitudes[i] = entry.coordinate().longitude();
            entryByKey.putIfAbsent(normalize(entry.name()), i);
            if (!entry.regionName().isBlank()) {
                entryByKey.putIfAbsent(normalize(entry.name() + ", " + entry.regionName()), i);
            }
        }
        this.spatialIndex = entries.isEmpty() ? null : SpatialIndex.build(latitudes, longitudes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Main Beninese towns plus a few neighboring-country cities.
     */
    public static StaticGazetteer beninTowns() {
        return builder()
                .add("Cotonou", "BJ", "Benin", 6.3654, 2.4183)
                .add("Porto-Novo", "BJ", "Benin", 6.4969, 2.6289)
                .add("Abomey-Calavi", "BJ", "Benin", 6.4485, 2.3557)
                .add("Ouidah", "BJ", "Benin", 6.3631, 2.0853)
                .add("Allada", "BJ", "Benin", 6.6658, 2.1511)
                .add("Lokossa", "BJ", "Benin", 6.6387, 1.7167)
                .add("Abomey", "BJ", "Benin", 7.1829, 1.9912)
                .add("Bohicon", "BJ", "Benin", 7.1782, 2.0667)
                .add("Dassa-Zoume", "BJ", "Benin", 7.7500, 2.1833)
                .add("Savalou", "BJ", "Benin", 7.9281, 1.9756)
                .add("Parakou", "BJ", "Benin", 9.3372, 2.6303)
                .add("Djougou", "BJ", "Benin", 9.7085, 1.6660)
                .add("Natitingou", "BJ", "Benin", 10.3042, 1.3796)
                .add("Kandi", "BJ", "Benin", 11.1342, 2.9386)
                .add("Malanville", "BJ", "Benin", 11.8619, 3.3862)
                .add("Lome", "TG", "Togo", 6.1375, 1.2123)
                .add("Lagos", "NG", "Nigeria", 6.4550, 3.3841)
                .add("Niamey", "NE", "Niger", 13.5116, 2.1254)
                .build();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public CollaboratorResult<Coordinate> resolvePlace(String query) {
        if (query == null || query.isBlank()) {
            return CollaboratorResult.failure("query must be non-blank");
        }
        int index = entryByKey.getInt(normalize(query));
        if (index == NOT_FOUND) {
            return CollaboratorResult.failure("no gazetteer entry for '" + query.trim() + "'");
        }
        return CollaboratorResult.success(entries.get(index).coordinate());
    }

    @Override
    public CollaboratorResult<List<PlaceResolution>> reverseResolve(List<Coordinate> coordinates) {
        Objects.requireNonNull(coordinates, "coordinates");
        if (spatialIndex == null) {
            return CollaboratorResult.failure("gazetteer is empty");
        }
        List<PlaceResolution> resolutions = new ArrayList<>(coordinates.size());
        for (Coordinate coordinate : coordinates) {
            if (coordinate == null) {
                return CollaboratorResult.failure("null coordinate in batch");
            }
            SpatialMatch match = spatialIndex.nearest(coordinate.latitude(), coordinate.longitude());
            Entry entry = entries.get(match.nodeId());
            resolutions.add(new PlaceResolution(entry.name(), entry.regionCode()));
        }
        return CollaboratorResult.success(List.copyOf(resolutions));
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private record Entry(String name, String regionCode, String regionName, Coordinate coordinate) {
    }

    /**
     * Collects gazetteer entries. The first entry registered under a name wins.
     */
    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String name, String regionCode, String regionName, double latitude, double longitude) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("entry name must be non-blank");
            }
            Objects.requireNonNull(regionCode, "regionCode");
            entries.add(new Entry(
                    name.trim(),
                    regionCode,
                    regionName == null ? "" : regionName,
                    new Coordinate(latitude, longitude)
            ));
            return this;
        }

        public StaticGazetteer build() {
            return new StaticGazetteer(entries);
        }
    }
}
