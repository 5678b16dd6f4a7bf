package org.itinera.routing.collaborator;

import java.util.Objects;

/**
 * Place name and region code resolved for one coordinate.
 *
 * @param placeName human-readable locality name, possibly empty.
 * @param regionCode ISO country code such as {@code BJ}, possibly empty.
 */
public record PlaceResolution(String placeName, String regionCode) {
    public PlaceResolution {
        Objects.requireNonNull(placeName, "placeName");
        Objects.requireNonNull(regionCode, "regionCode");
    }

    public static PlaceResolution unnamed(String regionCode) {
        return new PlaceResolution("", regionCode);
    }

    public boolean isInRegion(String code) {
        return regionCode.equalsIgnoreCase(code);
    }
}
