package com.propertyintel.price.model;

import java.util.List;
import java.util.Set;

/**
 * POIs returned for a lookup, together with the requested attribute keys the
 * source did not provide for any of them. A non-empty {@code unavailableKeys}
 * marks a partial result, not a failure.
 */
public record PoiLookupResult(List<PointOfInterest> pois, Set<String> unavailableKeys) {

    public PoiLookupResult {
        pois = List.copyOf(pois);
        unavailableKeys = Set.copyOf(unavailableKeys);
    }

    public boolean isPartial() {
        return !unavailableKeys.isEmpty();
    }
}
