package com.propertyintel.price.model;

import java.util.Map;

/**
 * A point feature from the POI source. Ways and relations are reduced to their centre.
 *
 * @param id          OSM element id
 * @param elementType node, way or relation
 * @param attributes  only the requested attribute keys this element carries
 */
public record PointOfInterest(
        long id,
        String elementType,
        double latitude,
        double longitude,
        Map<String, String> attributes
) {
    public GeoPoint location() {
        return new GeoPoint(latitude, longitude);
    }
}
