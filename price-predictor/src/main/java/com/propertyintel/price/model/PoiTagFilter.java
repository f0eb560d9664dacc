package com.propertyintel.price.model;

import java.util.Map;

/**
 * OSM tag filter. A null value matches any value of the key, i.e. {@code shop=*}.
 */
public record PoiTagFilter(String key, String value) {

    public static PoiTagFilter anyValue(String key) {
        return new PoiTagFilter(key, null);
    }

    public boolean matches(Map<String, String> tags) {
        String actual = tags.get(key);
        if (actual == null) return false;
        return value == null || value.equals(actual);
    }

    /** Feature column name derived from the filter, e.g. distance_to_shop. */
    public String distanceColumn() {
        return "distance_to_" + (value == null ? key : value);
    }
}
