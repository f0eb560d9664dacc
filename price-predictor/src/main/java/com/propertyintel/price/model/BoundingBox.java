package com.propertyintel.price.model;

import java.util.Collection;

/**
 * Rectangular latitude/longitude region. Bounds are inclusive.
 */
public record BoundingBox(double north, double south, double east, double west) {

    /**
     * Square box of the given half-width in degrees centred on a point.
     */
    public static BoundingBox around(GeoPoint centre, double halfWidth) {
        return new BoundingBox(
                centre.latitude() + halfWidth,
                centre.latitude() - halfWidth,
                centre.longitude() + halfWidth,
                centre.longitude() - halfWidth);
    }

    /**
     * Smallest box holding every point, grown by {@code padding} degrees on each side.
     */
    public static BoundingBox covering(Collection<GeoPoint> points, double padding) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute a bounding box for zero points");
        }
        double north = Double.NEGATIVE_INFINITY;
        double south = Double.POSITIVE_INFINITY;
        double east = Double.NEGATIVE_INFINITY;
        double west = Double.POSITIVE_INFINITY;
        for (GeoPoint p : points) {
            north = Math.max(north, p.latitude());
            south = Math.min(south, p.latitude());
            east = Math.max(east, p.longitude());
            west = Math.min(west, p.longitude());
        }
        return new BoundingBox(north + padding, south - padding, east + padding, west - padding);
    }

    public boolean isWellFormed() {
        return north >= south && east >= west;
    }
}
