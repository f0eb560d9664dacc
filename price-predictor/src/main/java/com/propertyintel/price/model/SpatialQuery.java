package com.propertyintel.price.model;

import java.time.LocalDate;

/**
 * Bounding box plus a half-open date interval [start, end).
 */
public record SpatialQuery(BoundingBox bbox, LocalDate startDate, LocalDate endDate) {

    /**
     * Window centred on a point and a date: {@code halfWidth} degrees each way,
     * {@code weeks} weeks either side of the date.
     */
    public static SpatialQuery around(GeoPoint centre, double halfWidth, LocalDate date, int weeks) {
        return new SpatialQuery(
                BoundingBox.around(centre, halfWidth),
                date.minusWeeks(weeks),
                date.plusWeeks(weeks));
    }
}
