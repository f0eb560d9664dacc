package com.propertyintel.price.poi;

import com.propertyintel.price.config.PricePredictorProperties;
import com.propertyintel.price.exception.NoPoiFoundException;
import com.propertyintel.price.model.BoundingBox;
import com.propertyintel.price.model.GeoPoint;
import com.propertyintel.price.model.PoiLookupResult;
import com.propertyintel.price.model.PoiTagFilter;
import com.propertyintel.price.model.PointOfInterest;
import com.propertyintel.price.model.ProximityFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.ItemDistance;
import org.locationtech.jts.index.strtree.STRtree;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Attaches the distance to the nearest matching POI to each input point.
 *
 * One POI lookup covers the whole batch: the bounding box of all input points,
 * padded by a fixed margin on every side. POIs go into an STR-tree over a local
 * equirectangular projection; the tree's few nearest candidates for each point
 * are then measured in great-circle kilometres. When two POIs are equally near,
 * either may win; only the distance is reported.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProximityEnricher {

    /** Nearest candidates in the projection, re-measured with haversine */
    private static final int CANDIDATES = 8;

    private static final ItemDistance PLANAR = (a, b) -> {
        Projected p = (Projected) a.getItem();
        Projected q = (Projected) b.getItem();
        return Math.hypot(p.x() - q.x(), p.y() - q.y());
    };

    private final PoiSource poiSource;
    private final PricePredictorProperties properties;

    /**
     * @throws NoPoiFoundException when no POI matches the filter inside the padded box
     */
    public ProximityFeature attachNearest(List<GeoPoint> points, PoiTagFilter filter) {
        double padding = properties.getPoi().getPaddingDegrees();
        BoundingBox searchBox = BoundingBox.covering(points, padding);

        PoiLookupResult lookup = poiSource.fetch(searchBox, filter, properties.getPoi().getAttributeKeys());
        if (lookup.isPartial()) {
            log.warn("{} are not available in the POI data, continuing with the remaining keys",
                    lookup.unavailableKeys());
        }

        List<PointOfInterest> pois = lookup.pois();
        if (pois.isEmpty()) {
            throw new NoPoiFoundException(String.format(
                    "No POI matching %s within N%.4f S%.4f E%.4f W%.4f",
                    filter, searchBox.north(), searchBox.south(), searchBox.east(), searchBox.west()));
        }

        // longitude degrees shrink with latitude; scale them at the centre of the search box
        double lonScale = Math.cos(Math.toRadians((searchBox.north() + searchBox.south()) / 2));
        STRtree index = new STRtree();
        for (PointOfInterest poi : pois) {
            Projected projected = Projected.of(poi.location(), lonScale);
            index.insert(projected.envelope(), projected);
        }
        index.build();

        double[] distances = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            distances[i] = nearestDistanceKm(index, Projected.of(points.get(i), lonScale));
        }

        log.info("Attached {} to {} points using {} POIs", filter.distanceColumn(), points.size(), pois.size());
        return new ProximityFeature(filter.distanceColumn(), distances, lookup.unavailableKeys());
    }

    private double nearestDistanceKm(STRtree index, Projected point) {
        Object[] candidates = index.nearestNeighbour(point.envelope(), point, PLANAR, CANDIDATES);
        double best = Double.POSITIVE_INFINITY;
        for (Object candidate : candidates) {
            best = Math.min(best, GeoDistance.haversineKm(point.location(), ((Projected) candidate).location()));
        }
        return best;
    }

    private record Projected(GeoPoint location, double x, double y) {

        static Projected of(GeoPoint location, double lonScale) {
            return new Projected(location, location.longitude() * lonScale, location.latitude());
        }

        Envelope envelope() {
            return new Envelope(x, x, y, y);
        }
    }
}
