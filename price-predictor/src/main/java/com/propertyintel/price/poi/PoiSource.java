package com.propertyintel.price.poi;

import com.propertyintel.price.model.BoundingBox;
import com.propertyintel.price.model.PoiLookupResult;
import com.propertyintel.price.model.PoiTagFilter;

import java.util.List;

/**
 * Lookup of points of interest inside a bounding box.
 */
public interface PoiSource {

    /**
     * @param attributeKeys keys to carry on each POI; keys the source lacks are
     *                      reported in {@link PoiLookupResult#unavailableKeys()} rather than failing
     */
    PoiLookupResult fetch(BoundingBox bbox, PoiTagFilter filter, List<String> attributeKeys);
}
