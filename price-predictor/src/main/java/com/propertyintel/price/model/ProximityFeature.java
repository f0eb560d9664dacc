package com.propertyintel.price.model;

import java.util.Arrays;
import java.util.Set;

/**
 * Distance from each input point to its nearest matching POI, in input order.
 * Carries the unavailable POI keys through so callers can report the degradation.
 */
public final class ProximityFeature {

    private final String column;
    private final double[] distances;
    private final Set<String> unavailableKeys;

    public ProximityFeature(String column, double[] distances, Set<String> unavailableKeys) {
        this.column = column;
        this.distances = distances.clone();
        this.unavailableKeys = Set.copyOf(unavailableKeys);
    }

    public String column() {
        return column;
    }

    public double[] distances() {
        return distances.clone();
    }

    public double distance(int row) {
        return distances[row];
    }

    public int size() {
        return distances.length;
    }

    public Set<String> unavailableKeys() {
        return unavailableKeys;
    }

    @Override
    public String toString() {
        return "ProximityFeature[" + column + ", " + Arrays.toString(distances) + ", missing=" + unavailableKeys + "]";
    }
}
