package com.propertyintel.price.poi;

import com.propertyintel.price.model.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoDistanceTest {

    @Test
    void samePoint_isZero() {
        GeoPoint p = new GeoPoint(52.2053, 0.1218);
        assertThat(GeoDistance.haversineKm(p, p)).isZero();
    }

    @Test
    void oneDegreeOfLatitude_isAbout111Km() {
        double d = GeoDistance.haversineKm(new GeoPoint(51.0, -1.0), new GeoPoint(52.0, -1.0));
        assertThat(d).isCloseTo(111.195, within(0.001));
    }

    @Test
    void londonToCambridge_isSymmetric() {
        GeoPoint london = new GeoPoint(51.5074, -0.1278);
        GeoPoint cambridge = new GeoPoint(52.2053, 0.1218);

        double there = GeoDistance.haversineKm(london, cambridge);
        assertThat(there).isCloseTo(79.6, within(1.0));
        assertThat(GeoDistance.haversineKm(cambridge, london)).isCloseTo(there, within(1e-9));
    }
}
