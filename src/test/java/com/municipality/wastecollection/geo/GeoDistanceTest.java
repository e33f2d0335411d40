package com.municipality.wastecollection.geo;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeoDistanceTest {

    private static double dms(int degrees, int minutes, double seconds) {
        double value = Math.abs(degrees) + minutes / 60.0 + seconds / 3600.0;
        return degrees < 0 ? -value : value;
    }

    @Test
    void testOneDegreeOfLongitudeOnTheEquator() {
        assertEquals(111319.491, GeoDistance.meters(0, 0, 0, 1), 0.01);
    }

    @Test
    void testOneDegreeOfLatitudeAtTheEquator() {
        assertEquals(110574.389, GeoDistance.meters(0, 0, 1, 0), 0.01);
    }

    @Test
    void testFlindersPeakToBuninyong() {
        double lat1 = dms(-37, 57, 3.72030);
        double lon1 = dms(144, 25, 29.52440);
        double lat2 = dms(-37, 39, 10.15610);
        double lon2 = dms(143, 55, 35.38390);

        assertEquals(54972.271, GeoDistance.meters(lat1, lon1, lat2, lon2), 0.01);
    }

    @Test
    void testIdenticalPointsAreZeroApart() {
        assertEquals(0.0, GeoDistance.meters(36.8065, 10.1815, 36.8065, 10.1815));
    }

    @Test
    void testDistanceIsSymmetric() {
        double there = GeoDistance.meters(36.80, 10.18, 36.85, 10.25);
        double back = GeoDistance.meters(36.85, 10.25, 36.80, 10.18);
        assertEquals(there, back, 1e-6);
    }

    @Test
    void testNearlyAntipodalPointsFallBackToGreatCircle() {
        double distance = GeoDistance.meters(0, 0, 0.5, 179.7);

        assertFalse(Double.isNaN(distance));
        assertTrue(distance > 19_900_000 && distance < 20_100_000, "got " + distance);
    }

    @Test
    void testPathLengthInKilometres() {
        List<GeoPoint> path = List.of(new GeoPoint(0, 0), new GeoPoint(0, 1), new GeoPoint(0, 2));

        assertEquals(222.639, GeoDistance.pathKm(path), 0.001);
        assertEquals(0.0, GeoDistance.pathKm(List.of(new GeoPoint(1, 1))));
    }

    @Test
    void testGeoPointRejectsOutOfRangeCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(91, 0));
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(0, -180.5));
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(Double.NaN, 0));
    }
}
