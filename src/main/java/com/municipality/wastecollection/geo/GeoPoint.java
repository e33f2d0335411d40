package com.municipality.wastecollection.geo;

import lombok.Value;

@Value
public class GeoPoint {
    double latitude;
    double longitude;

    /**
     * Validating factory; the plain constructor is left for Jackson and trusted callers.
     */
    public static GeoPoint of(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180]: " + longitude);
        }
        return new GeoPoint(latitude, longitude);
    }
}
