package com.municipality.wastecollection.geo;

import java.util.List;

/**
 * Geodesic distances on the WGS84 ellipsoid.
 * <p>
 * Uses Vincenty's inverse formula, which is accurate to well under a millimetre for
 * non-antipodal points. The iteration fails to converge only for nearly antipodal pairs;
 * those fall back to a great-circle distance on the mean earth radius.
 */
public final class GeoDistance {

    // WGS84
    private static final double SEMI_MAJOR_AXIS = 6378137.0;
    private static final double FLATTENING = 1 / 298.257223563;
    private static final double SEMI_MINOR_AXIS = SEMI_MAJOR_AXIS * (1 - FLATTENING);

    static final double MEAN_EARTH_RADIUS = 6371008.8;

    private static final double CONVERGENCE = 1e-12;
    private static final int MAX_ITERATIONS = 200;

    private GeoDistance() {
    }

    public static double meters(GeoPoint from, GeoPoint to) {
        return meters(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }

    public static double meters(double lat1, double lon1, double lat2, double lon2) {
        if (lat1 == lat2 && lon1 == lon2) {
            return 0.0;
        }

        double deltaLon = lon2 - lon1;
        // Shortest way around, so pairs across the antimeridian are handled
        if (deltaLon > 180) {
            deltaLon -= 360;
        } else if (deltaLon < -180) {
            deltaLon += 360;
        }
        double l = Math.toRadians(deltaLon);
        double u1 = Math.atan((1 - FLATTENING) * Math.tan(Math.toRadians(lat1)));
        double u2 = Math.atan((1 - FLATTENING) * Math.tan(Math.toRadians(lat2)));
        double sinU1 = Math.sin(u1);
        double cosU1 = Math.cos(u1);
        double sinU2 = Math.sin(u2);
        double cosU2 = Math.cos(u2);

        double lambda = l;
        double previousLambda;
        double sinSigma;
        double cosSigma;
        double sigma;
        double cosSqAlpha;
        double cos2SigmaM;
        int iterations = 0;

        do {
            double sinLambda = Math.sin(lambda);
            double cosLambda = Math.cos(lambda);
            double a = cosU2 * sinLambda;
            double b = cosU1 * sinU2 - sinU1 * cosU2 * cosLambda;
            sinSigma = Math.sqrt(a * a + b * b);
            if (sinSigma == 0) {
                return 0.0;
            }
            cosSigma = sinU1 * sinU2 + cosU1 * cosU2 * cosLambda;
            sigma = Math.atan2(sinSigma, cosSigma);
            double sinAlpha = cosU1 * cosU2 * sinLambda / sinSigma;
            cosSqAlpha = 1 - sinAlpha * sinAlpha;
            // Both points on the equator
            cos2SigmaM = cosSqAlpha != 0 ? cosSigma - 2 * sinU1 * sinU2 / cosSqAlpha : 0;
            double c = FLATTENING / 16 * cosSqAlpha * (4 + FLATTENING * (4 - 3 * cosSqAlpha));
            previousLambda = lambda;
            lambda = l + (1 - c) * FLATTENING * sinAlpha
                    * (sigma + c * sinSigma * (cos2SigmaM + c * cosSigma * (-1 + 2 * cos2SigmaM * cos2SigmaM)));
        } while (Math.abs(lambda - previousLambda) > CONVERGENCE && ++iterations < MAX_ITERATIONS);

        if (Math.abs(lambda - previousLambda) > CONVERGENCE || Double.isNaN(lambda)) {
            return greatCircleMeters(lat1, lon1, lat2, lon2);
        }

        double uSq = cosSqAlpha * (SEMI_MAJOR_AXIS * SEMI_MAJOR_AXIS - SEMI_MINOR_AXIS * SEMI_MINOR_AXIS)
                / (SEMI_MINOR_AXIS * SEMI_MINOR_AXIS);
        double bigA = 1 + uSq / 16384 * (4096 + uSq * (-768 + uSq * (320 - 175 * uSq)));
        double bigB = uSq / 1024 * (256 + uSq * (-128 + uSq * (74 - 47 * uSq)));
        double deltaSigma = bigB * sinSigma * (cos2SigmaM + bigB / 4
                * (cosSigma * (-1 + 2 * cos2SigmaM * cos2SigmaM)
                - bigB / 6 * cos2SigmaM * (-3 + 4 * sinSigma * sinSigma) * (-3 + 4 * cos2SigmaM * cos2SigmaM)));

        return SEMI_MINOR_AXIS * bigA * (sigma - deltaSigma);
    }

    static double greatCircleMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * MEAN_EARTH_RADIUS * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    /**
     * Length of the polyline through the given points, in kilometres.
     */
    public static double pathKm(List<GeoPoint> points) {
        if (points == null || points.size() < 2) {
            return 0.0;
        }
        double total = 0.0;
        for (int i = 1; i < points.size(); i++) {
            total += meters(points.get(i - 1), points.get(i));
        }
        return total / 1000.0;
    }
}
