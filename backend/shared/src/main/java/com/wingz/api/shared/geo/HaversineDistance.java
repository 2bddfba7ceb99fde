package com.wingz.api.shared.geo;

/**
 * Great-circle distance on a sphere of the Earth's mean radius.
 */
public final class HaversineDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private HaversineDistance() {
    }

    /**
     * Distance between two valid points in kilometers. Always finite and non-negative,
     * zero for identical points and symmetric in its arguments.
     */
    public static double kilometers(GeoPoint from, GeoPoint to) {
        double lat1Rad = Math.toRadians(from.getLatitude());
        double lat2Rad = Math.toRadians(to.getLatitude());
        double deltaLatRad = Math.toRadians(to.getLatitude() - from.getLatitude());
        double deltaLonRad = Math.toRadians(to.getLongitude() - from.getLongitude());

        double sinLat = Math.sin(deltaLatRad / 2);
        double sinLon = Math.sin(deltaLonRad / 2);
        double a = sinLat * sinLat + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinLon * sinLon;

        // rounding can push a just past 1.0 for antipodal points
        a = Math.min(1.0, Math.max(0.0, a));

        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(a));
    }

    /**
     * Rounds a distance to two decimals for display. Comparisons should use the raw value.
     */
    public static double round(double kilometers) {
        return Math.round(kilometers * 100.0) / 100.0;
    }
}
