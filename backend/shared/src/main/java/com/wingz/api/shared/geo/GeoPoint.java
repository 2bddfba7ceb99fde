package com.wingz.api.shared.geo;

import lombok.Value;

/**
 * A WGS84 latitude/longitude pair in degrees.
 */
@Value
public class GeoPoint {
    double latitude;
    double longitude;

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    public static boolean isValidLatitude(double latitude) {
        return Double.isFinite(latitude) && latitude >= -90.0 && latitude <= 90.0;
    }

    public static boolean isValidLongitude(double longitude) {
        return Double.isFinite(longitude) && longitude >= -180.0 && longitude <= 180.0;
    }

    public boolean isValid() {
        return isValidLatitude(latitude) && isValidLongitude(longitude);
    }
}
