package com.wingz.api.ride.service.geo;

import com.wingz.api.ride.service.filter.QueryParams;
import com.wingz.api.shared.geo.GeoPoint;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Reads the {@code gps_latitude}/{@code gps_longitude} query point. The point is present only
 * when both values are finite numbers inside the coordinate ranges.
 */
@Slf4j
public final class GpsQuery {

    public static final String LATITUDE = "gps_latitude";
    public static final String LONGITUDE = "gps_longitude";
    public static final String RADIUS = "radius";

    private GpsQuery() {
    }

    public static Optional<GeoPoint> point(Map<String, String> params) {
        String rawLatitude = params.get(LATITUDE);
        String rawLongitude = params.get(LONGITUDE);
        if (rawLatitude == null || rawLongitude == null) {
            return Optional.empty();
        }

        Optional<Double> latitude = QueryParams.parseFiniteDouble(rawLatitude).filter(GeoPoint::isValidLatitude);
        Optional<Double> longitude = QueryParams.parseFiniteDouble(rawLongitude).filter(GeoPoint::isValidLongitude);
        if (latitude.isEmpty() || longitude.isEmpty()) {
            log.debug("Ignoring invalid GPS point: {}, {}", rawLatitude, rawLongitude);
            return Optional.empty();
        }
        return Optional.of(GeoPoint.of(latitude.get(), longitude.get()));
    }

    /**
     * Radius in kilometers, or the default when absent or unparseable. A negative radius is kept
     * and matches nothing.
     */
    public static double radiusKm(Map<String, String> params, double defaultRadiusKm) {
        return QueryParams.parseFiniteDouble(params.get(RADIUS)).orElse(defaultRadiusKm);
    }
}
