package com.wingz.api.ride.service.geo;

import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.geo.HaversineDistance;
import lombok.Value;

/**
 * A ride annotated with its pickup's distance from a query point, kept at full precision.
 */
@Value
public class RankedRide {
    Ride ride;
    double distanceKm;

    public Long getRideId() {
        return ride.getId();
    }

    public double getRoundedDistanceKm() {
        return HaversineDistance.round(distanceKm);
    }
}
