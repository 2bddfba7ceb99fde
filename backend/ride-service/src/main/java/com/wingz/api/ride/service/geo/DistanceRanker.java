package com.wingz.api.ride.service.geo;

import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.geo.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orders and bounds rides by the great-circle distance of their pickup from a query point.
 * Ties on distance fall back to the ride id.
 */
@Slf4j
@Component
public class DistanceRanker {

    private static final Comparator<RankedRide> BY_DISTANCE = Comparator
            .comparingDouble(RankedRide::getDistanceKm)
            .thenComparing(RankedRide::getRideId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Rank mode: every ride, nearest first.
     */
    public List<RankedRide> rank(GeoPoint origin, Collection<Ride> rides) {
        return rides.stream()
                .map(ride -> new RankedRide(ride, ride.distanceFrom(origin)))
                .sorted(BY_DISTANCE)
                .collect(Collectors.toList());
    }

    /**
     * Radius mode: only rides whose pickup lies within {@code radiusKm}, nearest first.
     */
    public List<RankedRide> withinRadius(GeoPoint origin, double radiusKm, Collection<Ride> rides) {
        List<RankedRide> matches = rides.stream()
                .map(ride -> new RankedRide(ride, ride.distanceFrom(origin)))
                .filter(ranked -> ranked.getDistanceKm() <= radiusKm)
                .sorted(BY_DISTANCE)
                .collect(Collectors.toList());
        log.debug("{} of {} rides within {} km of {}", matches.size(), rides.size(), radiusKm, origin);
        return matches;
    }
}
