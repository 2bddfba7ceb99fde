package com.wingz.api.ride.service.geo;

import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.geo.GeoPoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DistanceRankerTest {

    private static final GeoPoint SAN_FRANCISCO = GeoPoint.of(37.7749, -122.4194);

    private final DistanceRanker ranker = new DistanceRanker();

    private static Ride ride(long id, double latitude, double longitude) {
        return Ride.builder()
                .id(id)
                .status(RideStatus.EN_ROUTE)
                .pickupLatitude(latitude)
                .pickupLongitude(longitude)
                .dropoffLatitude(latitude)
                .dropoffLongitude(longitude)
                .build();
    }

    private static List<Long> ids(List<RankedRide> ranked) {
        return ranked.stream().map(RankedRide::getRideId).collect(Collectors.toList());
    }

    @Test
    void rankOrdersByNonDecreasingDistance() {
        List<Ride> rides = List.of(
                ride(1, 40.0, -74.0),
                ride(2, 37.7750, -122.4195),
                ride(3, 37.80, -122.45),
                ride(4, 34.05, -118.24));

        List<RankedRide> ranked = ranker.rank(SAN_FRANCISCO, rides);

        assertEquals(List.of(2L, 3L, 4L, 1L), ids(ranked));
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).getDistanceKm() <= ranked.get(i).getDistanceKm());
        }
    }

    @Test
    void equalDistancesFallBackToId() {
        List<RankedRide> ranked = ranker.rank(SAN_FRANCISCO, List.of(
                ride(9, 37.7750, -122.4195),
                ride(5, 37.7750, -122.4195)));

        assertEquals(List.of(5L, 9L), ids(ranked));
    }

    @Test
    void withinRadiusKeepsOnlyRidesInsideTheRadius() {
        List<Ride> rides = List.of(
                ride(1, 40.0, -74.0),
                ride(2, 37.7750, -122.4195),
                ride(3, 37.80, -122.45));

        List<RankedRide> nearby = ranker.withinRadius(SAN_FRANCISCO, 10.0, rides);

        assertEquals(List.of(2L, 3L), ids(nearby));
        nearby.forEach(rankedRide -> assertTrue(rankedRide.getDistanceKm() <= 10.0));
        assertEquals(0.01, nearby.get(0).getRoundedDistanceKm());
    }

    @Test
    void zeroRadiusKeepsOnlyExactMatches() {
        List<RankedRide> nearby = ranker.withinRadius(SAN_FRANCISCO, 0.0, List.of(
                ride(1, 37.7749, -122.4194),
                ride(2, 37.7750, -122.4195)));

        assertEquals(List.of(1L), ids(nearby));
        assertEquals(0.0, nearby.get(0).getDistanceKm());
    }
}
