package com.wingz.api.ride.service.mapper;

import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideResponse;
import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.RideEvent;
import com.wingz.api.shared.entities.User;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultProjectorTest {

    private static final ZonedDateTime NOW = ZonedDateTime.of(2025, 3, 14, 12, 0, 0, 0, ZoneOffset.UTC);

    private final ResultProjector projector = new ResultProjector();

    private static Ride sampleRide() {
        User rider = User.builder().id(1L).firstName("Ann").lastName("Lee").email("ann@wingz.com")
                .role(UserRole.RIDER).build();
        User driver = User.builder().id(2L).firstName("Bo").lastName("Kim").email("bo@wingz.com")
                .role(UserRole.DRIVER).build();
        return Ride.builder()
                .id(10L)
                .status(RideStatus.PICKUP)
                .rider(rider)
                .driver(driver)
                .pickupLatitude(37.7749)
                .pickupLongitude(-122.4194)
                .dropoffLatitude(37.78)
                .dropoffLongitude(-122.42)
                .pickupTime(NOW)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    void timeSinceUsesTheCoarsestWholeUnit() {
        assertEquals("2 days ago", ResultProjector.timeSince(NOW.minusDays(2).minusHours(5), NOW));
        assertEquals("23 hours ago", ResultProjector.timeSince(NOW.minusHours(23).minusMinutes(59), NOW));
        assertEquals("1 hours ago", ResultProjector.timeSince(NOW.minusHours(1), NOW));
        assertEquals("5 minutes ago", ResultProjector.timeSince(NOW.minusMinutes(5).minusSeconds(30), NOW));
        assertEquals("Just now", ResultProjector.timeSince(NOW.minusSeconds(59), NOW));
        assertEquals("Just now", ResultProjector.timeSince(NOW.plusMinutes(1), NOW));
    }

    @Test
    void eventFlagsFollowTheDescription() {
        RideEvent event = RideEvent.builder().id(3L).ride(sampleRide()).description("Driver PICKUP confirmed")
                .createdAt(NOW.minusMinutes(10)).build();

        RideEventResponse response = projector.toEventResponse(event, NOW);

        assertTrue(response.isPickupEvent());
        assertFalse(response.isDropoffEvent());
        assertEquals(10L, response.getRideId());
        assertEquals("10 minutes ago", response.getTimeSinceCreated());
    }

    @Test
    void rideDetailCarriesLocationsEventsAndRoundedDistance() {
        Ride ride = sampleRide();
        RideEvent event = RideEvent.builder().id(3L).ride(ride).description("Pickup completed").createdAt(NOW).build();

        RideResponse response = projector.toRideResponse(ride, List.of(event), 0.014241);

        assertEquals(List.of(37.7749, -122.4194), response.getPickupLocation());
        assertEquals(1, response.getTodaysEventsCount());
        assertEquals("Pickup completed", response.getTodaysRideEvents().get(0).getDescription());
        assertEquals(0.01, response.getDistanceFromPoint());
        assertEquals("Ann Lee", response.getRider().getFullName());
    }

    @Test
    void distanceIsOmittedWithoutAQueryPoint() {
        assertNull(projector.toRideResponse(sampleRide(), List.of(), null).getDistanceFromPoint());
    }
}
