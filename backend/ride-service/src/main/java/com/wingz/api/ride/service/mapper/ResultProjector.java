package com.wingz.api.ride.service.mapper;

import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideListItemResponse;
import com.wingz.api.ride.service.dto.RideResponse;
import com.wingz.api.ride.service.dto.TodaysRideEventResponse;
import com.wingz.api.ride.service.dto.UserResponse;
import com.wingz.api.ride.service.dto.UserSummaryResponse;
import com.wingz.api.ride.service.geo.RankedRide;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.RideEvent;
import com.wingz.api.shared.entities.User;
import com.wingz.api.shared.geo.HaversineDistance;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps entities to their response shapes. Pure: every derived value that depends on time or on
 * a query point is passed in.
 */
@Component
public class ResultProjector {

    public UserSummaryResponse toSummary(User user) {
        if (user == null) {
            return null;
        }
        return UserSummaryResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .fullName(user.getFullName())
                .role(user.getRole())
                .build();
    }

    public UserResponse toUserResponse(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .role(user.getRole())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .email(user.getEmail())
                .phoneNumber(user.getPhoneNumber())
                .fullName(user.getFullName())
                .admin(user.isAdmin())
                .active(user.isActive())
                .dateJoined(user.getDateJoined())
                .build();
    }

    public RideListItemResponse toListItem(Ride ride, long todaysEventsCount) {
        return RideListItemResponse.builder()
                .id(ride.getId())
                .status(ride.getStatus())
                .riderId(ride.getRider().getId())
                .driverId(ride.getDriver().getId())
                .riderEmail(ride.getRider().getEmail())
                .driverEmail(ride.getDriver().getEmail())
                .riderName(ride.getRider().getFullName())
                .driverName(ride.getDriver().getFullName())
                .pickupTime(ride.getPickupTime())
                .todaysEventsCount(todaysEventsCount)
                .pickupLatitude(ride.getPickupLatitude())
                .pickupLongitude(ride.getPickupLongitude())
                .build();
    }

    public RideListItemResponse toListItem(RankedRide ranked, long todaysEventsCount) {
        RideListItemResponse item = toListItem(ranked.getRide(), todaysEventsCount);
        item.setDistanceKm(ranked.getRoundedDistanceKm());
        return item;
    }

    /**
     * @param todaysEvents events of the ride inside the current window, newest first
     * @param distanceKm   full precision distance from a query point, or null
     */
    public RideResponse toRideResponse(Ride ride, List<RideEvent> todaysEvents, Double distanceKm) {
        return RideResponse.builder()
                .id(ride.getId())
                .status(ride.getStatus())
                .rider(toSummary(ride.getRider()))
                .driver(toSummary(ride.getDriver()))
                .pickupLatitude(ride.getPickupLatitude())
                .pickupLongitude(ride.getPickupLongitude())
                .dropoffLatitude(ride.getDropoffLatitude())
                .dropoffLongitude(ride.getDropoffLongitude())
                .pickupTime(ride.getPickupTime())
                .pickupLocation(Arrays.asList(ride.getPickupLatitude(), ride.getPickupLongitude()))
                .dropoffLocation(Arrays.asList(ride.getDropoffLatitude(), ride.getDropoffLongitude()))
                .todaysRideEvents(todaysEvents.stream().map(this::toTodaysEvent).collect(Collectors.toList()))
                .todaysEventsCount(todaysEvents.size())
                .distanceFromPoint(distanceKm == null ? null : HaversineDistance.round(distanceKm))
                .createdAt(ride.getCreatedAt())
                .updatedAt(ride.getUpdatedAt())
                .build();
    }

    public TodaysRideEventResponse toTodaysEvent(RideEvent event) {
        return TodaysRideEventResponse.builder()
                .id(event.getId())
                .description(event.getDescription())
                .createdAt(event.getCreatedAt())
                .build();
    }

    public RideEventResponse toEventResponse(RideEvent event, ZonedDateTime now) {
        return RideEventResponse.builder()
                .id(event.getId())
                .rideId(event.getRide().getId())
                .description(event.getDescription())
                .createdAt(event.getCreatedAt())
                .pickupEvent(event.isPickupEvent())
                .dropoffEvent(event.isDropoffEvent())
                .timeSinceCreated(timeSince(event.getCreatedAt(), now))
                .build();
    }

    /**
     * Coarse elapsed time: whole days, else whole hours, else whole minutes, else "Just now".
     */
    public static String timeSince(ZonedDateTime createdAt, ZonedDateTime now) {
        Duration elapsed = Duration.between(createdAt, now);
        if (elapsed.isNegative()) {
            return "Just now";
        }
        if (elapsed.toDays() > 0) {
            return elapsed.toDays() + " days ago";
        }
        if (elapsed.toHours() > 0) {
            return elapsed.toHours() + " hours ago";
        }
        if (elapsed.toMinutes() > 0) {
            return elapsed.toMinutes() + " minutes ago";
        }
        return "Just now";
    }
}
