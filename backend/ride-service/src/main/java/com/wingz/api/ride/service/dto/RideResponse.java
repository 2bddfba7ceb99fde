package com.wingz.api.ride.service.dto;

import com.wingz.api.shared.constants.RideStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Full ride view with participants and the events of the current window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideResponse {
    private Long id;
    private RideStatus status;
    private UserSummaryResponse rider;
    private UserSummaryResponse driver;
    private Double pickupLatitude;
    private Double pickupLongitude;
    private Double dropoffLatitude;
    private Double dropoffLongitude;
    private ZonedDateTime pickupTime;
    private List<Double> pickupLocation;
    private List<Double> dropoffLocation;
    private List<TodaysRideEventResponse> todaysRideEvents;
    private long todaysEventsCount;

    // Only set when a GPS point was supplied
    private Double distanceFromPoint;

    private ZonedDateTime createdAt;
    private ZonedDateTime updatedAt;
}
