package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wingz.api.shared.constants.RideStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Compact ride row for list views.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideListItemResponse {
    private Long id;
    private RideStatus status;
    private Long riderId;
    private Long driverId;
    private String riderEmail;
    private String driverEmail;
    private String riderName;
    private String driverName;
    private ZonedDateTime pickupTime;
    private long todaysEventsCount;
    private Double pickupLatitude;
    private Double pickupLongitude;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double distanceKm;
}
