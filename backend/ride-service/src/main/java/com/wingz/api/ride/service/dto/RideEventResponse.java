package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEventResponse {
    private Long id;
    private Long rideId;
    private String description;
    private ZonedDateTime createdAt;

    @JsonProperty("is_pickup_event")
    private boolean pickupEvent;

    @JsonProperty("is_dropoff_event")
    private boolean dropoffEvent;

    private String timeSinceCreated;
}
