package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Edits an existing event. Events are append-only in the domain, but this path allows
 * correcting the description, parent ride or timestamp.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEventUpdateRequest {

    @JsonAlias("id_ride")
    private Long rideId;

    @Size(max = 500)
    private String description;

    private ZonedDateTime createdAt;
}
