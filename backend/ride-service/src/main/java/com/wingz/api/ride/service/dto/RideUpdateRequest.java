package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.wingz.api.shared.constants.RideStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Partial update; absent fields keep their value. Any status may follow any other.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideUpdateRequest {

    private RideStatus status;

    @JsonAlias("id_rider")
    private Long riderId;

    @JsonAlias("id_driver")
    private Long driverId;

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double pickupLatitude;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double pickupLongitude;

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double dropoffLatitude;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double dropoffLongitude;

    private ZonedDateTime pickupTime;
}
