package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.wingz.api.shared.constants.RideStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideCreateRequest {

    @NotNull
    private RideStatus status;

    @NotNull
    @JsonAlias("id_rider")
    private Long riderId;

    @NotNull
    @JsonAlias("id_driver")
    private Long driverId;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double pickupLatitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double pickupLongitude;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double dropoffLatitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double dropoffLongitude;

    @NotNull
    private ZonedDateTime pickupTime;
}
