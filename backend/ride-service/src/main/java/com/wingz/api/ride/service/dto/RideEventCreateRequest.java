package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEventCreateRequest {

    @NotNull
    @JsonAlias("id_ride")
    private Long rideId;

    @NotBlank(message = "Description cannot be empty.")
    @Size(max = 500)
    private String description;
}
