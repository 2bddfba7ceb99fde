package com.wingz.api.ride.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TodaysRideEventResponse {
    private Long id;
    private String description;
    private ZonedDateTime createdAt;
}
