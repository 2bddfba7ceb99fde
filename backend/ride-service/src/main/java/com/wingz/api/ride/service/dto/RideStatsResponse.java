package com.wingz.api.ride.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideStatsResponse {
    private long totalRides;
    private Map<String, Long> statusCounts;
    private long activeRides;
    private long completedRides;
    private long cancelledRides;
}
