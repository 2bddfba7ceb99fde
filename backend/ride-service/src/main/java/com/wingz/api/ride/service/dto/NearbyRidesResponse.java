package com.wingz.api.ride.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NearbyRidesResponse {
    private int count;
    private Center center;
    private double radiusKm;
    private List<RideListItemResponse> rides;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Center {
        private double latitude;
        private double longitude;
    }
}
