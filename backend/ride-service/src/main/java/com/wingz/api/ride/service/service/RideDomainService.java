package com.wingz.api.ride.service.service;

import com.wingz.api.ride.service.dto.NearbyRidesResponse;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideCreateRequest;
import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideListItemResponse;
import com.wingz.api.ride.service.dto.RideResponse;
import com.wingz.api.ride.service.dto.RideStatsResponse;
import com.wingz.api.ride.service.dto.RideUpdateRequest;

import java.util.List;
import java.util.Map;

public interface RideDomainService {

    /**
     * Filtered, ordered page of rides. A valid GPS point switches to rank mode, which orders by
     * pickup distance and ignores {@code ordering}.
     */
    PageResponse<RideListItemResponse> listRides(Map<String, String> params);

    RideResponse getRide(Long rideId, Map<String, String> params);

    RideResponse createRide(RideCreateRequest request);

    RideResponse updateRide(Long rideId, RideUpdateRequest request);

    void deleteRide(Long rideId);

    NearbyRidesResponse nearbyRides(Map<String, String> params);

    List<RideEventResponse> rideEvents(Long rideId);

    RideStatsResponse rideStats();

    List<RideListItemResponse> activeRides();
}
