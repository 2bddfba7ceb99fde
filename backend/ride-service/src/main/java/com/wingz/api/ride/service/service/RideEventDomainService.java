package com.wingz.api.ride.service.service;

import com.wingz.api.ride.service.dto.EventStatsResponse;
import com.wingz.api.ride.service.dto.EventTypeCountResponse;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideEventCreateRequest;
import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideEventUpdateRequest;

import java.util.List;
import java.util.Map;

public interface RideEventDomainService {

    PageResponse<RideEventResponse> listEvents(Map<String, String> params);

    RideEventResponse getEvent(Long eventId);

    RideEventResponse createEvent(RideEventCreateRequest request);

    RideEventResponse updateEvent(Long eventId, RideEventUpdateRequest request);

    void deleteEvent(Long eventId);

    /**
     * Events created inside the current window across all rides, newest first.
     */
    PageResponse<RideEventResponse> todaysEvents(Map<String, String> params);

    List<EventTypeCountResponse> eventTypes();

    EventStatsResponse eventStats();
}
