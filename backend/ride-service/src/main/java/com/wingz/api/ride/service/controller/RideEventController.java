package com.wingz.api.ride.service.controller;

import com.wingz.api.ride.service.access.ApiOperation;
import com.wingz.api.ride.service.access.Gated;
import com.wingz.api.ride.service.dto.EventStatsResponse;
import com.wingz.api.ride.service.dto.EventTypeCountResponse;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideEventCreateRequest;
import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideEventUpdateRequest;
import com.wingz.api.ride.service.service.RideEventDomainService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/ride-events")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class RideEventController {

    private final RideEventDomainService rideEventDomainService;

    @GetMapping
    @Gated(ApiOperation.LIST_EVENTS)
    public ResponseEntity<PageResponse<RideEventResponse>> listEvents(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(rideEventDomainService.listEvents(params));
    }

    @GetMapping("/{eventId}")
    @Gated(ApiOperation.GET_EVENT)
    public ResponseEntity<RideEventResponse> getEvent(@PathVariable Long eventId) {
        return ResponseEntity.ok(rideEventDomainService.getEvent(eventId));
    }

    @PostMapping
    @Gated(ApiOperation.CREATE_EVENT)
    public ResponseEntity<RideEventResponse> createEvent(@Valid @RequestBody RideEventCreateRequest request) {
        log.info("Recording event for ride {}", request.getRideId());
        return ResponseEntity.status(HttpStatus.CREATED).body(rideEventDomainService.createEvent(request));
    }

    @RequestMapping(value = "/{eventId}", method = {RequestMethod.PATCH, RequestMethod.PUT})
    @Gated(ApiOperation.UPDATE_EVENT)
    public ResponseEntity<RideEventResponse> updateEvent(@PathVariable Long eventId,
                                                         @Valid @RequestBody RideEventUpdateRequest request) {
        log.info("Updating event {}", eventId);
        return ResponseEntity.ok(rideEventDomainService.updateEvent(eventId, request));
    }

    @DeleteMapping("/{eventId}")
    @Gated(ApiOperation.DELETE_EVENT)
    public ResponseEntity<Void> deleteEvent(@PathVariable Long eventId) {
        log.info("Deleting event {}", eventId);
        rideEventDomainService.deleteEvent(eventId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/todays_events")
    @Gated(ApiOperation.TODAYS_EVENTS)
    public ResponseEntity<PageResponse<RideEventResponse>> todaysEvents(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(rideEventDomainService.todaysEvents(params));
    }

    @GetMapping("/event_types")
    @Gated(ApiOperation.EVENT_TYPES)
    public ResponseEntity<List<EventTypeCountResponse>> eventTypes() {
        return ResponseEntity.ok(rideEventDomainService.eventTypes());
    }

    @GetMapping("/stats")
    @Gated(ApiOperation.EVENT_STATS)
    public ResponseEntity<EventStatsResponse> eventStats() {
        return ResponseEntity.ok(rideEventDomainService.eventStats());
    }
}
