package com.wingz.api.ride.service.controller;

import com.wingz.api.ride.service.access.ApiOperation;
import com.wingz.api.ride.service.access.Gated;
import com.wingz.api.ride.service.dto.NearbyRidesResponse;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideCreateRequest;
import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideListItemResponse;
import com.wingz.api.ride.service.dto.RideResponse;
import com.wingz.api.ride.service.dto.RideStatsResponse;
import com.wingz.api.ride.service.dto.RideUpdateRequest;
import com.wingz.api.ride.service.service.RideDomainService;
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
@RequestMapping("/api/rides")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class RideController {

    private final RideDomainService rideDomainService;

    @GetMapping
    @Gated(ApiOperation.LIST_RIDES)
    public ResponseEntity<PageResponse<RideListItemResponse>> listRides(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(rideDomainService.listRides(params));
    }

    @GetMapping("/{rideId}")
    @Gated(ApiOperation.GET_RIDE)
    public ResponseEntity<RideResponse> getRide(@PathVariable Long rideId,
                                                @RequestParam Map<String, String> params) {
        return ResponseEntity.ok(rideDomainService.getRide(rideId, params));
    }

    @PostMapping
    @Gated(ApiOperation.CREATE_RIDE)
    public ResponseEntity<RideResponse> createRide(@Valid @RequestBody RideCreateRequest request) {
        log.info("Creating ride for rider {} and driver {}", request.getRiderId(), request.getDriverId());
        return ResponseEntity.status(HttpStatus.CREATED).body(rideDomainService.createRide(request));
    }

    @RequestMapping(value = "/{rideId}", method = {RequestMethod.PATCH, RequestMethod.PUT})
    @Gated(ApiOperation.UPDATE_RIDE)
    public ResponseEntity<RideResponse> updateRide(@PathVariable Long rideId,
                                                   @Valid @RequestBody RideUpdateRequest request) {
        log.info("Updating ride {}", rideId);
        return ResponseEntity.ok(rideDomainService.updateRide(rideId, request));
    }

    @DeleteMapping("/{rideId}")
    @Gated(ApiOperation.DELETE_RIDE)
    public ResponseEntity<Void> deleteRide(@PathVariable Long rideId) {
        log.info("Deleting ride {}", rideId);
        rideDomainService.deleteRide(rideId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/nearby")
    @Gated(ApiOperation.NEARBY_RIDES)
    public ResponseEntity<NearbyRidesResponse> nearbyRides(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(rideDomainService.nearbyRides(params));
    }

    @GetMapping("/{rideId}/events")
    @Gated(ApiOperation.RIDE_EVENTS)
    public ResponseEntity<List<RideEventResponse>> rideEvents(@PathVariable Long rideId) {
        return ResponseEntity.ok(rideDomainService.rideEvents(rideId));
    }

    @GetMapping("/stats")
    @Gated(ApiOperation.RIDE_STATS)
    public ResponseEntity<RideStatsResponse> rideStats() {
        return ResponseEntity.ok(rideDomainService.rideStats());
    }

    @GetMapping("/active")
    @Gated(ApiOperation.ACTIVE_RIDES)
    public ResponseEntity<List<RideListItemResponse>> activeRides() {
        return ResponseEntity.ok(rideDomainService.activeRides());
    }
}
