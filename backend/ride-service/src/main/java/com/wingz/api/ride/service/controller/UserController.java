package com.wingz.api.ride.service.controller;

import com.wingz.api.ride.service.access.ApiOperation;
import com.wingz.api.ride.service.access.Gated;
import com.wingz.api.ride.service.dto.MessageResponse;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideListItemResponse;
import com.wingz.api.ride.service.dto.UserCreateRequest;
import com.wingz.api.ride.service.dto.UserResponse;
import com.wingz.api.ride.service.dto.UserStatsResponse;
import com.wingz.api.ride.service.dto.UserSummaryResponse;
import com.wingz.api.ride.service.dto.UserUpdateRequest;
import com.wingz.api.ride.service.service.UserDomainService;
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
@RequestMapping("/api/users")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class UserController {

    private final UserDomainService userDomainService;

    @GetMapping
    @Gated(ApiOperation.LIST_USERS)
    public ResponseEntity<PageResponse<UserSummaryResponse>> listUsers(@RequestParam Map<String, String> params) {
        return ResponseEntity.ok(userDomainService.listUsers(params));
    }

    @GetMapping("/{userId}")
    @Gated(ApiOperation.GET_USER)
    public ResponseEntity<UserResponse> getUser(@PathVariable Long userId) {
        return ResponseEntity.ok(userDomainService.getUser(userId));
    }

    @PostMapping
    @Gated(ApiOperation.CREATE_USER)
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody UserCreateRequest request) {
        log.info("Creating user {}", request.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(userDomainService.createUser(request));
    }

    @RequestMapping(value = "/{userId}", method = {RequestMethod.PATCH, RequestMethod.PUT})
    @Gated(ApiOperation.UPDATE_USER)
    public ResponseEntity<UserResponse> updateUser(@PathVariable Long userId,
                                                   @Valid @RequestBody UserUpdateRequest request) {
        log.info("Updating user {}", userId);
        return ResponseEntity.ok(userDomainService.updateUser(userId, request));
    }

    @DeleteMapping("/{userId}")
    @Gated(ApiOperation.DEACTIVATE_USER)
    public ResponseEntity<MessageResponse> deactivateUser(@PathVariable Long userId) {
        log.info("Deactivating user {}", userId);
        userDomainService.deactivateUser(userId);
        return ResponseEntity.ok(new MessageResponse("User deactivated successfully"));
    }

    @PostMapping("/{userId}/activate")
    @Gated(ApiOperation.ACTIVATE_USER)
    public ResponseEntity<UserResponse> activateUser(@PathVariable Long userId) {
        log.info("Activating user {}", userId);
        return ResponseEntity.ok(userDomainService.activateUser(userId));
    }

    @GetMapping("/{userId}/rides")
    @Gated(ApiOperation.USER_RIDES)
    public ResponseEntity<List<RideListItemResponse>> userRides(@PathVariable Long userId) {
        return ResponseEntity.ok(userDomainService.userRides(userId));
    }

    @GetMapping("/stats")
    @Gated(ApiOperation.USER_STATS)
    public ResponseEntity<UserStatsResponse> userStats() {
        return ResponseEntity.ok(userDomainService.userStats());
    }

    @GetMapping("/drivers")
    @Gated(ApiOperation.LIST_DRIVERS)
    public ResponseEntity<List<UserSummaryResponse>> drivers() {
        return ResponseEntity.ok(userDomainService.activeDrivers());
    }

    @GetMapping("/riders")
    @Gated(ApiOperation.LIST_RIDERS)
    public ResponseEntity<List<UserSummaryResponse>> riders() {
        return ResponseEntity.ok(userDomainService.activeRiders());
    }
}
