package com.wingz.api.ride.service.service;

import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideListItemResponse;
import com.wingz.api.ride.service.dto.UserCreateRequest;
import com.wingz.api.ride.service.dto.UserResponse;
import com.wingz.api.ride.service.dto.UserStatsResponse;
import com.wingz.api.ride.service.dto.UserSummaryResponse;
import com.wingz.api.ride.service.dto.UserUpdateRequest;

import java.util.List;
import java.util.Map;

public interface UserDomainService {

    PageResponse<UserSummaryResponse> listUsers(Map<String, String> params);

    UserResponse getUser(Long userId);

    UserResponse createUser(UserCreateRequest request);

    UserResponse updateUser(Long userId, UserUpdateRequest request);

    /**
     * Soft delete: the user is kept with {@code is_active = false}.
     */
    void deactivateUser(Long userId);

    UserResponse activateUser(Long userId);

    /**
     * Rides where the user is rider or driver, newest first.
     */
    List<RideListItemResponse> userRides(Long userId);

    UserStatsResponse userStats();

    List<UserSummaryResponse> activeDrivers();

    List<UserSummaryResponse> activeRiders();
}
