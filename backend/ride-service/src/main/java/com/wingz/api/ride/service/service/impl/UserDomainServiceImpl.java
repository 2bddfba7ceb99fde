package com.wingz.api.ride.service.service.impl;

import com.wingz.api.ride.service.config.WingzProperties;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideListItemResponse;
import com.wingz.api.ride.service.dto.UserCreateRequest;
import com.wingz.api.ride.service.dto.UserResponse;
import com.wingz.api.ride.service.dto.UserStatsResponse;
import com.wingz.api.ride.service.dto.UserSummaryResponse;
import com.wingz.api.ride.service.dto.UserUpdateRequest;
import com.wingz.api.ride.service.filter.FilterPlan;
import com.wingz.api.ride.service.filter.Pagination;
import com.wingz.api.ride.service.filter.UserFilterPipeline;
import com.wingz.api.ride.service.mapper.ResultProjector;
import com.wingz.api.ride.service.repository.RideRepository;
import com.wingz.api.ride.service.repository.UserRepository;
import com.wingz.api.ride.service.service.UserDomainService;
import com.wingz.api.ride.service.window.TimeWindowAggregator;
import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.User;
import com.wingz.api.shared.exception.NotFoundException;
import com.wingz.api.shared.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserDomainServiceImpl implements UserDomainService {

    private final UserRepository userRepository;
    private final RideRepository rideRepository;
    private final UserFilterPipeline userFilterPipeline;
    private final TimeWindowAggregator timeWindowAggregator;
    private final ResultProjector resultProjector;
    private final WingzProperties properties;

    @Override
    @Transactional(readOnly = true)
    public PageResponse<UserSummaryResponse> listUsers(Map<String, String> params) {
        FilterPlan<User> plan = userFilterPipeline.build(params);
        log.info("Listing users with filters {}", plan.describe());
        Page<User> page = userRepository.findAll(plan.toSpecification(),
                Pagination.pageable(params, properties.getQuery(), plan.getSort()));
        return PageResponse.of(page, resultProjector::toSummary);
    }

    @Override
    @Transactional(readOnly = true)
    public UserResponse getUser(Long userId) {
        return resultProjector.toUserResponse(findUser(userId));
    }

    @Override
    @Transactional
    public UserResponse createUser(UserCreateRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (userRepository.existsByEmail(email)) {
            throw new ValidationException("email", "A user with this email already exists.");
        }

        User user = User.builder()
                .email(email)
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName().trim())
                .phoneNumber(request.getPhoneNumber().trim())
                .role(request.getRole() != null ? request.getRole() : UserRole.RIDER)
                .active(true)
                .dateJoined(timeWindowAggregator.now())
                .build();

        User saved = userRepository.save(user);
        log.info("Created user {} with role {}", saved.getEmail(), saved.getRole());
        return resultProjector.toUserResponse(saved);
    }

    @Override
    @Transactional
    public UserResponse updateUser(Long userId, UserUpdateRequest request) {
        User user = findUser(userId);

        if (request.getEmail() != null) {
            String email = normalizeEmail(request.getEmail());
            if (!email.equals(user.getEmail()) && userRepository.existsByEmail(email)) {
                throw new ValidationException("email", "A user with this email already exists.");
            }
            user.setEmail(email);
        }
        if (request.getFirstName() != null) {
            user.setFirstName(request.getFirstName().trim());
        }
        if (request.getLastName() != null) {
            user.setLastName(request.getLastName().trim());
        }
        if (request.getPhoneNumber() != null) {
            user.setPhoneNumber(request.getPhoneNumber().trim());
        }
        if (request.getRole() != null) {
            user.setRole(request.getRole());
        }
        if (request.getActive() != null) {
            user.setActive(request.getActive());
        }

        User saved = userRepository.save(user);
        log.info("Updated user {}", userId);
        return resultProjector.toUserResponse(saved);
    }

    @Override
    @Transactional
    public void deactivateUser(Long userId) {
        User user = findUser(userId);
        user.setActive(false);
        userRepository.save(user);
        log.info("Deactivated user {}", user.getEmail());
    }

    @Override
    @Transactional
    public UserResponse activateUser(Long userId) {
        User user = findUser(userId);
        user.setActive(true);
        User saved = userRepository.save(user);
        log.info("Activated user {}", user.getEmail());
        return resultProjector.toUserResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RideListItemResponse> userRides(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new NotFoundException("User", userId);
        }
        List<Ride> rides = rideRepository.findByParticipant(userId);
        Map<Long, Long> counts = timeWindowAggregator.countsByRide(
                rides.stream().map(Ride::getId).collect(Collectors.toList()), timeWindowAggregator.today());
        return rides.stream()
                .map(ride -> resultProjector.toListItem(ride, counts.get(ride.getId())))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public UserStatsResponse userStats() {
        long total = userRepository.count();
        long active = userRepository.countByActiveTrue();
        return UserStatsResponse.builder()
                .totalUsers(total)
                .activeUsers(active)
                .inactiveUsers(total - active)
                .drivers(userRepository.countByRoleAndActiveTrue(UserRole.DRIVER))
                .riders(userRepository.countByRoleAndActiveTrue(UserRole.RIDER))
                .admins(userRepository.countByRoleAndActiveTrue(UserRole.ADMIN))
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserSummaryResponse> activeDrivers() {
        return activeWithRole(UserRole.DRIVER);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserSummaryResponse> activeRiders() {
        return activeWithRole(UserRole.RIDER);
    }

    private List<UserSummaryResponse> activeWithRole(UserRole role) {
        return userRepository.findByRoleAndActiveTrueOrderByDateJoinedDescIdDesc(role).stream()
                .map(resultProjector::toSummary)
                .collect(Collectors.toList());
    }

    private User findUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
