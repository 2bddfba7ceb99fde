package com.wingz.api.ride.service.service.impl;

import com.wingz.api.ride.service.config.WingzProperties;
import com.wingz.api.ride.service.dto.NearbyRidesResponse;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideCreateRequest;
import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideListItemResponse;
import com.wingz.api.ride.service.dto.RideResponse;
import com.wingz.api.ride.service.dto.RideStatsResponse;
import com.wingz.api.ride.service.dto.RideUpdateRequest;
import com.wingz.api.ride.service.filter.FilterPlan;
import com.wingz.api.ride.service.filter.Pagination;
import com.wingz.api.ride.service.filter.RideFilterPipeline;
import com.wingz.api.ride.service.geo.DistanceRanker;
import com.wingz.api.ride.service.geo.GpsQuery;
import com.wingz.api.ride.service.geo.RankedRide;
import com.wingz.api.ride.service.mapper.ResultProjector;
import com.wingz.api.ride.service.repository.RideEventRepository;
import com.wingz.api.ride.service.repository.RideRepository;
import com.wingz.api.ride.service.repository.UserRepository;
import com.wingz.api.ride.service.service.RideDomainService;
import com.wingz.api.ride.service.window.TimeWindowAggregator;
import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.RideEvent;
import com.wingz.api.shared.entities.User;
import com.wingz.api.shared.exception.NotFoundException;
import com.wingz.api.shared.exception.ValidationException;
import com.wingz.api.shared.geo.GeoPoint;
import com.wingz.api.shared.window.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RideDomainServiceImpl implements RideDomainService {

    private static final Set<UserRole> RIDER_ROLES = Set.of(UserRole.RIDER, UserRole.ADMIN);
    private static final Set<UserRole> DRIVER_ROLES = Set.of(UserRole.DRIVER, UserRole.ADMIN);

    private final RideRepository rideRepository;
    private final RideEventRepository rideEventRepository;
    private final UserRepository userRepository;
    private final RideFilterPipeline rideFilterPipeline;
    private final DistanceRanker distanceRanker;
    private final TimeWindowAggregator timeWindowAggregator;
    private final ResultProjector resultProjector;
    private final WingzProperties properties;

    @Override
    @Transactional(readOnly = true)
    public PageResponse<RideListItemResponse> listRides(Map<String, String> params) {
        FilterPlan<Ride> plan = rideFilterPipeline.build(params);
        TimeWindow today = timeWindowAggregator.today();
        Optional<GeoPoint> origin = GpsQuery.point(params);
        log.info("Listing rides with filters {} (rank mode: {})", plan.describe(), origin.isPresent());

        if (origin.isPresent()) {
            List<Ride> candidates = rideRepository.findAll(plan.toSpecification(), plan.getSort());
            List<RankedRide> ranked = distanceRanker.rank(origin.get(), candidates);
            Pageable pageable = Pagination.pageable(params, properties.getQuery(), Sort.unsorted());
            PageResponse<RankedRide> page = PageResponse.slice(ranked, pageable);
            Map<Long, Long> counts = timeWindowAggregator.countsByRide(
                    page.getResults().stream().map(RankedRide::getRideId).collect(Collectors.toList()), today);
            return page.map(rankedRide -> resultProjector.toListItem(rankedRide, counts.get(rankedRide.getRideId())));
        }

        Pageable pageable = Pagination.pageable(params, properties.getQuery(), plan.getSort());
        Page<Ride> page = rideRepository.findAll(plan.toSpecification(), pageable);
        Map<Long, Long> counts = timeWindowAggregator.countsByRide(
                page.getContent().stream().map(Ride::getId).collect(Collectors.toList()), today);
        return PageResponse.of(page, ride -> resultProjector.toListItem(ride, counts.get(ride.getId())));
    }

    @Override
    @Transactional(readOnly = true)
    public RideResponse getRide(Long rideId, Map<String, String> params) {
        Ride ride = findRide(rideId);
        Double distance = GpsQuery.point(params).map(ride::distanceFrom).orElse(null);
        return project(ride, distance);
    }

    @Override
    @Transactional
    public RideResponse createRide(RideCreateRequest request) {
        User rider = participant("rider_id", request.getRiderId(), RIDER_ROLES);
        User driver = participant("driver_id", request.getDriverId(), DRIVER_ROLES);
        requireDistinct(rider, driver);

        ZonedDateTime now = timeWindowAggregator.now();
        Ride ride = Ride.builder()
                .status(request.getStatus())
                .rider(rider)
                .driver(driver)
                .pickupLatitude(request.getPickupLatitude())
                .pickupLongitude(request.getPickupLongitude())
                .dropoffLatitude(request.getDropoffLatitude())
                .dropoffLongitude(request.getDropoffLongitude())
                .pickupTime(request.getPickupTime())
                .createdAt(now)
                .updatedAt(now)
                .build();
        requireValidCoordinates(ride);

        Ride saved = rideRepository.save(ride);
        log.info("Created ride {} for rider {} and driver {}", saved.getId(), rider.getEmail(), driver.getEmail());
        return project(saved, null);
    }

    /**
     * The ride update and the status change event are two separate writes. A failure after the
     * first leaves the ride updated without its event.
     */
    @Override
    public RideResponse updateRide(Long rideId, RideUpdateRequest request) {
        Ride ride = findRide(rideId);
        RideStatus previousStatus = ride.getStatus();

        if (request.getRiderId() != null) {
            ride.setRider(participant("rider_id", request.getRiderId(), RIDER_ROLES));
        }
        if (request.getDriverId() != null) {
            ride.setDriver(participant("driver_id", request.getDriverId(), DRIVER_ROLES));
        }
        requireDistinct(ride.getRider(), ride.getDriver());

        if (request.getStatus() != null) {
            ride.setStatus(request.getStatus());
        }
        if (request.getPickupLatitude() != null) {
            ride.setPickupLatitude(request.getPickupLatitude());
        }
        if (request.getPickupLongitude() != null) {
            ride.setPickupLongitude(request.getPickupLongitude());
        }
        if (request.getDropoffLatitude() != null) {
            ride.setDropoffLatitude(request.getDropoffLatitude());
        }
        if (request.getDropoffLongitude() != null) {
            ride.setDropoffLongitude(request.getDropoffLongitude());
        }
        if (request.getPickupTime() != null) {
            ride.setPickupTime(request.getPickupTime());
        }
        requireValidCoordinates(ride);

        ZonedDateTime now = timeWindowAggregator.now();
        ride.setUpdatedAt(now);
        rideRepository.save(ride);
        log.info("Updated ride {}", rideId);

        if (ride.getStatus() != previousStatus) {
            RideEvent statusEvent = RideEvent.builder()
                    .ride(ride)
                    .description(String.format("Status changed from %s to %s",
                            previousStatus.getValue(), ride.getStatus().getValue()))
                    .createdAt(now)
                    .build();
            rideEventRepository.save(statusEvent);
            log.info("Ride {} status changed from {} to {}", rideId, previousStatus, ride.getStatus());
        }

        return project(findRide(rideId), null);
    }

    @Override
    @Transactional
    public void deleteRide(Long rideId) {
        Ride ride = rideRepository.findById(rideId)
                .orElseThrow(() -> new NotFoundException("Ride", rideId));
        int events = rideEventRepository.deleteByRideId(rideId);
        rideRepository.delete(ride);
        log.info("Deleted ride {} and {} events", rideId, events);
    }

    @Override
    @Transactional(readOnly = true)
    public NearbyRidesResponse nearbyRides(Map<String, String> params) {
        GeoPoint center = GpsQuery.point(params).orElseThrow(() -> new ValidationException(
                "gps_latitude and gps_longitude are required and must be valid coordinates",
                Map.of(GpsQuery.LATITUDE, "required, between -90 and 90",
                        GpsQuery.LONGITUDE, "required, between -180 and 180")));
        double radiusKm = GpsQuery.radiusKm(params, properties.getQuery().getDefaultRadiusKm());

        FilterPlan<Ride> plan = rideFilterPipeline.build(params);
        List<Ride> candidates = rideRepository.findAll(plan.toSpecification(), plan.getSort());
        List<RankedRide> matches = distanceRanker.withinRadius(center, radiusKm, candidates);

        TimeWindow today = timeWindowAggregator.today();
        Map<Long, Long> counts = timeWindowAggregator.countsByRide(
                matches.stream().map(RankedRide::getRideId).collect(Collectors.toList()), today);
        log.info("Found {} rides within {} km of {}", matches.size(), radiusKm, center);

        return NearbyRidesResponse.builder()
                .count(matches.size())
                .center(new NearbyRidesResponse.Center(center.getLatitude(), center.getLongitude()))
                .radiusKm(radiusKm)
                .rides(matches.stream()
                        .map(ranked -> resultProjector.toListItem(ranked, counts.get(ranked.getRideId())))
                        .collect(Collectors.toList()))
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<RideEventResponse> rideEvents(Long rideId) {
        if (!rideRepository.existsById(rideId)) {
            throw new NotFoundException("Ride", rideId);
        }
        ZonedDateTime now = timeWindowAggregator.now();
        return rideEventRepository.findByRideId(rideId).stream()
                .map(event -> resultProjector.toEventResponse(event, now))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public RideStatsResponse rideStats() {
        Map<RideStatus, Long> byStatus = new LinkedHashMap<>();
        for (RideStatus status : RideStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (Object[] row : rideRepository.countGroupedByStatus()) {
            byStatus.put((RideStatus) row[0], (Long) row[1]);
        }

        Map<String, Long> statusCounts = new LinkedHashMap<>();
        byStatus.forEach((status, count) -> statusCounts.put(status.getValue(), count));
        long active = RideStatus.ACTIVE.stream().mapToLong(byStatus::get).sum();

        return RideStatsResponse.builder()
                .totalRides(byStatus.values().stream().mapToLong(Long::longValue).sum())
                .statusCounts(statusCounts)
                .activeRides(active)
                .completedRides(byStatus.get(RideStatus.COMPLETED))
                .cancelledRides(byStatus.get(RideStatus.CANCELLED))
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<RideListItemResponse> activeRides() {
        Specification<Ride> active = (root, query, cb) -> root.get("status").in(RideStatus.ACTIVE);
        List<Ride> rides = rideRepository.findAll(active,
                Sort.by(Sort.Direction.DESC, "pickupTime").and(Sort.by(Sort.Direction.DESC, "id")));
        Map<Long, Long> counts = timeWindowAggregator.countsByRide(
                rides.stream().map(Ride::getId).collect(Collectors.toList()), timeWindowAggregator.today());
        return rides.stream()
                .map(ride -> resultProjector.toListItem(ride, counts.get(ride.getId())))
                .collect(Collectors.toList());
    }

    private Ride findRide(Long rideId) {
        return rideRepository.findWithUsersById(rideId)
                .orElseThrow(() -> new NotFoundException("Ride", rideId));
    }

    private RideResponse project(Ride ride, Double distanceKm) {
        List<RideEvent> todaysEvents = timeWindowAggregator.eventsForRide(ride.getId(), timeWindowAggregator.today());
        return resultProjector.toRideResponse(ride, todaysEvents, distanceKm);
    }

    private User participant(String field, Long userId, Set<UserRole> allowedRoles) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ValidationException(field, "User " + userId + " does not exist"));
        if (!allowedRoles.contains(user.getRole())) {
            throw new ValidationException(field, "User " + userId + " has role " + user.getRole().getValue()
                    + ", expected one of " + allowedRoles.stream().map(UserRole::getValue).sorted()
                    .collect(Collectors.joining(", ")));
        }
        return user;
    }

    private void requireDistinct(User rider, User driver) {
        if (rider.getId().equals(driver.getId())) {
            throw new ValidationException("Rider and driver must be different users.");
        }
    }

    private void requireValidCoordinates(Ride ride) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (!GeoPoint.isValidLatitude(ride.getPickupLatitude())) {
            errors.put("pickup_latitude", "must be between -90 and 90 degrees");
        }
        if (!GeoPoint.isValidLongitude(ride.getPickupLongitude())) {
            errors.put("pickup_longitude", "must be between -180 and 180 degrees");
        }
        if (!GeoPoint.isValidLatitude(ride.getDropoffLatitude())) {
            errors.put("dropoff_latitude", "must be between -90 and 90 degrees");
        }
        if (!GeoPoint.isValidLongitude(ride.getDropoffLongitude())) {
            errors.put("dropoff_longitude", "must be between -180 and 180 degrees");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid coordinates", errors);
        }
    }
}
