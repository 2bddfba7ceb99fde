package com.wingz.api.ride.service.service.impl;

import com.wingz.api.ride.service.config.WingzProperties;
import com.wingz.api.ride.service.dto.EventStatsResponse;
import com.wingz.api.ride.service.dto.EventTypeCountResponse;
import com.wingz.api.ride.service.dto.PageResponse;
import com.wingz.api.ride.service.dto.RideEventCreateRequest;
import com.wingz.api.ride.service.dto.RideEventResponse;
import com.wingz.api.ride.service.dto.RideEventUpdateRequest;
import com.wingz.api.ride.service.filter.FilterPlan;
import com.wingz.api.ride.service.filter.Pagination;
import com.wingz.api.ride.service.filter.RideEventFilterPipeline;
import com.wingz.api.ride.service.mapper.ResultProjector;
import com.wingz.api.ride.service.repository.RideEventRepository;
import com.wingz.api.ride.service.repository.RideRepository;
import com.wingz.api.ride.service.service.RideEventDomainService;
import com.wingz.api.ride.service.window.DescriptionCount;
import com.wingz.api.ride.service.window.TimeWindowAggregator;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.RideEvent;
import com.wingz.api.shared.exception.NotFoundException;
import com.wingz.api.shared.exception.ValidationException;
import com.wingz.api.shared.window.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RideEventDomainServiceImpl implements RideEventDomainService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
            .and(Sort.by(Sort.Direction.DESC, "id"));

    private final RideEventRepository rideEventRepository;
    private final RideRepository rideRepository;
    private final RideEventFilterPipeline rideEventFilterPipeline;
    private final TimeWindowAggregator timeWindowAggregator;
    private final ResultProjector resultProjector;
    private final WingzProperties properties;

    @Override
    @Transactional(readOnly = true)
    public PageResponse<RideEventResponse> listEvents(Map<String, String> params) {
        FilterPlan<RideEvent> plan = rideEventFilterPipeline.build(params);
        log.info("Listing ride events with filters {}", plan.describe());
        Pageable pageable = Pagination.pageable(params, properties.getQuery(), plan.getSort());
        Page<RideEvent> page = rideEventRepository.findAll(plan.toSpecification(), pageable);
        ZonedDateTime now = timeWindowAggregator.now();
        return PageResponse.of(page, event -> resultProjector.toEventResponse(event, now));
    }

    @Override
    @Transactional(readOnly = true)
    public RideEventResponse getEvent(Long eventId) {
        return resultProjector.toEventResponse(findEvent(eventId), timeWindowAggregator.now());
    }

    @Override
    @Transactional
    public RideEventResponse createEvent(RideEventCreateRequest request) {
        Ride ride = parentRide(request.getRideId());
        requireDescription(request.getDescription());

        ZonedDateTime now = timeWindowAggregator.now();
        RideEvent saved = rideEventRepository.save(RideEvent.builder()
                .ride(ride)
                .description(request.getDescription().trim())
                .createdAt(now)
                .build());
        log.info("Created event {} for ride {}: {}", saved.getId(), ride.getId(), saved.getDescription());
        return resultProjector.toEventResponse(saved, now);
    }

    @Override
    @Transactional
    public RideEventResponse updateEvent(Long eventId, RideEventUpdateRequest request) {
        RideEvent event = findEvent(eventId);
        if (request.getRideId() != null) {
            event.setRide(parentRide(request.getRideId()));
        }
        if (request.getDescription() != null) {
            requireDescription(request.getDescription());
            event.setDescription(request.getDescription().trim());
        }
        if (request.getCreatedAt() != null) {
            event.setCreatedAt(request.getCreatedAt());
        }

        RideEvent saved = rideEventRepository.save(event);
        log.info("Updated event {}", eventId);
        return resultProjector.toEventResponse(saved, timeWindowAggregator.now());
    }

    @Override
    @Transactional
    public void deleteEvent(Long eventId) {
        RideEvent event = findEvent(eventId);
        rideEventRepository.delete(event);
        log.info("Deleted event {}", eventId);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResponse<RideEventResponse> todaysEvents(Map<String, String> params) {
        ZonedDateTime now = timeWindowAggregator.now();
        TimeWindow today = timeWindowAggregator.today(now);
        Pageable pageable = Pagination.pageable(params, properties.getQuery(), NEWEST_FIRST);
        Page<RideEvent> page = timeWindowAggregator.eventsInWindow(today, pageable);
        return PageResponse.of(page, event -> resultProjector.toEventResponse(event, now));
    }

    @Override
    @Transactional(readOnly = true)
    public List<EventTypeCountResponse> eventTypes() {
        return toResponses(timeWindowAggregator.rankDescriptions(-1));
    }

    @Override
    @Transactional(readOnly = true)
    public EventStatsResponse eventStats() {
        ZonedDateTime now = timeWindowAggregator.now();
        return EventStatsResponse.builder()
                .totalEvents(rideEventRepository.count())
                .eventsLastDay(timeWindowAggregator.count(timeWindowAggregator.today(now)))
                .eventsLastWeek(timeWindowAggregator.count(timeWindowAggregator.statsWindow(now)))
                .topEventTypes(toResponses(timeWindowAggregator.rankDescriptions(
                        properties.getQuery().getTopEventTypes())))
                .build();
    }

    private List<EventTypeCountResponse> toResponses(List<DescriptionCount> counts) {
        return counts.stream()
                .map(count -> new EventTypeCountResponse(count.getDescription(), count.getCount()))
                .collect(Collectors.toList());
    }

    private RideEvent findEvent(Long eventId) {
        return rideEventRepository.findById(eventId)
                .orElseThrow(() -> new NotFoundException("RideEvent", eventId));
    }

    private Ride parentRide(Long rideId) {
        return rideRepository.findById(rideId)
                .orElseThrow(() -> new ValidationException("ride_id", "Ride " + rideId + " does not exist"));
    }

    private void requireDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new ValidationException("description", "Description cannot be empty.");
        }
    }
}
