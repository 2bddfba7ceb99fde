package com.wingz.api.ride.service.window;

import com.wingz.api.ride.service.config.WingzProperties;
import com.wingz.api.ride.service.repository.RideEventRepository;
import com.wingz.api.shared.entities.RideEvent;
import com.wingz.api.shared.window.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Counts and lists ride events inside rolling windows. Callers take one reference instant
 * per operation and build every window of that operation from it.
 */
@Component
@RequiredArgsConstructor
public class TimeWindowAggregator {

    private final RideEventRepository rideEventRepository;
    private final WingzProperties properties;
    private final Clock clock;

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);
    }

    /**
     * The "today" window: the configured number of hours ending at {@code reference}.
     */
    public TimeWindow today(ZonedDateTime reference) {
        return TimeWindow.hoursEndingAt(reference, properties.getQuery().getWindowHours());
    }

    public TimeWindow today() {
        return today(now());
    }

    public TimeWindow statsWindow(ZonedDateTime reference) {
        return TimeWindow.endingAt(reference, Duration.ofDays(properties.getQuery().getStatsWindowDays()));
    }

    public List<RideEvent> eventsForRide(Long rideId, TimeWindow window) {
        return rideEventRepository.findByRideIdCreatedSince(rideId, window.getCutoff());
    }

    /**
     * Window counts keyed by ride id; rides without events in the window map to zero.
     */
    public Map<Long, Long> countsByRide(Collection<Long> rideIds, TimeWindow window) {
        Map<Long, Long> counts = new HashMap<>();
        rideIds.forEach(id -> counts.put(id, 0L));
        if (rideIds.isEmpty()) {
            return counts;
        }
        for (Object[] row : rideEventRepository.countCreatedSinceGroupedByRide(rideIds, window.getCutoff())) {
            counts.put((Long) row[0], (Long) row[1]);
        }
        return counts;
    }

    public Page<RideEvent> eventsInWindow(TimeWindow window, Pageable pageable) {
        return rideEventRepository.findCreatedSince(window.getCutoff(), pageable);
    }

    public long count(TimeWindow window) {
        return rideEventRepository.countByCreatedAtGreaterThanEqual(window.getCutoff());
    }

    /**
     * Descriptions by frequency, most frequent first, ties by description. A negative limit
     * keeps every description.
     */
    public List<DescriptionCount> rankDescriptions(int limit) {
        List<DescriptionCount> ranked = rideEventRepository.countGroupedByDescription().stream()
                .map(row -> new DescriptionCount((String) row[0], (Long) row[1]))
                .sorted(Comparator.comparingLong(DescriptionCount::getCount).reversed()
                        .thenComparing(DescriptionCount::getDescription))
                .collect(Collectors.toList());
        return limit < 0 ? ranked : ranked.stream().limit(limit).collect(Collectors.toList());
    }
}
