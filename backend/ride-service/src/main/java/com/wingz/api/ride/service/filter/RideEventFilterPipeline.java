package com.wingz.api.ride.service.filter;

import com.wingz.api.shared.entities.RideEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the ride event filter plan: ride_id, event_type (pickup or dropoff),
 * start_date/end_date on creation time and search over the description.
 */
@Slf4j
@Component
public class RideEventFilterPipeline {

    static final Set<String> EVENT_TYPES = Set.of("pickup", "dropoff");

    static final Map<String, String> ORDERING_FIELDS = Map.of(
            "id", "id",
            "id_ride_event", "id",
            "created_at", "createdAt",
            "description", "description");

    static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "createdAt");

    public FilterPlan<RideEvent> build(Map<String, String> params) {
        List<FilterClause<RideEvent>> clauses = new ArrayList<>();

        String rideId = params.get("ride_id");
        if (rideId != null) {
            Optional<Long> parsed = QueryParams.parseLong(rideId);
            if (parsed.isPresent()) {
                Long expected = parsed.get();
                clauses.add(new FilterClause<>("ride_id",
                        (root, query, cb) -> cb.equal(root.get("ride").get("id"), expected)));
            } else {
                log.debug("Ignoring non-numeric ride_id: {}", rideId);
            }
        }

        String eventType = QueryParams.trimToNull(params.get("event_type"));
        if (eventType != null) {
            String type = eventType.toLowerCase(Locale.ROOT);
            if (EVENT_TYPES.contains(type)) {
                String pattern = QueryParams.containsPattern(type);
                char escape = QueryParams.likeEscape();
                clauses.add(new FilterClause<>("event_type",
                        (root, query, cb) -> cb.like(cb.lower(root.<String>get("description")), pattern, escape)));
            } else {
                log.debug("Ignoring unknown event_type: {}", eventType);
            }
        }

        String startDate = params.get("start_date");
        if (startDate != null) {
            Optional<ZonedDateTime> start = QueryParams.parseTimestamp(startDate);
            if (start.isPresent()) {
                ZonedDateTime bound = start.get();
                clauses.add(new FilterClause<>("start_date",
                        (root, query, cb) -> cb.greaterThanOrEqualTo(root.<ZonedDateTime>get("createdAt"), bound)));
            } else {
                log.debug("Ignoring unparseable start_date: {}", startDate);
            }
        }

        String endDate = params.get("end_date");
        if (endDate != null) {
            Optional<ZonedDateTime> end = QueryParams.parseTimestamp(endDate);
            if (end.isPresent()) {
                ZonedDateTime bound = end.get();
                clauses.add(new FilterClause<>("end_date",
                        (root, query, cb) -> cb.lessThanOrEqualTo(root.<ZonedDateTime>get("createdAt"), bound)));
            } else {
                log.debug("Ignoring unparseable end_date: {}", endDate);
            }
        }

        String search = QueryParams.trimToNull(params.get("search"));
        if (search != null) {
            String pattern = QueryParams.containsPattern(search);
            char escape = QueryParams.likeEscape();
            clauses.add(new FilterClause<>("search",
                    (root, query, cb) -> cb.like(cb.lower(root.<String>get("description")), pattern, escape)));
        }

        Sort sort = OrderingParser.parse(params.get("ordering"), ORDERING_FIELDS, DEFAULT_SORT);
        return new FilterPlan<>(clauses, sort);
    }
}
