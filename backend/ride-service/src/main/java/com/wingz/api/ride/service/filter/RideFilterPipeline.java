package com.wingz.api.ride.service.filter;

import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.User;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the ride filter plan from query parameters: status, rider_id, driver_id,
 * start_date/end_date on pickup time, and search over rider and driver names and emails.
 */
@Slf4j
@Component
public class RideFilterPipeline {

    static final Map<String, String> ORDERING_FIELDS = Map.of(
            "id", "id",
            "status", "status",
            "pickup_time", "pickupTime",
            "created_at", "createdAt",
            "updated_at", "updatedAt");

    static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "pickupTime");

    public FilterPlan<Ride> build(Map<String, String> params) {
        List<FilterClause<Ride>> clauses = new ArrayList<>();

        String status = QueryParams.trimToNull(params.get("status"));
        if (status != null) {
            clauses.add(new FilterClause<>("status", statusEquals(status)));
        }

        participant(params, "rider_id", "rider").ifPresent(clauses::add);
        participant(params, "driver_id", "driver").ifPresent(clauses::add);

        String startDate = params.get("start_date");
        if (startDate != null) {
            Optional<ZonedDateTime> start = QueryParams.parseTimestamp(startDate);
            if (start.isPresent()) {
                ZonedDateTime bound = start.get();
                clauses.add(new FilterClause<>("start_date",
                        (root, query, cb) -> cb.greaterThanOrEqualTo(root.<ZonedDateTime>get("pickupTime"), bound)));
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
                        (root, query, cb) -> cb.lessThanOrEqualTo(root.<ZonedDateTime>get("pickupTime"), bound)));
            } else {
                log.debug("Ignoring unparseable end_date: {}", endDate);
            }
        }

        String search = QueryParams.trimToNull(params.get("search"));
        if (search != null) {
            clauses.add(new FilterClause<>("search", matchesParticipant(search)));
        }

        Sort sort = OrderingParser.parse(params.get("ordering"), ORDERING_FIELDS, DEFAULT_SORT);
        return new FilterPlan<>(clauses, sort);
    }

    /**
     * Unknown status values match nothing rather than failing the request.
     */
    private Specification<Ride> statusEquals(String value) {
        Optional<RideStatus> status = RideStatus.fromValue(value);
        if (status.isEmpty()) {
            log.debug("Unknown ride status filter: {}", value);
            return (root, query, cb) -> cb.disjunction();
        }
        RideStatus expected = status.get();
        return (root, query, cb) -> cb.equal(root.get("status"), expected);
    }

    private Optional<FilterClause<Ride>> participant(Map<String, String> params, String param, String attribute) {
        String raw = params.get(param);
        if (raw == null) {
            return Optional.empty();
        }
        Optional<Long> userId = QueryParams.parseLong(raw);
        if (userId.isEmpty()) {
            log.debug("Ignoring non-numeric {}: {}", param, raw);
            return Optional.empty();
        }
        Long expected = userId.get();
        return Optional.of(new FilterClause<>(param,
                (root, query, cb) -> cb.equal(root.get(attribute).get("id"), expected)));
    }

    private Specification<Ride> matchesParticipant(String term) {
        String pattern = QueryParams.containsPattern(term);
        char escape = QueryParams.likeEscape();
        return (root, query, cb) -> {
            Join<Ride, User> rider = root.join("rider", JoinType.LEFT);
            Join<Ride, User> driver = root.join("driver", JoinType.LEFT);
            return cb.or(
                    cb.like(cb.lower(rider.<String>get("firstName")), pattern, escape),
                    cb.like(cb.lower(rider.<String>get("lastName")), pattern, escape),
                    cb.like(cb.lower(rider.<String>get("email")), pattern, escape),
                    cb.like(cb.lower(driver.<String>get("firstName")), pattern, escape),
                    cb.like(cb.lower(driver.<String>get("lastName")), pattern, escape),
                    cb.like(cb.lower(driver.<String>get("email")), pattern, escape));
        };
    }
}
