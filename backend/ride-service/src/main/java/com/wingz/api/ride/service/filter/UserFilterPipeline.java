package com.wingz.api.ride.service.filter;

import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the user filter plan: role, is_active and search over name, email and phone number.
 */
@Slf4j
@Component
public class UserFilterPipeline {

    /**
     * Roles accepted by the {@code role} filter. Dispatcher is a valid stored role but is not
     * filterable; a dispatcher filter is dropped.
     */
    static final Set<UserRole> FILTERABLE_ROLES = EnumSet.of(UserRole.ADMIN, UserRole.DRIVER, UserRole.RIDER);

    static final Map<String, String> ORDERING_FIELDS = Map.of(
            "id", "id",
            "id_user", "id",
            "first_name", "firstName",
            "last_name", "lastName",
            "email", "email",
            "created_at", "dateJoined",
            "date_joined", "dateJoined");

    static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "dateJoined");

    public FilterPlan<User> build(Map<String, String> params) {
        List<FilterClause<User>> clauses = new ArrayList<>();

        String role = QueryParams.trimToNull(params.get("role"));
        if (role != null) {
            Optional<UserRole> parsed = UserRole.fromValue(role).filter(FILTERABLE_ROLES::contains);
            if (parsed.isPresent()) {
                UserRole expected = parsed.get();
                clauses.add(new FilterClause<>("role", (root, query, cb) -> cb.equal(root.get("role"), expected)));
            } else {
                log.debug("Ignoring role filter outside the allow-set: {}", role);
            }
        }

        String isActive = params.get("is_active");
        if (isActive != null) {
            boolean expected = QueryParams.parseBoolean(isActive);
            clauses.add(new FilterClause<>("is_active", (root, query, cb) -> cb.equal(root.get("active"), expected)));
        }

        String search = QueryParams.trimToNull(params.get("search"));
        if (search != null) {
            String pattern = QueryParams.containsPattern(search);
            char escape = QueryParams.likeEscape();
            clauses.add(new FilterClause<>("search", (root, query, cb) -> cb.or(
                    cb.like(cb.lower(root.<String>get("firstName")), pattern, escape),
                    cb.like(cb.lower(root.<String>get("lastName")), pattern, escape),
                    cb.like(cb.lower(root.<String>get("email")), pattern, escape),
                    cb.like(cb.lower(root.<String>get("phoneNumber")), pattern, escape))));
        }

        Sort sort = OrderingParser.parse(params.get("ordering"), ORDERING_FIELDS, DEFAULT_SORT);
        return new FilterPlan<>(clauses, sort);
    }
}
