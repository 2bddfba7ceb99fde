package com.wingz.api.ride.service.filter;

import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the {@code ordering} parameter: comma separated field names, {@code -} prefix for
 * descending. Fields outside the allow-list are ignored. The primary key is always appended
 * as the final tie-breaker so pagination is stable.
 */
public final class OrderingParser {

    public static final String ID_PROPERTY = "id";

    private OrderingParser() {
    }

    /**
     * @param ordering      raw parameter value, may be null
     * @param allowedFields parameter field name to entity property
     * @param defaultSort   used when no requested field is allowed
     */
    public static Sort parse(String ordering, Map<String, String> allowedFields, Sort defaultSort) {
        List<Sort.Order> orders = new ArrayList<>();
        if (ordering != null) {
            for (String token : ordering.split(",")) {
                String field = token.trim();
                Sort.Direction direction = Sort.Direction.ASC;
                if (field.startsWith("-")) {
                    direction = Sort.Direction.DESC;
                    field = field.substring(1);
                }
                String property = allowedFields.get(field);
                if (property != null && orders.stream().noneMatch(o -> o.getProperty().equals(property))) {
                    orders.add(new Sort.Order(direction, property));
                }
            }
        }

        Sort sort = orders.isEmpty() ? defaultSort : Sort.by(orders);
        return withIdTieBreaker(sort);
    }

    public static Sort withIdTieBreaker(Sort sort) {
        if (sort.getOrderFor(ID_PROPERTY) != null) {
            return sort;
        }
        Sort.Direction direction = sort.stream()
                .findFirst()
                .map(Sort.Order::getDirection)
                .orElse(Sort.Direction.ASC);
        return sort.and(Sort.by(direction, ID_PROPERTY));
    }
}
