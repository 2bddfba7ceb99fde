package com.wingz.api.ride.service.filter;

import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

/**
 * One predicate of a filter plan, named after the request parameter that produced it.
 */
@Value
public class FilterClause<T> {
    String name;
    Specification<T> specification;
}
