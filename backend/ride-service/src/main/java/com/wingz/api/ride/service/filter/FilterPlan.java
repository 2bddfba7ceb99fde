package com.wingz.api.ride.service.filter;

import lombok.Getter;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The predicates and ordering built for one request. All clauses combine with AND; an empty
 * plan matches every row.
 */
@Getter
public class FilterPlan<T> {

    private final List<FilterClause<T>> clauses;
    private final Sort sort;

    public FilterPlan(List<FilterClause<T>> clauses, Sort sort) {
        this.clauses = List.copyOf(clauses);
        this.sort = sort;
    }

    public Specification<T> toSpecification() {
        Specification<T> combined = (root, query, cb) -> cb.conjunction();
        for (FilterClause<T> clause : clauses) {
            combined = combined.and(clause.getSpecification());
        }
        return combined;
    }

    public boolean hasClause(String name) {
        return clauses.stream().anyMatch(clause -> clause.getName().equals(name));
    }

    public List<String> describe() {
        return clauses.stream().map(FilterClause::getName).collect(Collectors.toList());
    }
}
