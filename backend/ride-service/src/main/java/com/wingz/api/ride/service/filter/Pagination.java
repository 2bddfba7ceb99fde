package com.wingz.api.ride.service.filter;

import com.wingz.api.ride.service.config.WingzProperties;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Map;

/**
 * {@code page} is one-based; {@code page_size} is capped. Invalid values fall back to the defaults.
 */
public final class Pagination {

    private Pagination() {
    }

    public static Pageable pageable(Map<String, String> params, WingzProperties.Query settings, Sort sort) {
        int page = QueryParams.parsePositiveInt(params.get("page"), 1);
        int size = QueryParams.parsePositiveInt(params.get("page_size"), settings.getDefaultPageSize());
        return PageRequest.of(page - 1, Math.min(size, settings.getMaxPageSize()), sort);
    }
}
