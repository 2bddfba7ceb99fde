package com.wingz.api.ride.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {
    private long count;
    private int page;
    private int pageSize;
    private int totalPages;
    private List<T> results;

    public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper) {
        return PageResponse.<T>builder()
                .count(page.getTotalElements())
                .page(page.getNumber() + 1)
                .pageSize(page.getSize())
                .totalPages(page.getTotalPages())
                .results(page.getContent().stream().map(mapper).collect(Collectors.toList()))
                .build();
    }

    /**
     * Pages an already ordered in-memory list.
     */
    public static <T> PageResponse<T> slice(List<T> ordered, Pageable pageable) {
        int size = pageable.getPageSize();
        int from = (int) Math.min(pageable.getOffset(), ordered.size());
        int to = Math.min(from + size, ordered.size());
        return PageResponse.<T>builder()
                .count(ordered.size())
                .page(pageable.getPageNumber() + 1)
                .pageSize(size)
                .totalPages((ordered.size() + size - 1) / size)
                .results(List.copyOf(ordered.subList(from, to)))
                .build();
    }

    public <R> PageResponse<R> map(Function<T, R> mapper) {
        return PageResponse.<R>builder()
                .count(count)
                .page(page)
                .pageSize(pageSize)
                .totalPages(totalPages)
                .results(results.stream().map(mapper).collect(Collectors.toList()))
                .build();
    }
}
