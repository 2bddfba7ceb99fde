package com.wingz.api.shared.window;

import lombok.Value;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A rolling interval {@code [reference - length, reference]}. The reference instant is fixed
 * when the window is created so every record of one operation is judged against the same cutoff.
 */
@Value
public class TimeWindow {
    ZonedDateTime reference;
    Duration length;

    public static TimeWindow endingAt(ZonedDateTime reference, Duration length) {
        return new TimeWindow(reference, length);
    }

    public static TimeWindow hoursEndingAt(ZonedDateTime reference, long hours) {
        return new TimeWindow(reference, Duration.ofHours(hours));
    }

    public ZonedDateTime getCutoff() {
        return reference.minus(length);
    }

    public boolean includes(ZonedDateTime createdAt) {
        return createdAt != null && !createdAt.isBefore(getCutoff());
    }

    public <T> List<T> filter(Collection<T> records, Function<T, ZonedDateTime> createdAt) {
        return records.stream()
                .filter(record -> includes(createdAt.apply(record)))
                .collect(Collectors.toList());
    }

    public <T> long count(Collection<T> records, Function<T, ZonedDateTime> createdAt) {
        return records.stream()
                .filter(record -> includes(createdAt.apply(record)))
                .count();
    }
}
