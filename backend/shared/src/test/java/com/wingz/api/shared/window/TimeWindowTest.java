package com.wingz.api.shared.window;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

    private static final ZonedDateTime NOW = ZonedDateTime.of(2025, 3, 14, 12, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void includesRecordsJustInsideTheWindow() {
        TimeWindow window = TimeWindow.hoursEndingAt(NOW, 24);

        assertTrue(window.includes(NOW.minusHours(23).minusMinutes(59)));
        assertTrue(window.includes(NOW));
        assertFalse(window.includes(NOW.minusHours(24).minusMinutes(1)));
    }

    @Test
    void cutoffItselfIsInclusive() {
        TimeWindow window = TimeWindow.hoursEndingAt(NOW, 24);

        assertEquals(NOW.minusHours(24), window.getCutoff());
        assertTrue(window.includes(window.getCutoff()));
    }

    @Test
    void nullTimestampIsOutside() {
        assertFalse(TimeWindow.hoursEndingAt(NOW, 24).includes(null));
    }

    @Test
    void filtersAndCountsACollection() {
        List<ZonedDateTime> stamps = List.of(
                NOW.minusMinutes(5),
                NOW.minusHours(23).minusMinutes(59),
                NOW.minusHours(24).minusMinutes(1),
                NOW.minusDays(6),
                NOW.minusDays(8));

        TimeWindow day = TimeWindow.hoursEndingAt(NOW, 24);
        TimeWindow week = TimeWindow.endingAt(NOW, Duration.ofDays(7));

        assertEquals(stamps.subList(0, 2), day.filter(stamps, Function.identity()));
        assertEquals(2, day.count(stamps, Function.identity()));
        assertEquals(4, week.count(stamps, Function.identity()));
    }
}
