package com.wingz.api.ride.service.filter;

import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryParamsTest {

    @Test
    void trailingZIsUtc() {
        Optional<ZonedDateTime> parsed = QueryParams.parseTimestamp("2025-03-14T10:15:30Z");

        assertTrue(parsed.isPresent());
        assertEquals(ZonedDateTime.of(2025, 3, 14, 10, 15, 30, 0, ZoneOffset.UTC).toInstant(),
                parsed.get().toInstant());
    }

    @Test
    void explicitOffsetIsNormalisedToTheSameInstant() {
        Optional<ZonedDateTime> parsed = QueryParams.parseTimestamp("2025-03-14T12:15:30+02:00");

        assertEquals(ZonedDateTime.of(2025, 3, 14, 10, 15, 30, 0, ZoneOffset.UTC).toInstant(),
                parsed.orElseThrow().toInstant());
    }

    @Test
    void offsetLessTimestampAndPlainDateAreUtc() {
        assertEquals(ZonedDateTime.of(2025, 3, 14, 10, 0, 0, 0, ZoneOffset.UTC).toInstant(),
                QueryParams.parseTimestamp("2025-03-14T10:00:00").orElseThrow().toInstant());
        assertEquals(ZonedDateTime.of(2025, 3, 14, 0, 0, 0, 0, ZoneOffset.UTC).toInstant(),
                QueryParams.parseTimestamp("2025-03-14").orElseThrow().toInstant());
    }

    @Test
    void garbageTimestampsAreEmpty() {
        assertTrue(QueryParams.parseTimestamp("not-a-date").isEmpty());
        assertTrue(QueryParams.parseTimestamp("2025-13-45").isEmpty());
        assertTrue(QueryParams.parseTimestamp("   ").isEmpty());
        assertTrue(QueryParams.parseTimestamp(null).isEmpty());
    }

    @Test
    void booleanAcceptsOnlyTheTruthySet() {
        assertTrue(QueryParams.parseBoolean("true"));
        assertTrue(QueryParams.parseBoolean("TRUE"));
        assertTrue(QueryParams.parseBoolean("1"));
        assertTrue(QueryParams.parseBoolean("Yes"));
        assertFalse(QueryParams.parseBoolean("false"));
        assertFalse(QueryParams.parseBoolean("on"));
        assertFalse(QueryParams.parseBoolean(null));
    }

    @Test
    void finiteDoubleRejectsNanAndInfinity() {
        assertEquals(Optional.of(37.5), QueryParams.parseFiniteDouble("37.5"));
        assertTrue(QueryParams.parseFiniteDouble("NaN").isEmpty());
        assertTrue(QueryParams.parseFiniteDouble("Infinity").isEmpty());
        assertTrue(QueryParams.parseFiniteDouble("abc").isEmpty());
    }

    @Test
    void positiveIntFallsBackToDefault() {
        assertEquals(3, QueryParams.parsePositiveInt("3", 1));
        assertEquals(1, QueryParams.parsePositiveInt("0", 1));
        assertEquals(1, QueryParams.parsePositiveInt("-2", 1));
        assertEquals(20, QueryParams.parsePositiveInt("lots", 20));
    }

    @Test
    void containsPatternEscapesWildcards() {
        assertEquals("%ann%", QueryParams.containsPattern("Ann"));
        assertEquals("%50\\%\\_off%", QueryParams.containsPattern("50%_off"));
    }
}
