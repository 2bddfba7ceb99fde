package com.wingz.api.ride.service.filter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lenient parsing of optional query parameters. Anything unparseable comes back empty and
 * the caller drops the corresponding constraint.
 */
public final class QueryParams {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes");
    private static final char LIKE_ESCAPE = '\\';

    private QueryParams() {
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * ISO-8601 timestamp. A trailing {@code Z} means {@code +00:00}; timestamps without an offset
     * and plain dates are read as UTC.
     */
    public static Optional<ZonedDateTime> parseTimestamp(String value) {
        String candidate = trimToNull(value);
        if (candidate == null) {
            return Optional.empty();
        }
        if (candidate.endsWith("Z")) {
            candidate = candidate.substring(0, candidate.length() - 1) + "+00:00";
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(candidate, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).atZoneSameInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDateTime) parsed).atZone(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return parseDate(candidate);
        }
    }

    private static Optional<ZonedDateTime> parseDate(String candidate) {
        try {
            return Optional.of(LocalDate.parse(candidate).atStartOfDay(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean parseBoolean(String value) {
        return value != null && TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    public static Optional<Long> parseLong(String value) {
        String candidate = trimToNull(value);
        if (candidate == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(candidate));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * A finite double, so NaN and infinities never reach a computation.
     */
    public static Optional<Double> parseFiniteDouble(String value) {
        String candidate = trimToNull(value);
        if (candidate == null) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(candidate);
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static int parsePositiveInt(String value, int defaultValue) {
        return parseLong(value)
                .filter(parsed -> parsed > 0 && parsed <= Integer.MAX_VALUE)
                .map(Long::intValue)
                .orElse(defaultValue);
    }

    /**
     * A lower-cased {@code %term%} pattern with LIKE wildcards escaped.
     */
    public static String containsPattern(String term) {
        String lowered = term.toLowerCase(Locale.ROOT);
        StringBuilder pattern = new StringBuilder("%");
        for (char c : lowered.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }

    public static char likeEscape() {
        return LIKE_ESCAPE;
    }
}
