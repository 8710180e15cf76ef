package io.nooa.core.cron;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Intervals ({@code 30s}, {@code 5m}, {@code 6h}, {@code 1d}, at most {@link #MAX_INTERVAL}), {@code @hourly},
 * {@code @daily} and one-shot ISO-8601 instants with an optional {@code at } prefix. Anything else
 * falls back to one minute.
 */
public final class ScheduleCalculator {
    public static final Duration FALLBACK_INTERVAL = Duration.ofSeconds(60);
    public static final Duration MAX_INTERVAL = Duration.ofDays(36_500);

    private static final Pattern INTERVAL_PATTERN = Pattern.compile("^(\\d+)([smhd])$", Pattern.CASE_INSENSITIVE);
    private static final String AT_PREFIX = "at ";

    private ScheduleCalculator() {
    }

    public static Instant computeNextRun(String schedule, Instant from) {
        Optional<Instant> oneShot = oneShotInstant(schedule);
        if (oneShot.isPresent()) {
            return oneShot.get();
        }
        Duration interval = interval(schedule).orElse(FALLBACK_INTERVAL);
        try {
            return from.plus(interval);
        } catch (DateTimeException | ArithmeticException e) {
            return from.plus(FALLBACK_INTERVAL);
        }
    }

    public static boolean isDue(Instant now, String nextRunAt) {
        return parseInstant(nextRunAt)
            .map(next -> !next.isAfter(now))
            .orElse(false);
    }

    public static boolean isOneShot(String schedule) {
        return oneShotInstant(schedule).isPresent();
    }

    public static boolean isValid(String schedule) {
        if (isOneShot(schedule)) {
            return true;
        }
        return interval(schedule).map(value -> !value.isZero()).orElse(false);
    }

    public static Optional<Duration> interval(String schedule) {
        if (schedule == null) {
            return Optional.empty();
        }
        String trimmed = schedule.trim();
        Matcher matcher = INTERVAL_PATTERN.matcher(trimmed);
        if (matcher.matches()) {
            long unitSeconds = switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
                case "s" -> 1;
                case "m" -> 60;
                case "h" -> 3_600;
                default -> 86_400;
            };
            try {
                Duration interval = Duration.ofSeconds(Math.multiplyExact(Long.parseLong(matcher.group(1)), unitSeconds));
                return interval.compareTo(MAX_INTERVAL) > 0 ? Optional.empty() : Optional.of(interval);
            } catch (NumberFormatException | ArithmeticException e) {
                return Optional.empty();
            }
        }
        if ("@hourly".equals(trimmed)) {
            return Optional.of(Duration.ofHours(1));
        }
        if ("@daily".equals(trimmed)) {
            return Optional.of(Duration.ofDays(1));
        }
        return Optional.empty();
    }

    public static Optional<Instant> oneShotInstant(String schedule) {
        if (schedule == null) {
            return Optional.empty();
        }
        String trimmed = schedule.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith(AT_PREFIX)) {
            trimmed = trimmed.substring(AT_PREFIX.length()).trim();
        }
        return parseInstant(trimmed);
    }

    public static Optional<Instant> parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(raw.trim()));
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }
}
