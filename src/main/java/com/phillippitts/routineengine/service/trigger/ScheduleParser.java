package com.phillippitts.routineengine.service.trigger;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text schedule into a fixed repeat interval.
 *
 * <p>Recognised (case-insensitive, anywhere in the text, first match wins in this order):
 * {@code every hour}, {@code every day} / {@code daily}, {@code every week} / {@code weekly},
 * {@code every N minute(s)} and {@code every N hour(s)}. Clock times such as "at 8:00" are not interpreted; a daily schedule
 * repeats every 24 hours from registration.
 */
public final class ScheduleParser {

    private static final Pattern EVERY_N_MINUTES = Pattern.compile("every\\s+(\\d+)\\s+minutes?");
    private static final Pattern EVERY_N_HOURS = Pattern.compile("every\\s+(\\d+)\\s+hours?");

    private ScheduleParser() {}

    /**
     * @return the repeat interval, or empty when the text is not understood or the count is zero
     */
    public static Optional<Duration> parse(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            return Optional.empty();
        }
        String s = schedule.toLowerCase(Locale.ROOT);

        if (s.contains("every hour")) {
            return Optional.of(Duration.ofHours(1));
        }
        if (s.contains("every day") || s.contains("daily")) {
            return Optional.of(Duration.ofDays(1));
        }
        if (s.contains("every week") || s.contains("weekly")) {
            return Optional.of(Duration.ofDays(7));
        }
        Matcher minutes = EVERY_N_MINUTES.matcher(s);
        if (minutes.find()) {
            return every(minutes.group(1), ChronoUnit.MINUTES);
        }
        Matcher hours = EVERY_N_HOURS.matcher(s);
        if (hours.find()) {
            return every(hours.group(1), ChronoUnit.HOURS);
        }
        return Optional.empty();
    }

    /**
     * Counts whose period would not fit in a long of milliseconds count as not understood.
     */
    private static Optional<Duration> every(String digits, ChronoUnit unit) {
        long unitMillis = unit.getDuration().toMillis();
        return positive(digits)
                .filter(n -> n <= Long.MAX_VALUE / unitMillis)
                .map(n -> Duration.of(n, unit));
    }

    private static Optional<Long> positive(String digits) {
        try {
            long n = Long.parseLong(digits);
            return n > 0 ? Optional.of(n) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
