package io.caretaker.core.scheduler;

import io.caretaker.core.config.ConfigException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule for a job's next execution time.
 */
public sealed interface Trigger permits Trigger.Interval, Trigger.DailyAt {

    /**
     * First execution time strictly after {@code from}.
     */
    Instant nextRun(Instant from, ZoneId zone);

    String describe();

    static Trigger everyMinutes(long minutes) {
        if (minutes <= 0) {
            throw new ConfigException("interval must be > 0 minutes, got " + minutes);
        }
        return new Interval(Duration.ofMinutes(minutes));
    }

    /**
     * Parses a 24-hour {@code HH:MM} time of day.
     *
     * @throws ConfigException if {@code hhmm} is not a valid time
     */
    static Trigger dailyAt(String hhmm) {
        return new DailyAt(DailyAt.parse(hhmm));
    }

    record Interval(Duration period) implements Trigger {

        public Interval {
            Objects.requireNonNull(period, "period must not be null");
            if (period.isZero() || period.isNegative()) {
                throw new ConfigException("interval must be positive, got " + period);
            }
        }

        @Override
        public Instant nextRun(Instant from, ZoneId zone) {
            return from.plus(period);
        }

        @Override
        public String describe() {
            long minutes = period.toMinutes();
            if (period.equals(Duration.ofMinutes(minutes))) {
                return "every " + minutes + " minute" + (minutes == 1 ? "" : "s");
            }
            return "every " + period.toSeconds() + "s";
        }
    }

    record DailyAt(LocalTime time) implements Trigger {
        private static final Pattern HH_MM = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");

        public DailyAt {
            Objects.requireNonNull(time, "time must not be null");
        }

        static LocalTime parse(String hhmm) {
            if (hhmm == null) {
                throw new ConfigException("daily time is required (HH:MM)");
            }
            Matcher matcher = HH_MM.matcher(hhmm.trim());
            if (!matcher.matches()) {
                throw new ConfigException("invalid daily time '" + hhmm + "', expected HH:MM");
            }
            return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        }

        @Override
        public Instant nextRun(Instant from, ZoneId zone) {
            ZonedDateTime now = from.atZone(zone);
            ZonedDateTime candidate = now.toLocalDate().atTime(time).atZone(zone);
            if (!candidate.isAfter(now)) {
                candidate = now.toLocalDate().plusDays(1).atTime(time).atZone(zone);
            }
            return candidate.toInstant();
        }

        @Override
        public String describe() {
            return "daily at " + time;
        }
    }
}
