package org.tcgstats.metalens_api.modules.meta_analytics.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open analysis period {@code [start, end)}.
 *
 * @param days  length of the period in whole days
 * @param start inclusive lower bound
 * @param end   exclusive upper bound
 */
public record TimePeriod(int days, Instant start, Instant end) {

    public TimePeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Period start %s must precede end %s".formatted(start, end));
        }
    }

    public static TimePeriod endingAt(Instant end, int days) {
        return new TimePeriod(days, end.minus(Duration.ofDays(days)), end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean overlaps(TimePeriod other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }
}
