package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.tcgstats.metalens_api.modules.meta_analytics.model.TimePeriod;

import java.time.Duration;
import java.time.Instant;

/**
 * Derives absolute analysis periods from day counts relative to a reference instant.
 *
 * <pre>
 *   previous_start          previous_end = current_start          current_end = now
 *        |------ previousDays ------|------------ currentDays ------------|
 * </pre>
 *
 * Both periods are half-open. Explicit previous offsets may leave a gap before the current
 * period but may never reach into it.
 */
public final class TimeWindowCalculator {

    private TimeWindowCalculator() {}

    /**
     * Current period ending at {@code now}, previous period immediately before it.
     */
    public static TimeWindows contiguous(Instant now, int currentDays, int previousDays) {
        requirePositive("current_days", currentDays);
        requirePositive("previous_days", previousDays);
        var current = TimePeriod.endingAt(now, currentDays);
        var previous = TimePeriod.endingAt(current.start(), previousDays);
        return new TimeWindows(current, previous);
    }

    /**
     * Current period ending at {@code now}, previous period spanning
     * {@code [now - previousStartDays, now - previousEndDays)}.
     *
     * @throws MetaValidationException when the previous period is empty, inverted or overlaps the current one
     */
    public static TimeWindows explicit(Instant now, int currentDays, int previousStartDays, int previousEndDays) {
        requirePositive("current_days", currentDays);
        if (previousEndDays < 0) {
            throw new MetaValidationException(
                    "previous_end_days must not be negative, got %d".formatted(previousEndDays));
        }
        if (previousStartDays <= previousEndDays) {
            throw new MetaValidationException(
                    "previous_start_days (%d) must be greater than previous_end_days (%d)"
                            .formatted(previousStartDays, previousEndDays));
        }
        var current = TimePeriod.endingAt(now, currentDays);
        var previousEnd = now.minus(Duration.ofDays(previousEndDays));
        var previous = TimePeriod.endingAt(previousEnd, previousStartDays - previousEndDays);
        if (previous.overlaps(current)) {
            throw new MetaValidationException(
                    "Previous period [%s, %s) overlaps current period [%s, %s): previous_end_days (%d) must be at least current_days (%d)"
                            .formatted(previous.start(), previous.end(), current.start(), current.end(),
                                    previousEndDays, currentDays));
        }
        return new TimeWindows(current, previous);
    }

    /**
     * Resolves the periods of a ranking request, honouring explicit previous offsets when present.
     */
    public static TimeWindows resolve(Instant now, RankingsQuery query) {
        if (!query.hasExplicitPreviousPeriod()) {
            return contiguous(now, query.currentDays(), query.previousDays());
        }
        if (query.previousEndDays() == null) {
            throw new MetaValidationException("previous_start_days requires previous_end_days");
        }
        int endDays = query.previousEndDays();
        int startDays = query.previousStartDays() != null
                ? query.previousStartDays()
                : startAfter(endDays, requirePositive("previous_days", query.previousDays()));
        return explicit(now, query.currentDays(), startDays, endDays);
    }

    /**
     * Single period of {@code days} ending at {@code now}.
     */
    public static TimePeriod single(Instant now, int days) {
        requirePositive("days", days);
        return TimePeriod.endingAt(now, days);
    }

    private static int startAfter(int endDays, int previousDays) {
        try {
            return Math.addExact(endDays, previousDays);
        } catch (ArithmeticException e) {
            throw new MetaValidationException(
                    "previous_end_days (%d) plus previous_days (%d) is out of range".formatted(endDays, previousDays));
        }
    }

    private static int requirePositive(String name, int days) {
        if (days <= 0) {
            throw new MetaValidationException("%s must be positive, got %d".formatted(name, days));
        }
        return days;
    }
}
