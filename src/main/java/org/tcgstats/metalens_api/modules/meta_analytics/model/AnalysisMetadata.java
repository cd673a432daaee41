package org.tcgstats.metalens_api.modules.meta_analytics.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Describes what a response was computed over.
 *
 * @param format         tournament format
 * @param currentPeriod  the analysed period (the only one for single-window operations)
 * @param previousPeriod the comparison period, absent for single-window operations
 * @param generatedAt    when the response was computed
 */
public record AnalysisMetadata(
        String format,
        TimePeriod currentPeriod,
        @Nullable TimePeriod previousPeriod,
        Instant generatedAt
) {}
