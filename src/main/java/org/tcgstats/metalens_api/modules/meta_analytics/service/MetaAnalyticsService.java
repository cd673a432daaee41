package org.tcgstats.metalens_api.modules.meta_analytics.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tcgstats.metalens_api.modules.meta_analytics.config.MetaAnalyticsProperties;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaAnalyticsEngine;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaValidationException;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.RankingsQuery;
import org.tcgstats.metalens_api.modules.meta_analytics.model.FormatArchetypesResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchupMatrixResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.RankingsResult;

import java.util.Optional;

/**
 * Entry point for callers of the meta analytics engine.
 * <p>
 * Enforces the configured period cap and reports "no data in window" as an empty
 * {@link Optional} rather than an error.
 */
@Service
@NullMarked
public class MetaAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(MetaAnalyticsService.class);

    private final MetaAnalyticsEngine engine;
    private final MetaAnalyticsProperties properties;

    public MetaAnalyticsService(MetaAnalyticsEngine engine, MetaAnalyticsProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    public Optional<RankingsResult> rankings(RankingsQuery query) {
        requireWithinCap("current_days", query.currentDays());
        requireWithinCap("previous_days", query.previousDays());
        requireWithinCap("previous_start_days", query.previousStartDays());
        requireWithinCap("previous_end_days", query.previousEndDays());

        var result = engine.rankings(query);
        if (result.isEmpty()) {
            log.info("No archetype data for {} in the current period", query.format());
            return Optional.empty();
        }
        return Optional.of(result);
    }

    public Optional<MatchupMatrixResult> matchupMatrix(String format, int days) {
        requireWithinCap("days", days);

        var result = engine.matchupMatrix(format, days);
        if (result.isEmpty()) {
            log.info("No matchup data for {} in the last {} days", format, days);
            return Optional.empty();
        }
        return Optional.of(result);
    }

    public FormatArchetypesResult formatArchetypes(String format, int days) {
        requireWithinCap("days", days);
        return engine.formatArchetypes(format, days);
    }

    private void requireWithinCap(String name, @Nullable Integer days) {
        if (days != null && days > properties.maxDays()) {
            throw new MetaValidationException(
                    "%s must be at most %d, got %d".formatted(name, properties.maxDays(), days));
        }
    }
}
