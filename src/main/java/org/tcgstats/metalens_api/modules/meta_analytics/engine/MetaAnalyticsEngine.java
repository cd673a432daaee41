package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tcgstats.metalens_api.modules.meta_analytics.model.AnalysisMetadata;
import org.tcgstats.metalens_api.modules.meta_analytics.model.FormatArchetype;
import org.tcgstats.metalens_api.modules.meta_analytics.model.FormatArchetypesResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchupMatrixResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.RankingRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.RankingsResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.ShareResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass meta analytics pipelines: resolve periods, fetch rows, reduce, merge, filter,
 * group, sort and attach metadata.
 * <p>
 * Holds no mutable state; concurrent calls share nothing but the row source and the clock.
 * Validation failures surface before the row source is touched. Row source failures propagate.
 */
@NullMarked
public final class MetaAnalyticsEngine {

    private static final Logger log = LoggerFactory.getLogger(MetaAnalyticsEngine.class);

    static final Comparator<RankingRow> BY_CURRENT_META_SHARE = Comparator
            .comparingDouble(RankingRow::metaShareCurrent).reversed()
            .thenComparing(RankingRow::mainTitle)
            .thenComparing(row -> Objects.toString(row.colorIdentity(), ""))
            .thenComparing(row -> Objects.toString(row.strategy(), ""));

    static final Comparator<FormatArchetype> BY_META_SHARE = Comparator
            .comparingDouble(FormatArchetype::metaShare).reversed()
            .thenComparing(FormatArchetype::name);

    private final MetaRowSource rowSource;
    private final Clock clock;
    private final WinRateCalculator winRateCalculator;
    private final MatchupMatrixCalculator matchupMatrixCalculator;

    public MetaAnalyticsEngine(MetaRowSource rowSource, Clock clock) {
        this(rowSource, clock, WinRateCalculator.DEFAULT_MIN_MATCHES);
    }

    public MetaAnalyticsEngine(MetaRowSource rowSource, Clock clock, int minMatches) {
        this.rowSource = rowSource;
        this.clock = clock;
        this.winRateCalculator = new WinRateCalculator(minMatches);
        this.matchupMatrixCalculator = new MatchupMatrixCalculator(minMatches);
    }

    /**
     * Archetypes of the current period ranked by meta share, each compared with the previous period.
     *
     * @throws MetaValidationException when the periods are malformed or overlap
     */
    public RankingsResult rankings(RankingsQuery query) {
        var now = clock.instant();
        var windows = TimeWindowCalculator.resolve(now, query);
        log.info("Computing archetype rankings for {}: current [{}, {}), previous [{}, {})",
                query.format(), windows.current().start(), windows.current().end(),
                windows.previous().start(), windows.previous().end());

        var currentDecks = rowSource.fetchArchetypeRows(query.format(), windows.current());
        var previousDecks = rowSource.fetchArchetypeRows(query.format(), windows.previous());
        var currentMatches = rowSource.fetchMatchRows(query.format(), windows.current());
        var previousMatches = rowSource.fetchMatchRows(query.format(), windows.previous());

        if (log.isDebugEnabled()) {
            log.debug("Fetched {} / {} decklists and {} / {} matches (current / previous) for {}",
                    currentDecks.size(), previousDecks.size(),
                    currentMatches.size(), previousMatches.size(), query.format());
        }

        var merged = PeriodMerger.merge(
                ShareCalculator.calculate(currentDecks),
                ShareCalculator.calculate(previousDecks),
                winRateCalculator.calculate(currentMatches),
                winRateCalculator.calculate(previousMatches));

        var rows = FilterGroupEngine.apply(merged, query.colorIdentity(), query.strategy(), query.groupBy())
                .stream()
                .sorted(BY_CURRENT_META_SHARE)
                .toList();

        log.info("Ranked {} rows for {} ({} archetypes before filtering)", rows.size(), query.format(), merged.size());
        return new RankingsResult(rows,
                new AnalysisMetadata(query.format(), windows.current(), windows.previous(), now));
    }

    /**
     * Head-to-head table of every archetype pair that met in the last {@code days} days.
     */
    public MatchupMatrixResult matchupMatrix(String format, int days) {
        requireFormat(format);
        var now = clock.instant();
        var period = TimeWindowCalculator.single(now, days);
        log.info("Computing matchup matrix for {} over [{}, {})", format, period.start(), period.end());

        var matches = rowSource.fetchMatchRows(format, period);
        var matrix = matchupMatrixCalculator.calculate(matches);
        var archetypes = matrix.keySet().stream().sorted().toList();

        log.info("Matchup matrix for {} covers {} archetypes from {} matches", format, archetypes.size(), matches.size());
        return new MatchupMatrixResult(matrix, archetypes, new AnalysisMetadata(format, period, null, now));
    }

    /**
     * Every archetype seen in the last {@code days} days with its deck count and meta share.
     */
    public FormatArchetypesResult formatArchetypes(String format, int days) {
        requireFormat(format);
        var now = clock.instant();
        var period = TimeWindowCalculator.single(now, days);

        var shares = ShareCalculator.calculate(rowSource.fetchArchetypeRows(format, period));
        List<FormatArchetype> archetypes = new ArrayList<>(shares.size());
        for (ShareResult share : shares) {
            archetypes.add(new FormatArchetype(share.archetypeId(), share.mainTitle(), share.colorIdentity(),
                    share.strategy(), share.sampleSize(), share.metaShare()));
        }
        archetypes.sort(BY_META_SHARE);

        log.info("Found {} archetypes for {} over the last {} days", archetypes.size(), format, days);
        return new FormatArchetypesResult(List.copyOf(archetypes), new AnalysisMetadata(format, period, null, now));
    }

    private static void requireFormat(String format) {
        if (format == null || format.isBlank()) {
            throw new MetaValidationException("format must not be blank");
        }
    }
}
