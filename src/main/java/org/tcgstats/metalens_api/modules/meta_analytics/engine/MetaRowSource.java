package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.tcgstats.metalens_api.modules.meta_analytics.model.ArchetypeRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.TimePeriod;

import java.util.List;

/**
 * Supplies already-filtered rows for one format and one half-open period.
 * <p>
 * Failures are propagated to the caller untouched; the engine neither catches nor retries them.
 */
public interface MetaRowSource {

    /**
     * Every decklist of the format whose tournament started inside {@code period}.
     */
    List<ArchetypeRow> fetchArchetypeRows(String format, TimePeriod period);

    /**
     * Every decided match of the format whose tournament started inside {@code period}.
     */
    List<MatchRow> fetchMatchRows(String format, TimePeriod period);
}
