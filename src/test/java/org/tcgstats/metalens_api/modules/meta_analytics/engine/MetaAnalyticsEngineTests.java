package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.tcgstats.metalens_api.modules.meta_analytics.model.ArchetypeRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.RankingRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.TimePeriod;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaFixtures.decks;
import static org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaFixtures.match;

class MetaAnalyticsEngineTests {

    private static final Instant NOW = Instant.parse("2024-10-15T12:00:00Z");

    MetaRowSource rowSource;
    Clock clock;

    MetaAnalyticsEngine engine;

    TimeWindows windows;

    @BeforeEach
    void setUp() {
        rowSource = mock(MetaRowSource.class);
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        engine = new MetaAnalyticsEngine(rowSource, clock);
        windows = TimeWindowCalculator.contiguous(NOW, 14, 14);
    }

    private void stubCurrent(List<ArchetypeRow> decks, List<MatchRow> matches) {
        when(rowSource.fetchArchetypeRows("Standard", windows.current())).thenReturn(decks);
        when(rowSource.fetchMatchRows("Standard", windows.current())).thenReturn(matches);
    }

    private void stubPrevious(List<ArchetypeRow> decks, List<MatchRow> matches) {
        when(rowSource.fetchArchetypeRows("Standard", windows.previous())).thenReturn(decks);
        when(rowSource.fetchMatchRows("Standard", windows.previous())).thenReturn(matches);
    }

    private static List<ArchetypeRow> currentDecks() {
        List<ArchetypeRow> rows = new ArrayList<>();
        rows.addAll(decks(1, "Esper Control", "WUB", "control", 3));
        rows.addAll(decks(2, "Domain Ramp", "WUBRG", "ramp", 1));
        rows.addAll(decks(3, "Boros Aggro", "RW", "aggro", 1));
        return rows;
    }

    @Test
    void rankings_sortsByCurrentShare_andComparesWithPrevious() {
        stubCurrent(currentDecks(), List.of(
                match(1, "Esper Control", 3, "Boros Aggro", true),
                match(1, "Esper Control", 3, "Boros Aggro", true),
                match(3, "Boros Aggro", 1, "Esper Control", true)));
        stubPrevious(decks(1, "Esper Control", "WUB", "control", 2), List.of());

        var result = engine.rankings(RankingsQuery.of("Standard", 14, 14));

        var rows = result.rows();
        assertEquals(List.of("Esper Control", "Boros Aggro", "Domain Ramp"),
                rows.stream().map(RankingRow::mainTitle).toList());
        var esper = rows.get(0);
        assertEquals(60.0, esper.metaShareCurrent(), 1e-9);
        assertEquals(100.0, esper.metaSharePrevious(), 1e-9);
        assertEquals(200.0 / 3, esper.winRateCurrent(), 1e-9);
        assertNull(esper.winRatePrevious());
        assertNull(rows.get(2).metaSharePrevious());
        assertNull(rows.get(2).matchCountCurrent());
    }

    @Test
    void rankings_metadataDescribesBothPeriods() {
        stubCurrent(currentDecks(), List.of());
        stubPrevious(List.of(), List.of());

        var metadata = engine.rankings(RankingsQuery.of("Standard", 14, 14)).metadata();

        assertEquals("Standard", metadata.format());
        assertEquals(windows.current(), metadata.currentPeriod());
        assertEquals(windows.previous(), metadata.previousPeriod());
        assertEquals(NOW, metadata.generatedAt());
        assertEquals(NOW.minus(Duration.ofDays(28)), metadata.previousPeriod().start());
    }

    @Test
    void rankings_emptyCurrentPeriod_yieldsEmptyResult() {
        stubCurrent(List.of(), List.of());
        stubPrevious(currentDecks(), List.of());

        assertTrue(engine.rankings(RankingsQuery.of("Standard", 14, 14)).isEmpty());
    }

    @Test
    void rankings_filterAndGroupApplyAfterMerge() {
        stubCurrent(currentDecks(), List.of());
        stubPrevious(List.of(), List.of());

        var query = RankingsQuery.of("Standard", 14, 14).withGroupBy(GroupBy.STRATEGY);
        var rows = engine.rankings(query).rows();

        assertEquals(3, rows.size());
        assertTrue(rows.stream().allMatch(RankingRow::grouped));
        assertEquals("control", rows.get(0).strategy());

        var filtered = engine.rankings(RankingsQuery.of("Standard", 14, 14).withFilters("RW", null)).rows();
        assertEquals(1, filtered.size());
        // share stays relative to the whole format
        assertEquals(20.0, filtered.get(0).metaShareCurrent(), 1e-9);
    }

    @Test
    void rankings_tiesAreOrderedByTitle() {
        List<ArchetypeRow> tied = new ArrayList<>();
        tied.addAll(decks(8, "Rakdos Midrange", "BR", "midrange", 1));
        tied.addAll(decks(9, "Azorius Control", "WU", "control", 1));
        stubCurrent(tied, List.of());
        stubPrevious(List.of(), List.of());

        var rows = engine.rankings(RankingsQuery.of("Standard", 14, 14)).rows();

        assertEquals("Azorius Control", rows.get(0).mainTitle());
    }

    @Test
    void rankings_explicitOffsets_fetchTheRequestedPreviousPeriod() {
        when(rowSource.fetchArchetypeRows(eq("Standard"), any())).thenReturn(currentDecks());
        when(rowSource.fetchMatchRows(eq("Standard"), any())).thenReturn(List.of());

        var query = RankingsQuery.of("Standard", 14, 14).withPreviousOffsets(60, 30);
        engine.rankings(query);

        var periods = ArgumentCaptor.forClass(TimePeriod.class);
        verify(rowSource, times(2)).fetchArchetypeRows(eq("Standard"), periods.capture());
        var previous = periods.getAllValues().get(1);
        assertEquals(NOW.minus(Duration.ofDays(60)), previous.start());
        assertEquals(NOW.minus(Duration.ofDays(30)), previous.end());
    }

    @Test
    void rankings_overlappingPeriods_failBeforeAnyFetch() {
        var query = RankingsQuery.of("Standard", 14, 14).withPreviousOffsets(20, 7);

        assertThrows(MetaValidationException.class, () -> engine.rankings(query));
        verifyNoInteractions(rowSource);
    }

    @Test
    void rankings_rowSourceFailure_propagates() {
        when(rowSource.fetchArchetypeRows(anyString(), any())).thenThrow(new IllegalStateException("db down"));

        var ex = assertThrows(IllegalStateException.class,
                () -> engine.rankings(RankingsQuery.of("Standard", 14, 14)));
        assertEquals("db down", ex.getMessage());
    }

    @Test
    void matchupMatrix_listsArchetypesAlphabetically() {
        var period = TimeWindowCalculator.single(NOW, 30);
        when(rowSource.fetchMatchRows("Modern", period)).thenReturn(List.of(
                match(1, "Rakdos Scam", 2, "Amulet Titan", true),
                match(2, "Amulet Titan", 3, "Boros Energy", false)));

        var result = engine.matchupMatrix("Modern", 30);

        assertEquals(List.of("Amulet Titan", "Boros Energy", "Rakdos Scam"), result.archetypes());
        assertEquals(1, result.matrix().get("Rakdos Scam").get("Amulet Titan").matchCount());
        assertNull(result.metadata().previousPeriod());
        assertEquals(period, result.metadata().currentPeriod());
    }

    @Test
    void matchupMatrix_noMatches_yieldsEmptyResult() {
        when(rowSource.fetchMatchRows(anyString(), any())).thenReturn(List.of());

        var result = engine.matchupMatrix("Modern", 30);

        assertTrue(result.isEmpty());
        assertTrue(result.archetypes().isEmpty());
    }

    @Test
    void matchupMatrix_nonPositiveDays_failBeforeAnyFetch() {
        assertThrows(MetaValidationException.class, () -> engine.matchupMatrix("Modern", 0));
        verifyNoInteractions(rowSource);
    }

    @Test
    void formatArchetypes_areOrderedByShare() {
        when(rowSource.fetchArchetypeRows(eq("Standard"), any())).thenReturn(currentDecks());

        var result = engine.formatArchetypes("Standard", 30);

        assertEquals("Esper Control", result.archetypes().get(0).name());
        assertEquals(3, result.archetypes().get(0).deckCount());
        assertEquals(60.0, result.archetypes().get(0).metaShare(), 1e-9);
        assertEquals(30, result.metadata().currentPeriod().days());
    }

    @Test
    void concurrentCalls_produceIdenticalResults() throws Exception {
        when(rowSource.fetchArchetypeRows(eq("Standard"), any())).thenReturn(currentDecks());
        when(rowSource.fetchMatchRows(eq("Standard"), any())).thenReturn(List.of(
                match(1, "Esper Control", 3, "Boros Aggro", true),
                match(1, "Esper Control", 2, "Domain Ramp", false),
                match(2, "Domain Ramp", 3, "Boros Aggro", true)));

        var query = RankingsQuery.of("Standard", 14, 14);
        var expected = engine.rankings(query);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Object>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> engine.rankings(query));
            }
            for (Future<Object> future : pool.invokeAll(calls)) {
                assertEquals(expected, future.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
