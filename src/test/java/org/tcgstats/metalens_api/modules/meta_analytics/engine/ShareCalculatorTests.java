package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.junit.jupiter.api.Test;
import org.tcgstats.metalens_api.modules.meta_analytics.model.ArchetypeRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.ShareResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaFixtures.DATE;
import static org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaFixtures.decks;

class ShareCalculatorTests {

    @Test
    void sharesArePercentagesOfAllDecklists() {
        List<ArchetypeRow> rows = new ArrayList<>();
        rows.addAll(decks(1, "Esper Control", "WUB", "control", 3));
        rows.addAll(decks(2, "Domain Ramp", "WUBRG", "ramp", 1));
        rows.addAll(decks(3, "Boros Aggro", "RW", "aggro", 1));

        var results = ShareCalculator.calculate(rows);
        Map<Long, ShareResult> byId = results.stream()
                .collect(Collectors.toMap(ShareResult::archetypeId, r -> r));

        assertEquals(3, results.size());
        assertEquals(60.0, byId.get(1L).metaShare(), 1e-9);
        assertEquals(20.0, byId.get(2L).metaShare(), 1e-9);
        assertEquals(20.0, byId.get(3L).metaShare(), 1e-9);
        assertEquals(3, byId.get(1L).sampleSize());
        assertEquals(100.0, results.stream().mapToDouble(ShareResult::metaShare).sum(), 1e-9);
    }

    @Test
    void displayFieldsComeFromFirstRowOfArchetype() {
        var rows = List.of(
                new ArchetypeRow(7, "Izzet Prowess", "UR", "aggro", DATE),
                new ArchetypeRow(7, "Izzet Tempo", "UR", "aggro", DATE));

        var result = ShareCalculator.calculate(rows).get(0);

        assertEquals("Izzet Prowess", result.mainTitle());
        assertEquals(100.0, result.metaShare(), 1e-9);
    }

    @Test
    void missingColorIdentityIsCarriedThrough() {
        var result = ShareCalculator.calculate(List.of(new ArchetypeRow(4, "Eldrazi", null, "ramp", DATE))).get(0);

        assertNull(result.colorIdentity());
    }

    @Test
    void emptyInput_yieldsEmptyResult() {
        assertTrue(ShareCalculator.calculate(List.of()).isEmpty());
    }
}
