package com.inventorysense.engine.correlation;

import com.inventorysense.engine.errors.InsufficientDataException;
import com.inventorysense.engine.model.FeatureImportance;
import com.inventorysense.engine.model.RootCauseReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RootCauseAnalyzerTest {

    private final RootCauseAnalyzer analyzer = new RootCauseAnalyzer(5);

    @Test
    void testContributionsRenormalizedAndRanked() {
        // Given unsorted importances
        List<FeatureImportance> importances = List.of(
            new FeatureImportance("Returns_Quantity", 0.2),
            new FeatureImportance("Deliveries_Quantity", 0.5),
            new FeatureImportance("Storage_Days", 0.3));

        // When analyzing
        RootCauseReport report = analyzer.analyze(importances);

        // Then contributions are percentages in descending order
        assertEquals(List.of("Deliveries_Quantity", "Storage_Days", "Returns_Quantity"),
            report.topFactors().stream().map(RootCauseReport.FactorContribution::feature).toList());
        assertEquals(50.0, report.topFactors().get(0).contributionPct());
        assertEquals(30.0, report.topFactors().get(1).contributionPct());
        assertEquals(20.0, report.topFactors().get(2).contributionPct());

        assertEquals("Deliveries_Quantity", report.primaryCause().feature());
        assertEquals(RootCauseAnalyzer.PRIMARY_REASON, report.primaryCause().reason());
        assertEquals(2, report.secondaryDrivers().size());
        assertEquals("Storage_Days", report.secondaryDrivers().get(0).feature());
        assertEquals(RootCauseAnalyzer.RECOMMENDED_ACTIONS, report.recommendedActions());
    }

    @Test
    void testTopFactorsLimited() {
        List<FeatureImportance> importances = List.of(
            new FeatureImportance("a", 6),
            new FeatureImportance("b", 5),
            new FeatureImportance("c", 4),
            new FeatureImportance("d", 3),
            new FeatureImportance("e", 2),
            new FeatureImportance("f", 1));

        RootCauseReport report = analyzer.analyze(importances);

        assertEquals(5, report.topFactors().size());
        // Shares are against the full total, not the listed factors
        assertEquals(28.57, report.topFactors().get(0).contributionPct());
    }

    @Test
    void testSingleFeatureHasNoSecondaryDrivers() {
        RootCauseReport report = analyzer.analyze(List.of(new FeatureImportance("only", 0.4)));

        assertEquals(100.0, report.topFactors().get(0).contributionPct());
        assertTrue(report.secondaryDrivers().isEmpty());
    }

    @Test
    void testMissingImportancesAreInsufficient() {
        assertThrows(InsufficientDataException.class, () -> analyzer.analyze(List.of()));
        assertThrows(InsufficientDataException.class, () -> analyzer.analyze(null));
        assertThrows(InsufficientDataException.class,
            () -> analyzer.analyze(List.of(new FeatureImportance("zero", 0))));
    }
}
