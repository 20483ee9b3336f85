package com.inventorysense.engine.trend;

import com.inventorysense.common.DatasetColumns;
import com.inventorysense.engine.aggregate.DistributorQuarterAggregator;
import com.inventorysense.engine.errors.DataNotFoundException;
import com.inventorysense.engine.model.ComparisonRow;
import com.inventorysense.engine.model.DistributorQuarterAggregate;
import com.inventorysense.engine.model.DistributorTrend;
import com.inventorysense.engine.model.QuarterComparison;
import com.inventorysense.engine.model.RiskStatus;
import com.inventorysense.engine.model.TopRiskyDistributor;
import com.inventorysense.engine.model.TrendDirection;
import com.inventorysense.engine.model.YearQuarter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.inventorysense.engine.TestRecords.wasteRecord;
import static org.junit.jupiter.api.Assertions.*;

class TrendEngineTest {

    private final TrendEngine engine = new TrendEngine(3);

    private List<DistributorQuarterAggregate> table;

    @BeforeEach
    void setUp() {
        table = new DistributorQuarterAggregator().aggregate(DatasetColumns.REQUIRED, List.of(
            wasteRecord(1, "Texas", "Jan-23", 40, 100),
            wasteRecord(1, "Texas", "Apr-23", 130, 100),
            wasteRecord(2, "Texas", "Jan-23", 250, 100),
            wasteRecord(3, "Texas", "Apr-23", 210, 100),
            wasteRecord(4, "Ohio", "Jan-23", 10, 100)));
    }

    // ==========================================
    // Distributor trend
    // ==========================================

    @Test
    void testDistributorTrend() {
        DistributorTrend trend = engine.distributorTrend(table, 1);

        assertEquals(1, trend.distributorId());
        assertEquals(2, trend.trend().size());
        assertEquals(YearQuarter.parse("2023 Q1"), trend.trend().get(0).quarter());
        assertNull(trend.trend().get(0).pctChange());
        assertEquals(130.0, trend.trend().get(1).waste());
        assertEquals(225.0, trend.trend().get(1).pctChange());
    }

    @Test
    void testDistributorTrendNotFound() {
        assertThrows(DataNotFoundException.class, () -> engine.distributorTrend(table, 99));
    }

    // ==========================================
    // Quarter comparison
    // ==========================================

    @Test
    void testCompareQuartersOuterJoin() {
        // Given distributor 3 has no row in the first quarter
        QuarterComparison result = engine.compareQuarters(table, "Texas", "2023 Q1", "2023 Q2", List.of(1, 3));

        // Then both distributors appear, with the missing side kept as null
        assertEquals(2, result.comparison().size());

        ComparisonRow first = result.comparison().get(0);
        assertEquals(1, first.distributorId());
        assertEquals(40.0, first.totalWasteQ1());
        assertEquals(130.0, first.totalWasteQ2());
        assertEquals(90.0, first.delta());
        assertEquals(TrendDirection.UP, first.trend());
        assertEquals("Very Good → Very Good", first.statusChange());

        ComparisonRow second = result.comparison().get(1);
        assertEquals(3, second.distributorId());
        assertNull(second.totalWasteQ1());
        assertEquals(210.0, second.delta());
        assertEquals("Unknown → Risk", second.statusChange());
    }

    @Test
    void testCompareQuartersMissingSecondQuarter() {
        QuarterComparison result = engine.compareQuarters(table, "Texas", "2023 Q1", "2023 Q2", List.of(2, 1));

        // Ascending distributor order regardless of request order
        assertEquals(1, result.comparison().get(0).distributorId());

        ComparisonRow row = result.comparison().get(1);
        assertEquals(2, row.distributorId());
        assertNull(row.totalWasteQ2());
        assertEquals(-250.0, row.delta());
        assertEquals(TrendDirection.DOWN, row.trend());
        assertEquals("⬇️ 🟢", row.trendArrow());
        assertEquals("High Risk → Unknown", row.statusChange());
    }

    @Test
    void testSameQuarterComparesRowsToThemselves() {
        QuarterComparison result = engine.compareQuarters(table, "Texas", "2023 Q1", "2023 2023Q1", List.of(1, 2));

        assertEquals(2, result.comparison().size());
        for (ComparisonRow row : result.comparison()) {
            assertEquals(0.0, row.delta());
            assertEquals(TrendDirection.FLAT, row.trend());
            assertEquals(row.totalWasteQ1(), row.totalWasteQ2());
        }
        assertEquals("High Risk → High Risk", result.comparison().get(1).statusChange());
    }

    @Test
    void testCompareQuartersEmptyJoin() {
        QuarterComparison result = engine.compareQuarters(table, "Texas", "2023 Q3", "2023 Q4", List.of(1));

        assertTrue(result.comparison().isEmpty());
    }

    @Test
    void testCompareQuartersUnknownState() {
        assertThrows(DataNotFoundException.class,
            () -> engine.compareQuarters(table, "Nevada", "2023 Q1", "2023 Q2", List.of(1)));
    }

    @Test
    void testCompareQuartersRejectsBadInput() {
        assertThrows(IllegalArgumentException.class,
            () -> engine.compareQuarters(table, "Texas", "Q1 2023", "2023 Q2", List.of(1)));
        assertThrows(IllegalArgumentException.class,
            () -> engine.compareQuarters(table, "Texas", "2023 Q1", "2023 Q5", List.of(1)));
        assertThrows(IllegalArgumentException.class,
            () -> engine.compareQuarters(table, "Texas", "2023 Q1", "2023 Q2", List.of()));
    }

    // ==========================================
    // Top risky
    // ==========================================

    @Test
    void testTopRisky() {
        List<TopRiskyDistributor> top = engine.topRisky(table);

        assertEquals(3, top.size());
        assertEquals(2, top.get(0).distributorId());
        assertEquals(150.0, top.get(0).riskPct());
        assertEquals(RiskStatus.HIGH_RISK, top.get(0).status());
        assertEquals(3, top.get(1).distributorId());
        assertEquals(1, top.get(2).distributorId());
        assertEquals(YearQuarter.parse("2023 Q2"), top.get(2).quarter());
    }

    @Test
    void testTopRiskyTiesKeepTableOrder() {
        List<DistributorQuarterAggregate> tied = new DistributorQuarterAggregator().aggregate(DatasetColumns.REQUIRED, List.of(
            wasteRecord(6, "Texas", "Jan-23", 40, 30),
            wasteRecord(5, "Texas", "Jan-23", 40, 30)));

        List<TopRiskyDistributor> top = new TrendEngine(5).topRisky(tied);

        assertEquals(List.of(5, 6), top.stream().map(TopRiskyDistributor::distributorId).toList());
        assertEquals(33.3, top.get(0).riskPct());
    }
}
