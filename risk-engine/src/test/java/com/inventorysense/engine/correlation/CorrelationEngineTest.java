package com.inventorysense.engine.correlation;

import com.inventorysense.engine.errors.InsufficientDataException;
import com.inventorysense.engine.model.CorrelationHeatmap;
import com.inventorysense.engine.model.CorrelationReport;
import com.inventorysense.engine.model.KeyRelationships;
import com.inventorysense.engine.model.RawDataset;
import com.inventorysense.engine.model.Relationship;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationEngineTest {

    private final CorrelationEngine engine = new CorrelationEngine(10);

    /**
     * Build a dataset from columns of equal length; {@code null} cells are left out of the row.
     */
    private static RawDataset columns(Map<String, List<Object>> columns) {
        int size = columns.values().iterator().next().size();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> column : columns.entrySet()) {
                row.put(column.getKey(), column.getValue().get(i));
            }
            rows.add(row);
        }
        return RawDataset.of(rows);
    }

    private static RawDataset xyz() {
        Map<String, List<Object>> data = new LinkedHashMap<>();
        data.put("X", List.of(1, 2, 3, 4, 5));
        data.put("Y", List.of(3, 1, 2, 5, 4));
        data.put("Z", List.of(-3, -1, -2, -5, -4));
        data.put("Name", List.of("a", "b", "c", "d", "e"));
        return columns(data);
    }

    @Test
    void testMatrixIsSymmetricWithUnitDiagonal() {
        CorrelationHeatmap heatmap = engine.analyze(xyz()).heatmap();

        assertEquals(List.of("X", "Y", "Z"), heatmap.features());
        int n = heatmap.features().size();
        for (int i = 0; i < n; i++) {
            assertEquals(1.0, heatmap.value(i, i));
            for (int j = 0; j < n; j++) {
                assertEquals(heatmap.value(i, j), heatmap.value(j, i));
            }
        }
        assertEquals(0.6, heatmap.value(0, 1));
        assertEquals(-0.6, heatmap.value(0, 2));
        assertEquals(-1.0, heatmap.value(1, 2));
    }

    @Test
    void testRelationshipBuckets() {
        KeyRelationships relationships = engine.analyze(xyz()).keyRelationships();

        // Strong holds both orderings of Y/Z
        assertEquals(2, relationships.strong().size());
        assertEquals("Y", relationships.strong().get(0).f1());
        assertEquals("Z", relationships.strong().get(0).f2());
        assertEquals(1.0, relationships.strong().get(0).abs());

        // Moderate excludes the strong pair and keeps generation order on ties
        assertEquals(4, relationships.moderate().size());
        assertEquals("X", relationships.moderate().get(0).f1());
        assertEquals("Y", relationships.moderate().get(0).f2());

        // Inverse is ordered by magnitude and holds only negative values
        List<Relationship> inverse = relationships.inverse();
        assertEquals(4, inverse.size());
        assertEquals(-1.0, inverse.get(0).value());
        assertEquals(-0.6, inverse.get(3).value());
        assertTrue(inverse.stream().allMatch(r -> r.value() <= -0.4));
    }

    @Test
    void testBucketsAreLimited() {
        KeyRelationships relationships = new CorrelationEngine(1).analyze(xyz()).keyRelationships();

        assertEquals(1, relationships.strong().size());
        assertEquals(1, relationships.moderate().size());
        assertEquals(1, relationships.inverse().size());
    }

    @Test
    void testPairwiseCompleteObservations() {
        Map<String, List<Object>> data = new LinkedHashMap<>();
        data.put("A", Arrays.asList(1, 2, null, 4));
        data.put("B", Arrays.asList(2, 4, 100, 8));
        CorrelationReport report = engine.analyze(columns(data));

        assertEquals(1.0, report.heatmap().value(0, 1));
    }

    @Test
    void testConstantColumnYieldsNullCell() {
        Map<String, List<Object>> data = new LinkedHashMap<>();
        data.put("A", List.of(1, 2, 3));
        data.put("B", List.of(2, 4, 7));
        data.put("Flat", List.of(5, 5, 5));
        CorrelationReport report = engine.analyze(columns(data));

        assertNull(report.heatmap().value(0, 2));
        assertNull(report.heatmap().value(2, 1));
        assertEquals(1.0, report.heatmap().value(2, 2));
        assertTrue(report.keyRelationships().strong().stream()
            .noneMatch(r -> r.f1().equals("Flat") || r.f2().equals("Flat")));
    }

    @Test
    void testTextColumnsAreNotNumeric() {
        Map<String, List<Object>> data = new LinkedHashMap<>();
        data.put("A", List.of(1, 2, 3));
        data.put("Text", List.of("1", "2", "3"));

        assertThrows(InsufficientDataException.class, () -> engine.analyze(columns(data)));
    }

    @Test
    void testPearsonAtExtremeMagnitudes() {
        // Sums of squared deviations would overflow past Double.MAX_VALUE
        assertEquals(1.0, CorrelationEngine.pearson(List.of(1e80, 2e80, 3e80), List.of(1e80, 2e80, 3e80)), 1e-9);
        assertEquals(-1.0, CorrelationEngine.pearson(List.of(1e200, 2e200, 3e200), List.of(3e200, 2e200, 1e200)), 1e-9);
    }

    @Test
    void testTinyValuesStayFinite() {
        // Given columns whose squared deviations would underflow to zero
        Map<String, List<Object>> data = new LinkedHashMap<>();
        data.put("A", List.of(1e-160, 2e-160, 3e-160));
        data.put("B", List.of(1e-160, 2e-160, 1e-160));
        data.put("C", List.of(2e-160, 4e-160, 6e-160));

        // When
        CorrelationHeatmap heatmap = engine.analyze(columns(data)).heatmap();

        // Then
        assertEquals(0.0, heatmap.value(0, 1));
        assertEquals(1.0, heatmap.value(0, 2));
        assertEquals(0.0, heatmap.value(1, 2));
    }

    @Test
    void testPearsonUndefinedWithFewerThanTwoPairs() {
        assertNull(CorrelationEngine.pearson(Arrays.asList(1.0, null), Arrays.asList(null, 2.0)));
        assertNull(CorrelationEngine.pearson(List.of(1.0), List.of(2.0)));
    }
}
