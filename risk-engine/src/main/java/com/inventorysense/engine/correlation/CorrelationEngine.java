package com.inventorysense.engine.correlation;

import com.inventorysense.common.AnalyticsConfig;
import com.inventorysense.engine.errors.InsufficientDataException;
import com.inventorysense.engine.model.CorrelationHeatmap;
import com.inventorysense.engine.model.CorrelationReport;
import com.inventorysense.engine.model.KeyRelationships;
import com.inventorysense.engine.model.RawDataset;
import com.inventorysense.engine.model.Relationship;
import com.inventorysense.engine.util.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Pearson correlation over the numeric columns of the raw dataset.
 */
public class CorrelationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    static final double STRONG = 0.75;
    static final double MODERATE = 0.4;

    private final int relationshipLimit;

    public CorrelationEngine() {
        this(AnalyticsConfig.getRelationshipLimit());
    }

    public CorrelationEngine(int relationshipLimit) {
        this.relationshipLimit = relationshipLimit;
    }

    /**
     * @throws InsufficientDataException if fewer than two numeric columns exist
     */
    public CorrelationReport analyze(RawDataset dataset) {
        List<String> features = dataset.numericColumns();
        if (features.size() < 2) {
            throw new InsufficientDataException("Not enough numeric features: " + features.size() + " found, 2 required");
        }

        int n = features.size();
        List<List<Double>> values = new ArrayList<>(n);
        for (String feature : features) {
            values.add(dataset.numericValues(feature));
        }

        Double[][] matrix = new Double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                Double r = Numbers.round(pearson(values.get(i), values.get(j)), 2);
                matrix[i][j] = r;
                matrix[j][i] = r;
            }
        }

        List<List<Double>> rows = new ArrayList<>(n);
        for (Double[] row : matrix) {
            rows.add(Collections.unmodifiableList(Arrays.asList(row)));
        }
        CorrelationHeatmap heatmap = new CorrelationHeatmap(List.copyOf(features), rows);

        LOG.debug("Computed {}x{} correlation matrix", n, n);
        return new CorrelationReport(heatmap, keyRelationships(heatmap));
    }

    /**
     * Bucket every ordered off-diagonal pair. Each unordered pair appears twice, as (i,j) and (j,i).
     */
    KeyRelationships keyRelationships(CorrelationHeatmap heatmap) {
        List<String> features = heatmap.features();
        List<Relationship> relationships = new ArrayList<>();
        for (int i = 0; i < features.size(); i++) {
            for (int j = 0; j < features.size(); j++) {
                Double value = heatmap.value(i, j);
                if (i != j && value != null) {
                    relationships.add(Relationship.of(features.get(i), features.get(j), value));
                }
            }
        }

        return new KeyRelationships(
            top(relationships, r -> r.abs() >= STRONG),
            top(relationships, r -> r.abs() >= MODERATE && r.abs() < STRONG),
            top(relationships, r -> r.value() <= -MODERATE));
    }

    private List<Relationship> top(List<Relationship> relationships, Predicate<Relationship> bucket) {
        return relationships.stream()
            .filter(bucket)
            .sorted(Comparator.comparingDouble(Relationship::abs).reversed())
            .limit(relationshipLimit)
            .toList();
    }

    /**
     * Pairwise-complete Pearson coefficient, {@code null} when undefined.
     */
    static Double pearson(List<Double> x, List<Double> y) {
        int count = 0;
        double sumX = 0;
        double sumY = 0;
        for (int k = 0; k < x.size(); k++) {
            if (x.get(k) != null && y.get(k) != null) {
                count++;
                sumX += x.get(k);
                sumY += y.get(k);
            }
        }
        if (count < 2) {
            return null;
        }
        double meanX = sumX / count;
        double meanY = sumY / count;

        // Deviations are scaled into [-1, 1] so the products stay finite and normal at any magnitude
        double scaleX = 0;
        double scaleY = 0;
        for (int k = 0; k < x.size(); k++) {
            if (x.get(k) != null && y.get(k) != null) {
                scaleX = Math.max(scaleX, Math.abs(x.get(k) - meanX));
                scaleY = Math.max(scaleY, Math.abs(y.get(k) - meanY));
            }
        }
        if (scaleX == 0 || scaleY == 0) {
            return null;
        }

        double covariance = 0;
        double varianceX = 0;
        double varianceY = 0;
        for (int k = 0; k < x.size(); k++) {
            if (x.get(k) != null && y.get(k) != null) {
                double dx = (x.get(k) - meanX) / scaleX;
                double dy = (y.get(k) - meanY) / scaleY;
                covariance += dx * dy;
                varianceX += dx * dx;
                varianceY += dy * dy;
            }
        }
        double r = covariance / (Math.sqrt(varianceX) * Math.sqrt(varianceY));
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
