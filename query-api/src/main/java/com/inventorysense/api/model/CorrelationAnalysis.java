package com.inventorysense.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inventorysense.engine.model.CorrelationHeatmap;
import com.inventorysense.engine.model.CorrelationReport;
import com.inventorysense.engine.model.KeyRelationships;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlation report plus the static model recommendations shown next to it.
 */
public record CorrelationAnalysis(
    @JsonProperty("heatmap") CorrelationHeatmap heatmap,
    @JsonProperty("key_relationships") KeyRelationships keyRelationships,
    @JsonProperty("model_recommendations") Map<String, ModelRecommendation> modelRecommendations
) {
    static final Map<String, ModelRecommendation> MODEL_RECOMMENDATIONS = recommendations();

    public static CorrelationAnalysis of(CorrelationReport report) {
        return new CorrelationAnalysis(report.heatmap(), report.keyRelationships(), MODEL_RECOMMENDATIONS);
    }

    private static Map<String, ModelRecommendation> recommendations() {
        Map<String, ModelRecommendation> recommendations = new LinkedHashMap<>();
        recommendations.put("linear_regression", new ModelRecommendation(
            List.of("Storage_Duration", "Distributor_Size", "Region_Population"),
            "Strong linear correlation with waste"));
        recommendations.put("decision_tree", new ModelRecommendation(
            List.of("Order_Frequency", "Storage_Duration", "Temperature_Variance"),
            "Captures non-linear interactions"));
        recommendations.put("xgboost", new ModelRecommendation(
            List.of("All numeric features"),
            "Handles multicollinearity and complex patterns"));
        return Collections.unmodifiableMap(recommendations);
    }
}
