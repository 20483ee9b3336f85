package com.inventorysense.api;

import com.inventorysense.api.services.FeatureImportanceStore;
import com.inventorysense.engine.errors.InsufficientDataException;
import com.inventorysense.engine.model.FeatureImportance;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;

/**
 * Root-cause endpoint with the importance store mocked.
 */
@QuarkusTest
class RootCauseResourceTest {

    @InjectMock
    FeatureImportanceStore importanceStore;

    @Test
    void testModelNotTrained() {
        // Given nothing has been published
        when(importanceStore.current()).thenThrow(new InsufficientDataException("Model not trained yet"));

        given()
            .when().get("/api/root-cause")
            .then()
            .statusCode(400)
            .body("error", equalTo("Model not trained yet"))
            .body("status", equalTo(400));
    }

    @Test
    void testZeroImportances() {
        when(importanceStore.current()).thenReturn(new FeatureImportanceStore.Published(
            "Lasso Regression", List.of(new FeatureImportance("Deliveries_Quantity", 0.0)), 0L));

        given()
            .when().get("/api/root-cause")
            .then()
            .statusCode(400)
            .body("error", containsString("cannot normalize"));
    }

    @Test
    void testSixFeaturesKeepTopFive() {
        when(importanceStore.current()).thenReturn(new FeatureImportanceStore.Published(
            "Decision Tree", List.of(
                new FeatureImportance("a", 1),
                new FeatureImportance("b", 2),
                new FeatureImportance("c", 3),
                new FeatureImportance("d", 4),
                new FeatureImportance("e", 5),
                new FeatureImportance("f", 5)), 0L));

        given()
            .when().get("/api/root-cause")
            .then()
            .statusCode(200)
            .body("result.top_factors", hasSize(5))
            .body("result.top_factors.feature", contains("e", "f", "d", "c", "b"))
            .body("result.top_factors[0].contribution_pct", equalTo(25.0f))
            .body("result.secondary_drivers.feature", contains("f", "d"))
            .body("summary", containsString("Decision Tree"));

        verify(importanceStore).current();
    }
}
