package com.inventorysense.api;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for the risk endpoints against the sample dataset.
 */
@QuarkusTest
class RiskResourceTest {

    @BeforeEach
    void setUp() {
        DatasetFixtures.uploadSample();
    }

    // ==========================================
    // Overview
    // ==========================================

    @Test
    void testOverview() {
        given()
            .when().get("/api/risk/overview")
            .then()
            .statusCode(200)
            .body("result.state_wise_waste[0].state", equalTo("Texas"))
            .body("result.state_wise_waste[0].value", equalTo(300.0f))
            .body("result.high_risk_distributors[0].distributor_id", equalTo(101))
            .body("result.high_risk_distributors[0].risk_pct", equalTo(25.0f))
            .body("result.high_risk_distributors[0].status", equalTo("OK"))
            .body("result.high_risk_distributors[1].risk_pct", equalTo(18.8f))
            .body("result.key_insights[0]", equalTo("Texas accounts for 76% of total stale inventory losses."))
            .body("dataset_version", greaterThan(0))
            .body("query_time_ms", greaterThanOrEqualTo(0));
    }

    @Test
    void testOverviewFilteredByYearAndMonth() {
        given()
            .queryParam("year", "2023")
            .queryParam("month", "Aug")
            .when().get("/api/risk/overview")
            .then()
            .statusCode(200)
            .body("result.state_wise_waste", hasSize(1))
            .body("result.state_wise_waste[0].state", equalTo("Ohio"))
            .body("result.state_wise_waste[0].value", equalTo(50.0f));
    }

    @Test
    void testOverviewWithSentinels() {
        given()
            .queryParam("year", "All Years")
            .queryParam("month", "All Months")
            .when().get("/api/risk/overview")
            .then()
            .statusCode(200)
            .body("result.state_wise_waste", hasSize(2));
    }

    @Test
    void testOverviewRejectsNonNumericYear() {
        given()
            .queryParam("year", "last")
            .when().get("/api/risk/overview")
            .then()
            .statusCode(400)
            .body("error", containsString("Year filter"));
    }

    // ==========================================
    // Distributor trend
    // ==========================================

    @Test
    void testDistributorTrend() {
        given()
            .queryParam("distributor_id", 101)
            .when().get("/api/risk/distributor-trend")
            .then()
            .statusCode(200)
            .body("result.distributor_id", equalTo(101))
            .body("result.trend", hasSize(2))
            .body("result.trend[0].quarter", equalTo("2023 Q1"))
            .body("result.trend[0].pct_change", nullValue())
            .body("result.trend[1].waste", equalTo(150.0f))
            .body("result.trend[1].pct_change", equalTo(50.0f))
            .body("result.trend[1].status", equalTo("Very Good"));
    }

    @Test
    void testDistributorTrendNotFound() {
        given()
            .queryParam("distributor_id", 999)
            .when().get("/api/risk/distributor-trend")
            .then()
            .statusCode(404)
            .body("error", containsString("999"));
    }

    // ==========================================
    // Quarter comparison
    // ==========================================

    @Test
    void testQuarterComparison() {
        given()
            .queryParam("state", "Texas")
            .queryParam("quarter_a", "2023 Q1")
            .queryParam("quarter_b", "2023 2023Q2")
            .queryParam("distributor_1", 102)
            .queryParam("distributor_2", 101)
            .when().get("/api/risk/quarter-comparison")
            .then()
            .statusCode(200)
            .body("result.quarter_a", equalTo("2023 Q1"))
            .body("result.quarter_b", equalTo("2023 Q2"))
            .body("result.comparison", hasSize(2))
            .body("result.comparison[0].distributor_id", equalTo(101))
            .body("result.comparison[0].total_waste_q1", equalTo(100.0f))
            .body("result.comparison[0].total_waste_q2", equalTo(150.0f))
            .body("result.comparison[0].delta", equalTo(50.0f))
            .body("result.comparison[0].trend", equalTo("up"))
            .body("result.comparison[0].status_change", equalTo("Very Good → Very Good"))
            .body("result.comparison[1].distributor_id", equalTo(102));
    }

    @Test
    void testQuarterComparisonUnknownState() {
        given()
            .queryParam("state", "Nevada")
            .queryParam("quarter_a", "2023 Q1")
            .queryParam("quarter_b", "2023 Q2")
            .queryParam("distributor_1", 101)
            .when().get("/api/risk/quarter-comparison")
            .then()
            .statusCode(404)
            .body("error", containsString("Nevada"));
    }

    @Test
    void testQuarterComparisonBadLabel() {
        given()
            .queryParam("state", "Texas")
            .queryParam("quarter_a", "first quarter")
            .queryParam("quarter_b", "2023 Q2")
            .queryParam("distributor_1", 101)
            .when().get("/api/risk/quarter-comparison")
            .then()
            .statusCode(400)
            .body("error", containsString("Invalid quarter label"));
    }

    @Test
    void testQuarterComparisonRequiresDistributor() {
        given()
            .queryParam("state", "Texas")
            .queryParam("quarter_a", "2023 Q1")
            .queryParam("quarter_b", "2023 Q2")
            .when().get("/api/risk/quarter-comparison")
            .then()
            .statusCode(400)
            .body("error", containsString("distributor_1"));
    }

    // ==========================================
    // Top risky
    // ==========================================

    @Test
    void testTopRisky() {
        given()
            .when().get("/api/risk/top-risky")
            .then()
            .statusCode(200)
            .body("result", hasSize(5))
            .body("result[0].distributor_id", equalTo(101))
            .body("result[0].quarter", equalTo("2023 Q2"))
            .body("result[0].risk_pct", equalTo(50.0f))
            .body("result[1].distributor_id", equalTo(103))
            .body("result[1].risk_pct", equalTo(25.0f));
    }
}
