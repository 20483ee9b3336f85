package com.inventorysense.common;

/**
 * Centralized configuration for the analytics engines.
 * Every value can be overridden through an environment variable.
 */
public class AnalyticsConfig {

    private static final int TOP_RISKY_LIMIT =
        intFromEnv("ANALYTICS_TOP_RISKY_LIMIT", 5);

    private static final int RELATIONSHIP_LIMIT =
        intFromEnv("ANALYTICS_RELATIONSHIP_LIMIT", 5);

    private static final int ROOT_CAUSE_TOP_FACTORS =
        intFromEnv("ANALYTICS_ROOT_CAUSE_TOP_FACTORS", 5);

    private static final int OVERVIEW_TOP_STATES =
        intFromEnv("ANALYTICS_OVERVIEW_TOP_STATES", 10);

    private static final int OVERVIEW_TOP_DISTRIBUTORS =
        intFromEnv("ANALYTICS_OVERVIEW_TOP_DISTRIBUTORS", 5);

    private static final int CHART_MONTHS =
        intFromEnv("ANALYTICS_CHART_MONTHS", 6);

    private static int intFromEnv(String name, int defaultValue) {
        String value = System.getenv().getOrDefault(name, String.valueOf(defaultValue));
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Number of aggregate rows returned by the top-risky ranking.
     */
    public static int getTopRiskyLimit() {
        return TOP_RISKY_LIMIT;
    }

    /**
     * Number of relationships kept in each correlation bucket.
     */
    public static int getRelationshipLimit() {
        return RELATIONSHIP_LIMIT;
    }

    /**
     * Number of features listed in the root-cause report.
     */
    public static int getRootCauseTopFactors() {
        return ROOT_CAUSE_TOP_FACTORS;
    }

    /**
     * Number of states in the state-wise waste chart.
     */
    public static int getOverviewTopStates() {
        return OVERVIEW_TOP_STATES;
    }

    /**
     * Number of distributors in the overview risk table.
     */
    public static int getOverviewTopDistributors() {
        return OVERVIEW_TOP_DISTRIBUTORS;
    }

    /**
     * Number of most recent months in the allowed-vs-actual chart.
     */
    public static int getChartMonths() {
        return CHART_MONTHS;
    }
}
