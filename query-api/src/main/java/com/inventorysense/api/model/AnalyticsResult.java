package com.inventorysense.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic wrapper for analytics results.
 * Carries the version of the dataset snapshot the result was computed from,
 * the computation time and a human-readable summary.
 *
 * @param <T> The type of the result data
 */
public record AnalyticsResult<T>(
    @JsonProperty("result") T result,
    @JsonProperty("dataset_version") long datasetVersion,
    @JsonProperty("query_time_ms") long queryTimeMs,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("summary") String summary
) {
    /**
     * Create an analytics result stamped with the current time.
     *
     * @param result The computed result
     * @param datasetVersion Version of the snapshot the result was computed from
     * @param queryTimeMs Time taken to compute the result in milliseconds
     * @param summary Human-readable summary of the result
     */
    public static <T> AnalyticsResult<T> of(T result, long datasetVersion, long queryTimeMs, String summary) {
        return new AnalyticsResult<>(result, datasetVersion, queryTimeMs, System.currentTimeMillis(), summary);
    }
}
