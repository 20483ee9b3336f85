package com.inventorysense.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Row-oriented dataset upload: one map of column name to cell value per row.
 */
public record UploadRequest(
    @JsonProperty("rows") List<Map<String, Object>> rows
) {}
