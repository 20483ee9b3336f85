package com.inventorysense.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UploadResponse(
    @JsonProperty("message") String message,
    @JsonProperty("rows") int rows,
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("distributor_quarters") int distributorQuarters,
    @JsonProperty("dataset_version") long datasetVersion
) {}
