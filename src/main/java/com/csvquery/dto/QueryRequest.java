package com.csvquery.dto;

import jakarta.validation.constraints.NotBlank;

/** {@code versionId} defaults to "latest", the newest version whose table is ready. */
public record QueryRequest(
        @NotBlank String datasetId,
        @NotBlank String question,
        String versionId,
        @NotBlank String userId
) {
    public static final String LATEST = "latest";

    public String versionOrLatest() {
        return versionId == null || versionId.isBlank() ? LATEST : versionId;
    }
}
