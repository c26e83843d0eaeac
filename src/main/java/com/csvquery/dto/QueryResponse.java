package com.csvquery.dto;

public record QueryResponse(
        String answer,
        String rawAnswer,
        String generatedSql,
        TablePreview preview
) {}
