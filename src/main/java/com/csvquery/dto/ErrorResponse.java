package com.csvquery.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ErrorResponse {
    private String status;
    private String message;
    private String path;
    @Builder.Default
    private Instant timestamp = Instant.now();
}
