package com.csvquery.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INVALID_UPLOAD(HttpStatus.BAD_REQUEST),
    CHUNK_WRITE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    MISSING_CHUNK(HttpStatus.INTERNAL_SERVER_ERROR),
    SCHEMA_INFERENCE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    REGISTRATION_CONFLICT(HttpStatus.CONFLICT),
    ENQUEUE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    TASK_TIMEOUT(HttpStatus.INTERNAL_SERVER_ERROR),
    TASK_NOT_FOUND(HttpStatus.NOT_FOUND),
    DATASET_NOT_FOUND(HttpStatus.NOT_FOUND),
    SQL_GENERATION_FAILED(HttpStatus.BAD_REQUEST),
    QUERY_EXECUTION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
