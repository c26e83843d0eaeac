package com.csvquery.exception;

/** The table engine could not parse the assembled file. */
public class SchemaInferenceException extends AppException {

    public SchemaInferenceException(String message) {
        super(ErrorCode.SCHEMA_INFERENCE_FAILED, message);
    }

    public SchemaInferenceException(String message, Throwable cause) {
        super(ErrorCode.SCHEMA_INFERENCE_FAILED, message, cause);
    }
}
