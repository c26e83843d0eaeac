package com.csvquery.exception;

public class SqlGenerationException extends AppException {

    public SqlGenerationException(String message) {
        super(ErrorCode.SQL_GENERATION_FAILED, message);
    }

    public SqlGenerationException(String message, Throwable cause) {
        super(ErrorCode.SQL_GENERATION_FAILED, message, cause);
    }
}
