package com.csvquery.exception;

public class QueryExecutionException extends AppException {

    public QueryExecutionException(String message) {
        super(ErrorCode.QUERY_EXECUTION_FAILED, message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(ErrorCode.QUERY_EXECUTION_FAILED, message, cause);
    }
}
