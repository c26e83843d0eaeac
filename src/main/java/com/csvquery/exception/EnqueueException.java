package com.csvquery.exception;

public class EnqueueException extends AppException {

    public EnqueueException(String message) {
        super(ErrorCode.ENQUEUE_FAILED, message);
    }

    public EnqueueException(String message, Throwable cause) {
        super(ErrorCode.ENQUEUE_FAILED, message, cause);
    }
}
