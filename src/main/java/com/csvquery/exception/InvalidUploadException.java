package com.csvquery.exception;

public class InvalidUploadException extends AppException {

    public InvalidUploadException(String message) {
        super(ErrorCode.INVALID_UPLOAD, message);
    }

    public InvalidUploadException(String message, Throwable cause) {
        super(ErrorCode.INVALID_UPLOAD, message, cause);
    }
}
