package com.csvquery.exception;

public class RegistrationConflictException extends AppException {

    public RegistrationConflictException(String message) {
        super(ErrorCode.REGISTRATION_CONFLICT, message);
    }

    public RegistrationConflictException(String message, Throwable cause) {
        super(ErrorCode.REGISTRATION_CONFLICT, message, cause);
    }
}
