package com.csvquery.exception;

public class DatasetNotFoundException extends AppException {

    public DatasetNotFoundException(String message) {
        super(ErrorCode.DATASET_NOT_FOUND, message);
    }
}
