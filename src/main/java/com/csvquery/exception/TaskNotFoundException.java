package com.csvquery.exception;

public class TaskNotFoundException extends AppException {

    public TaskNotFoundException(String taskId) {
        super(ErrorCode.TASK_NOT_FOUND, "Ingestion task not found: " + taskId);
    }
}
