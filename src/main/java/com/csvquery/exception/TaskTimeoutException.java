package com.csvquery.exception;

import java.time.Duration;

public class TaskTimeoutException extends AppException {

    public TaskTimeoutException(String taskId, Duration limit) {
        super(ErrorCode.TASK_TIMEOUT, "Ingestion task " + taskId + " exceeded time limit of " + limit);
    }
}
