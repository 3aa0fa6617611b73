package com.lanhub.collector.intake.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The task is full. The message is shown to submitters, so the task id stays out of it.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class CapacityExceededException extends RuntimeException {
    private final String taskId;

    public CapacityExceededException(String taskId) {
        super("This task has reached its submission limit");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
