package com.lanhub.collector.intake.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class TaskClosedException extends RuntimeException {
    public TaskClosedException(String message) {
        super(message);
    }
}
