package com.lanhub.collector.intake.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class PasswordRejectedException extends RuntimeException {
    public PasswordRejectedException(String message) {
        super(message);
    }
}
