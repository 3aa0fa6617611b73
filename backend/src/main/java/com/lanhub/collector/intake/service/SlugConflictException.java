package com.lanhub.collector.intake.service;

public class SlugConflictException extends RuntimeException {
    public SlugConflictException(int attempts, Throwable lastCause) {
        super("Could not allocate a unique task slug after " + attempts + " attempts", lastCause);
    }
}
