package com.lanhub.collector.intake.api;

public record CopyTaskRequest(String title) {
}
