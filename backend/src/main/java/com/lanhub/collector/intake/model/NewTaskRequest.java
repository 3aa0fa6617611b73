package com.lanhub.collector.intake.model;

import java.time.Instant;

public record NewTaskRequest(
    String title,
    TaskType taskType,
    String templatePath,
    VersioningMode versioningMode,
    Integer maxLimit,
    String password,
    Instant expiresAt,
    Boolean allowAttachments
) {
}
