package com.lanhub.collector.intake.model;

import java.time.Instant;

public record TaskView(
    String id,
    String slug,
    String title,
    TaskType taskType,
    VersioningMode versioningMode,
    String templatePath,
    String collectionPath,
    int maxLimit,
    int currentCount,
    boolean passwordProtected,
    Instant expiresAt,
    boolean active,
    boolean allowAttachments,
    Instant createdAt
) {
    public static TaskView from(CollectionTask task) {
        return new TaskView(
            task.id(),
            task.slug(),
            task.title(),
            task.taskType(),
            task.versioningMode(),
            task.templatePath(),
            task.collectionPath(),
            task.maxLimit(),
            task.currentCount(),
            task.hasPassword(),
            task.expiresAt(),
            task.active(),
            task.allowAttachments(),
            task.createdAt()
        );
    }
}
