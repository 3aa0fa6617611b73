package com.lanhub.collector.intake.model;

import java.time.Instant;

public record CollectionTask(
    String id,
    String slug,
    String title,
    TaskType taskType,
    String templatePath,
    String collectionPath,
    VersioningMode versioningMode,
    int maxLimit,
    int currentCount,
    String passwordHash,
    Instant expiresAt,
    boolean active,
    boolean allowAttachments,
    Instant createdAt
) {
    public boolean isUnlimited() {
        return maxLimit <= 0;
    }

    public boolean isFull() {
        return !isUnlimited() && currentCount >= maxLimit;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isBlank();
    }

    public CollectionTask withSlug(String newSlug) {
        return new CollectionTask(
            id,
            newSlug,
            title,
            taskType,
            templatePath,
            collectionPath,
            versioningMode,
            maxLimit,
            currentCount,
            passwordHash,
            expiresAt,
            active,
            allowAttachments,
            createdAt
        );
    }
}
