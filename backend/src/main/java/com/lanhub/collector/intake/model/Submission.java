package com.lanhub.collector.intake.model;

import java.time.Instant;
import java.util.List;

public record Submission(
    long id,
    String taskId,
    String submitterName,
    String contact,
    String department,
    String originalFilename,
    String storedFilename,
    String clientIp,
    Instant submittedAt,
    List<String> attachmentPaths
) {
}
