package com.lanhub.collector.intake.model;

import java.time.Instant;
import java.util.List;

public record NewSubmission(
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
