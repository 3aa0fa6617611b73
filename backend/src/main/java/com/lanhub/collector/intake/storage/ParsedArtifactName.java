package com.lanhub.collector.intake.storage;

import java.time.LocalDateTime;

public record ParsedArtifactName(
    String templateName,
    String submitter,
    String contact,
    int version,
    LocalDateTime timestamp
) {
    public String identityKey() {
        return submitter + "|" + contact;
    }
}
