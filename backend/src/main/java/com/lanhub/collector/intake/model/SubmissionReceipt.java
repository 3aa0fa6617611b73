package com.lanhub.collector.intake.model;

public record SubmissionReceipt(
    long submissionId,
    String filename,
    String submitter,
    String contact,
    String department,
    int attachmentCount
) {
}
