package com.lanhub.collector.intake.service;

import com.lanhub.collector.intake.model.NewSubmission;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.persistence.TaskJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Bookkeeping side of a submission. The quota is enforced by the database: the counter update
 * only matches while the task is below its limit, and a miss rolls the submission row back.
 */
@Service
public class IngestionGate {
    private static final Logger log = LoggerFactory.getLogger(IngestionGate.class);

    private final TaskJdbcRepository repository;

    public IngestionGate(TaskJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public Submission recordSubmission(String taskId, NewSubmission submission) {
        long id = repository.insertSubmission(taskId, submission);
        int updated = repository.incrementCountIfBelowLimit(taskId);
        if (updated == 0) {
            log.warn("Submission from {} refused: task {} is at its limit", submission.submitterName(), taskId);
            throw new CapacityExceededException(taskId);
        }
        return new Submission(
            id,
            taskId,
            submission.submitterName(),
            submission.contact(),
            submission.department(),
            submission.originalFilename(),
            submission.storedFilename(),
            submission.clientIp(),
            submission.submittedAt(),
            submission.attachmentPaths() == null ? List.of() : submission.attachmentPaths()
        );
    }

    /**
     * Removes one submission row and gives its slot back. The decrement never takes the counter
     * below zero.
     */
    @Transactional
    public Optional<Submission> deleteSubmission(long submissionId) {
        Optional<Submission> existing = repository.findSubmission(submissionId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Submission submission = existing.get();
        if (repository.deleteSubmission(submissionId) == 0) {
            return Optional.empty();
        }
        if (repository.decrementCountIfPositive(submission.taskId()) == 0) {
            log.warn("Counter of task {} already at zero while deleting submission {}", submission.taskId(), submissionId);
        }
        return existing;
    }

    @Transactional
    public int clearSubmissions(String taskId) {
        int deleted = repository.deleteSubmissions(taskId);
        repository.resetCount(taskId);
        log.info("Cleared {} submissions of task {}", deleted, taskId);
        return deleted;
    }
}
