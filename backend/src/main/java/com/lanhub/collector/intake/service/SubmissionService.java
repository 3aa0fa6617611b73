package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.NewSubmission;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.SubmissionReceipt;
import com.lanhub.collector.intake.model.SubmitterInfo;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.storage.IncomingFile;
import com.lanhub.collector.intake.storage.StoredArtifact;
import com.lanhub.collector.intake.storage.SubmissionStorage;
import com.lanhub.collector.intake.util.FileNameSanitizer;
import com.lanhub.collector.intake.util.FileSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * File submissions: write the artifact under the io lock, then record it through the
 * {@link IngestionGate}. A refused submission has its files removed again.
 */
@Service
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final TaskService taskService;
    private final IngestionGate ingestionGate;
    private final SubmissionStorage storage;
    private final CollectorProperties properties;
    private final Clock clock;

    public SubmissionService(
        TaskService taskService,
        IngestionGate ingestionGate,
        SubmissionStorage storage,
        CollectorProperties properties,
        Clock clock
    ) {
        this.taskService = taskService;
        this.ingestionGate = ingestionGate;
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
    }

    public SubmissionReceipt submitFile(
        String slug,
        String password,
        SubmitterInfo submitter,
        IncomingFile file,
        List<IncomingFile> attachments
    ) {
        validateSubmitter(submitter);
        if (file == null || file.originalFilename() == null || file.originalFilename().isBlank()) {
            throw new InvalidSubmissionException("A file is required");
        }
        checkSize(file);
        checkType(file);
        List<IncomingFile> extraFiles = attachments == null ? List.of() : attachments;
        extraFiles.forEach(this::checkSize);

        CollectionTask task = taskService.requireOpenTask(slug, password);
        if (task.taskType() != TaskType.FILE_COLLECTION) {
            throw new InvalidSubmissionException("Task " + slug + " does not accept file uploads");
        }
        if (!extraFiles.isEmpty() && !task.allowAttachments()) {
            throw new InvalidSubmissionException("Task " + slug + " does not accept attachments");
        }

        StoredArtifact stored = storage.storeSubmission(
            task,
            submitter.name(),
            submitter.department(),
            file.originalFilename(),
            file.content()
        );
        List<String> attachmentPaths;
        try {
            attachmentPaths = storage.storeAttachments(task, submitter.name(), submitter.department(), extraFiles);
        } catch (RuntimeException e) {
            storage.discard(stored.path());
            throw e;
        }

        NewSubmission row = new NewSubmission(
            submitter.name().trim(),
            submitter.contact().trim(),
            submitter.department().trim(),
            file.originalFilename(),
            stored.fileName(),
            submitter.clientIp(),
            Instant.now(clock),
            attachmentPaths
        );
        Submission recorded;
        try {
            recorded = ingestionGate.recordSubmission(task.id(), row);
        } catch (CapacityExceededException e) {
            log.info("Task {} is full, discarding {}", e.getTaskId(), stored.fileName());
            storage.discard(stored.path());
            storage.discardAttachments(task, attachmentPaths);
            throw e;
        }
        log.info(
            "Accepted submission {} for task {} from {} ({})",
            recorded.id(),
            slug,
            recorded.submitterName(),
            recorded.clientIp()
        );
        return new SubmissionReceipt(
            recorded.id(),
            recorded.storedFilename(),
            recorded.submitterName(),
            recorded.contact(),
            recorded.department(),
            attachmentPaths.size()
        );
    }

    static void validateSubmitter(SubmitterInfo submitter) {
        if (submitter == null || submitter.name() == null || submitter.name().isBlank()) {
            throw new InvalidSubmissionException("Submitter name is required");
        }
        String contact = submitter.contact() == null ? "" : submitter.contact().trim();
        if (contact.length() < 4 || contact.length() > 11) {
            throw new InvalidSubmissionException("Contact must be 4 to 11 characters long");
        }
        if (submitter.department() == null || submitter.department().isBlank()) {
            throw new InvalidSubmissionException("Department is required");
        }
    }

    private void checkType(IncomingFile file) {
        String extension = FileNameSanitizer.extensionOf(file.originalFilename()).toLowerCase(Locale.ROOT);
        List<String> allowed = properties.getStorage().getAllowedExtensions();
        if (!allowed.contains(extension)) {
            throw new InvalidSubmissionException(
                "File " + file.originalFilename() + " must have one of the extensions " + String.join(", ", allowed)
            );
        }
        byte[] head;
        try (InputStream in = file.content().getInputStream()) {
            head = in.readNBytes(FileSignatures.HEAD_LENGTH);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read upload " + file.originalFilename(), e);
        }
        if (!FileSignatures.matches(extension, head)) {
            log.warn("Rejected upload {}: content does not match {}", file.originalFilename(), extension);
            throw new InvalidSubmissionException("File " + file.originalFilename() + " content does not match its extension");
        }
    }

    private void checkSize(IncomingFile file) {
        checkSize(file, properties.getStorage().getMaxFileSizeBytes());
    }

    static void checkSize(IncomingFile file, long maxBytes) {
        if (file.size() > maxBytes) {
            throw new InvalidSubmissionException("File " + file.originalFilename() + " exceeds " + maxBytes + " bytes");
        }
    }
}
