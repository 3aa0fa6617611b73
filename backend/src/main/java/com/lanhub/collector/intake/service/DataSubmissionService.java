package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.merge.SchemaReader;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.ColumnDefinition;
import com.lanhub.collector.intake.model.NewSubmission;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.SubmissionReceipt;
import com.lanhub.collector.intake.model.SubmitterInfo;
import com.lanhub.collector.intake.model.TableSchema;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.storage.ArtifactStorageException;
import com.lanhub.collector.intake.storage.IncomingFile;
import com.lanhub.collector.intake.storage.SubmissionStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured form submissions for data-collection tasks. Each record lands as one JSON file in
 * the task folder and counts against the task limit like a file upload. Attachments, when the
 * task allows them, go to the same per-submitter folder file uploads use.
 */
@Service
public class DataSubmissionService {
    private static final Logger log = LoggerFactory.getLogger(DataSubmissionService.class);

    private final TaskService taskService;
    private final IngestionGate ingestionGate;
    private final SubmissionStorage storage;
    private final SchemaReader schemaReader;
    private final CollectorProperties properties;
    private final Clock clock;

    public DataSubmissionService(
        TaskService taskService,
        IngestionGate ingestionGate,
        SubmissionStorage storage,
        SchemaReader schemaReader,
        CollectorProperties properties,
        Clock clock
    ) {
        this.taskService = taskService;
        this.ingestionGate = ingestionGate;
        this.storage = storage;
        this.schemaReader = schemaReader;
        this.properties = properties;
        this.clock = clock;
    }

    public TableSchema getSchema(String slug) {
        CollectionTask task = taskService.getBySlug(slug);
        if (task.taskType() != TaskType.DATA_COLLECTION) {
            throw new InvalidSubmissionException("Task " + slug + " is not a data-collection task");
        }
        return loadSchema(task);
    }

    public SubmissionReceipt submitRecord(
        String slug,
        String password,
        SubmitterInfo submitter,
        Map<String, Object> fields,
        List<IncomingFile> attachments
    ) {
        SubmissionService.validateSubmitter(submitter);
        if (fields == null || fields.isEmpty()) {
            throw new InvalidSubmissionException("Form data is required");
        }
        List<IncomingFile> extraFiles = attachments == null ? List.of() : attachments;
        long maxBytes = properties.getStorage().getMaxFileSizeBytes();
        extraFiles.forEach(file -> SubmissionService.checkSize(file, maxBytes));

        CollectionTask task = taskService.requireOpenTask(slug, password);
        if (task.taskType() != TaskType.DATA_COLLECTION) {
            throw new InvalidSubmissionException("Task " + slug + " is not a data-collection task");
        }
        if (!extraFiles.isEmpty() && !task.allowAttachments()) {
            throw new InvalidSubmissionException("Task " + slug + " does not accept attachments");
        }
        TableSchema schema = loadSchema(task);
        for (ColumnDefinition column : schema.columns()) {
            Object value = fields.get(column.name());
            if (column.required() && (value == null || value.toString().isBlank())) {
                throw new InvalidSubmissionException("Field " + column.name() + " is required");
            }
        }

        Map<String, Object> record = new LinkedHashMap<>(fields);
        record.put(properties.getMerge().getDefaultGroupByField(), submitter.department().trim());
        Path stored = storage.storeRecord(task, submitter.name(), submitter.department(), record);
        List<String> attachmentPaths;
        try {
            attachmentPaths = storage.storeAttachments(task, submitter.name(), submitter.department(), extraFiles);
        } catch (RuntimeException e) {
            storage.discard(stored);
            throw e;
        }

        NewSubmission row = new NewSubmission(
            submitter.name().trim(),
            submitter.contact().trim(),
            submitter.department().trim(),
            null,
            stored.getFileName().toString(),
            submitter.clientIp(),
            Instant.now(clock),
            attachmentPaths
        );
        Submission recorded;
        try {
            recorded = ingestionGate.recordSubmission(task.id(), row);
        } catch (CapacityExceededException e) {
            log.info("Task {} is full, discarding {}", e.getTaskId(), stored.getFileName());
            storage.discard(stored);
            storage.discardAttachments(task, attachmentPaths);
            throw e;
        }
        log.info(
            "Accepted data record {} for task {} from {} with {} attachment(s)",
            recorded.id(),
            slug,
            recorded.submitterName(),
            attachmentPaths.size()
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

    private TableSchema loadSchema(CollectionTask task) {
        if (task.templatePath() == null || task.templatePath().isBlank()) {
            return new TableSchema(task.title(), List.of());
        }
        Path schemaFile = Paths.get(task.templatePath());
        if (!Files.isRegularFile(schemaFile)) {
            log.warn("Schema file {} of task {} is missing", schemaFile, task.slug());
            return new TableSchema(task.title(), List.of());
        }
        try {
            return schemaReader.read(schemaFile);
        } catch (IOException e) {
            log.error("Failed to read schema {}", schemaFile, e);
            throw new ArtifactStorageException(schemaFile.toString(), e);
        }
    }
}
