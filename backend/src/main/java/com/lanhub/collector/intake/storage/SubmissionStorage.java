package com.lanhub.collector.intake.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.util.FileNameSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class SubmissionStorage {
    private static final Logger log = LoggerFactory.getLogger(SubmissionStorage.class);
    private static final DateTimeFormatter RECORD_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final int MAX_RECORD_SUFFIX = 1000;

    private final CollectorProperties properties;
    private final IoSerializer ioSerializer;
    private final FilenameVersioner versioner;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SubmissionStorage(
        CollectorProperties properties,
        IoSerializer ioSerializer,
        FilenameVersioner versioner,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.properties = properties;
        this.ioSerializer = ioSerializer;
        this.versioner = versioner;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path collectionFolder(CollectionTask task) {
        if (task.collectionPath() != null && !task.collectionPath().isBlank()) {
            return Paths.get(task.collectionPath());
        }
        return Paths.get(properties.getStorage().getRoot())
            .resolve(FileNameSanitizer.pathSegment(task.title()) + "_" + task.slug());
    }

    public String templateName(CollectionTask task) {
        if (task.templatePath() != null && !task.templatePath().isBlank()) {
            return FileNameSanitizer.stripExtension(task.templatePath());
        }
        return FileNameSanitizer.pathSegment(task.title());
    }

    public String submissionPrefix(CollectionTask task, String submitter, String department) {
        return templateName(task)
            + "-" + FileNameSanitizer.nameSegment(submitter)
            + "-" + FileNameSanitizer.nameSegment(department);
    }

    public StoredArtifact storeSubmission(
        CollectionTask task,
        String submitter,
        String department,
        String originalFilename,
        InputStreamSource content
    ) {
        Path folder = collectionFolder(task);
        String prefix = submissionPrefix(task, submitter, department);
        String extension = FileNameSanitizer.extensionOf(originalFilename);
        if (extension.isEmpty()) {
            extension = properties.getStorage().getDefaultExtension();
        }

        try (IoSerializer.Handle ignored = ioSerializer.acquire()) {
            StoredArtifact target;
            try {
                Files.createDirectories(folder);
                target = versioner.allocate(folder, prefix, extension, task.versioningMode(), now());
            } catch (IOException e) {
                log.error("Failed to prepare {} for prefix {}", folder, prefix, e);
                throw new ArtifactStorageException(folder.toString(), e);
            }
            write(target.path(), content);
            log.info("Submission saved: {} (version {})", target.path(), target.version());
            return target;
        }
    }

    /**
     * Stores attachments under {@code <collection>/<submitter>-<department>/}. Returned paths
     * are relative to the collection folder.
     */
    public List<String> storeAttachments(
        CollectionTask task,
        String submitter,
        String department,
        List<IncomingFile> attachments
    ) {
        if (attachments == null || attachments.isEmpty()) {
            return List.of();
        }
        Path collection = collectionFolder(task);
        String folderName = FileNameSanitizer.pathSegment(submitter) + "-" + FileNameSanitizer.pathSegment(department);
        Path folder = collection.resolve(folderName);

        List<String> stored = new ArrayList<>();
        for (IncomingFile attachment : attachments) {
            String safeName = FileNameSanitizer.pathSegment(attachment.originalFilename());
            String extension = FileNameSanitizer.extensionOf(safeName);
            String stem = FileNameSanitizer.stripExtension(safeName);
            try (IoSerializer.Handle ignored = ioSerializer.acquire()) {
                StoredArtifact target;
                try {
                    Files.createDirectories(folder);
                    target = versioner.allocate(folder, stem, extension, task.versioningMode(), null);
                } catch (IOException e) {
                    log.error("Failed to prepare attachment folder {}", folder, e);
                    throw new ArtifactStorageException(folder.toString(), e);
                }
                write(target.path(), attachment.content());
                log.info("Attachment saved: {}", target.path());
                stored.add(collection.relativize(target.path()).toString().replace('\\', '/'));
            }
        }
        return stored;
    }

    /**
     * Writes one structured record as {@code <name>_<department>_<yyyyMMdd-HHmmss>.json}. A
     * numeric suffix is appended when a record with the same second already exists.
     */
    public Path storeRecord(CollectionTask task, String submitter, String department, Map<String, Object> record) {
        Path folder = collectionFolder(task);
        String stem = FileNameSanitizer.nameSegment(submitter)
            + "_" + FileNameSanitizer.nameSegment(department)
            + "_" + RECORD_STAMP.format(now());

        try (IoSerializer.Handle ignored = ioSerializer.acquire()) {
            try {
                Files.createDirectories(folder);
            } catch (IOException e) {
                throw new ArtifactStorageException(folder.toString(), e);
            }
            for (int attempt = 1; attempt <= MAX_RECORD_SUFFIX; attempt++) {
                Path target = folder.resolve(attempt == 1 ? stem + ".json" : stem + "_" + attempt + ".json");
                if (Files.exists(target)) {
                    continue;
                }
                try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW)) {
                    objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, record);
                    log.info("Data record saved: {}", target);
                    return target;
                } catch (FileAlreadyExistsException e) {
                    log.debug("Record name taken, trying next suffix: {}", target);
                } catch (IOException e) {
                    log.error("Failed to write data record {}", target, e);
                    deletePartial(target);
                    throw new ArtifactStorageException(target.toString(), e);
                }
            }
        }
        throw new ArtifactStorageException(folder.resolve(stem + ".json").toString(),
            new FileAlreadyExistsException(stem));
    }

    /**
     * Removes a file written for a submission that was refused afterwards.
     */
    public void discard(Path file) {
        if (file == null) {
            return;
        }
        try (IoSerializer.Handle ignored = ioSerializer.acquire()) {
            if (Files.deleteIfExists(file)) {
                log.info("Discarded refused artifact {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to discard refused artifact {}: {}", file, e.getMessage());
        }
    }

    public void discardAttachments(CollectionTask task, List<String> relativePaths) {
        if (relativePaths == null) {
            return;
        }
        Path collection = collectionFolder(task);
        for (String relative : relativePaths) {
            discard(collection.resolve(relative));
        }
    }

    private void write(Path target, InputStreamSource content) {
        try (InputStream in = content.getInputStream()) {
            Files.copy(in, target);
        } catch (FileAlreadyExistsException e) {
            log.error("Refusing to replace existing file {}", target);
            throw new ArtifactStorageException(target.toString(), e);
        } catch (IOException e) {
            log.error("Error writing file to disk: {}", target, e);
            deletePartial(target);
            throw new ArtifactStorageException(target.toString(), e);
        }
    }

    private void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException cleanup) {
            log.warn("Failed to remove partial file {}: {}", target, cleanup.getMessage());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
