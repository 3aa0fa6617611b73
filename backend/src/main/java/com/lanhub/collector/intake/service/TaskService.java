package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.NewTaskRequest;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.model.VersioningMode;
import com.lanhub.collector.intake.persistence.TaskJdbcRepository;
import com.lanhub.collector.intake.util.FileNameSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class TaskService {
    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskJdbcRepository repository;
    private final SlugGenerator slugGenerator;
    private final PasswordVerifier passwordVerifier;
    private final CollectorProperties properties;
    private final Clock clock;

    public TaskService(
        TaskJdbcRepository repository,
        SlugGenerator slugGenerator,
        PasswordVerifier passwordVerifier,
        CollectorProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.slugGenerator = slugGenerator;
        this.passwordVerifier = passwordVerifier;
        this.properties = properties;
        this.clock = clock;
    }

    public CollectionTask createTask(NewTaskRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        int maxLimit = request.maxLimit() == null ? 0 : request.maxLimit();
        if (maxLimit < 0) {
            throw new IllegalArgumentException("maxLimit must be >= 0");
        }
        String id = UUID.randomUUID().toString();
        String title = request.title().trim();
        String collectionPath = Paths.get(properties.getStorage().getRoot())
            .resolve(FileNameSanitizer.pathSegment(title) + "-" + id.substring(0, 8))
            .toString();

        CollectionTask draft = new CollectionTask(
            id,
            null,
            title,
            request.taskType() == null ? TaskType.FILE_COLLECTION : request.taskType(),
            request.templatePath(),
            collectionPath,
            request.versioningMode() == null ? VersioningMode.AUTO_VERSION : request.versioningMode(),
            maxLimit,
            0,
            passwordVerifier.hash(request.password()),
            request.expiresAt(),
            true,
            Boolean.TRUE.equals(request.allowAttachments()),
            Instant.now(clock)
        );
        return insertWithFreshSlug(draft);
    }

    /**
     * Copies a task's configuration into a new task with its own slug and a zero counter. The
     * copy keeps the source's collection folder.
     */
    public CollectionTask copyTask(String sourceSlug, String newTitle) {
        CollectionTask source = getBySlug(sourceSlug);
        CollectionTask draft = new CollectionTask(
            UUID.randomUUID().toString(),
            null,
            newTitle == null || newTitle.isBlank() ? source.title() : newTitle.trim(),
            source.taskType(),
            source.templatePath(),
            source.collectionPath(),
            source.versioningMode(),
            source.maxLimit(),
            0,
            source.passwordHash(),
            source.expiresAt(),
            source.active(),
            source.allowAttachments(),
            Instant.now(clock)
        );
        return insertWithFreshSlug(draft);
    }

    public CollectionTask getBySlug(String slug) {
        return repository.findTaskBySlug(slug)
            .orElseThrow(() -> new TaskNotFoundException("Task " + slug + " not found"));
    }

    public List<CollectionTask> listTasks() {
        return repository.listTasks();
    }

    public CollectionTask setActive(String slug, boolean active) {
        CollectionTask task = getBySlug(slug);
        repository.updateActive(task.id(), active);
        log.info("Task {} active={}", slug, active);
        return getBySlug(slug);
    }

    /**
     * Resolves a task that is accepting submissions right now. The full-check here is advisory;
     * the ingestion gate enforces the limit atomically.
     */
    public CollectionTask requireOpenTask(String slug, String password) {
        CollectionTask task = getBySlug(slug);
        checkLive(task);
        if (task.isFull()) {
            throw new CapacityExceededException(task.id());
        }
        checkPassword(task, password);
        return task;
    }

    /**
     * The template file of a live task, for download by submitters. Empty when the task has no
     * template or the file is gone.
     */
    public Optional<Path> templateFile(String slug, String password) {
        CollectionTask task = getBySlug(slug);
        checkLive(task);
        checkPassword(task, password);
        if (task.templatePath() == null || task.templatePath().isBlank()) {
            return Optional.empty();
        }
        Path template = Paths.get(task.templatePath());
        if (!Files.isRegularFile(template)) {
            log.warn("Template {} of task {} is missing", template, slug);
            return Optional.empty();
        }
        return Optional.of(template);
    }

    public List<Submission> listSubmissions(String slug) {
        return repository.listSubmissions(getBySlug(slug).id());
    }

    private void checkLive(CollectionTask task) {
        if (!task.active()) {
            throw new TaskClosedException("Task " + task.slug() + " is not active");
        }
        if (task.isExpired(Instant.now(clock))) {
            throw new TaskClosedException("Task " + task.slug() + " has expired");
        }
    }

    private void checkPassword(CollectionTask task, String password) {
        if (task.hasPassword() && !passwordVerifier.verify(password, task.passwordHash())) {
            throw new PasswordRejectedException("Password rejected for task " + task.slug());
        }
    }

    private CollectionTask insertWithFreshSlug(CollectionTask draft) {
        int maxRetries = properties.getTasks().getSlugMaxRetries();
        DuplicateKeyException lastConflict = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            CollectionTask candidate = draft.withSlug(slugGenerator.next());
            try {
                repository.insertTask(candidate);
                log.info("Created task {} ({}) with slug {}", candidate.title(), candidate.id(), candidate.slug());
                return candidate;
            } catch (DuplicateKeyException e) {
                lastConflict = e;
                log.warn("Slug {} already taken (attempt {}/{})", candidate.slug(), attempt, maxRetries);
            }
        }
        throw new SlugConflictException(maxRetries, lastConflict);
    }
}
