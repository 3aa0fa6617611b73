package com.lanhub.collector.intake.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.NewSubmission;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.model.VersioningMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class TaskJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(TaskJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public TaskJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts a task row. A slug collision surfaces as
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void insertTask(CollectionTask task) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", task.id())
            .addValue("slug", task.slug())
            .addValue("title", task.title())
            .addValue("taskType", task.taskType().name())
            .addValue("templatePath", task.templatePath())
            .addValue("collectionPath", task.collectionPath())
            .addValue("versioningMode", task.versioningMode().name())
            .addValue("maxLimit", task.maxLimit())
            .addValue("currentCount", task.currentCount())
            .addValue("passwordHash", task.passwordHash())
            .addValue("expiresAt", toTimestamp(task.expiresAt()))
            .addValue("active", task.active())
            .addValue("allowAttachments", task.allowAttachments())
            .addValue("createdAt", toTimestamp(task.createdAt()));
        jdbc.update(
            """
                INSERT INTO tasks (
                    id,
                    slug,
                    title,
                    task_type,
                    template_path,
                    collection_path,
                    versioning_mode,
                    max_limit,
                    current_count,
                    password_hash,
                    expires_at,
                    active,
                    allow_attachments,
                    created_at
                )
                VALUES (
                    :id,
                    :slug,
                    :title,
                    :taskType,
                    :templatePath,
                    :collectionPath,
                    :versioningMode,
                    :maxLimit,
                    :currentCount,
                    :passwordHash,
                    :expiresAt,
                    :active,
                    :allowAttachments,
                    :createdAt
                )
                """,
            params
        );
    }

    public Optional<CollectionTask> findTaskBySlug(String slug) {
        List<CollectionTask> rows = jdbc.query(
            """
                SELECT *
                FROM tasks
                WHERE slug = :slug
                """,
            new MapSqlParameterSource("slug", slug),
            taskRowMapper()
        );
        return rows.stream().findFirst();
    }

    public Optional<CollectionTask> findTaskById(String id) {
        List<CollectionTask> rows = jdbc.query(
            """
                SELECT *
                FROM tasks
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            taskRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<CollectionTask> listTasks() {
        return jdbc.query(
            """
                SELECT *
                FROM tasks
                ORDER BY created_at DESC, id
                """,
            new MapSqlParameterSource(),
            taskRowMapper()
        );
    }

    public int updateActive(String taskId, boolean active) {
        return jdbc.update(
            "UPDATE tasks SET active = :active WHERE id = :taskId",
            new MapSqlParameterSource()
                .addValue("taskId", taskId)
                .addValue("active", active)
        );
    }

    public long insertSubmission(String taskId, NewSubmission submission) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", taskId)
            .addValue("submitterName", submission.submitterName())
            .addValue("contact", submission.contact())
            .addValue("department", submission.department())
            .addValue("originalFilename", submission.originalFilename())
            .addValue("storedFilename", submission.storedFilename())
            .addValue("clientIp", submission.clientIp())
            .addValue("submittedAt", toTimestamp(submission.submittedAt()))
            .addValue("attachmentPaths", writeAttachmentPaths(submission.attachmentPaths()));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO submissions (
                    task_id,
                    submitter_name,
                    contact,
                    department,
                    original_filename,
                    stored_filename,
                    client_ip,
                    submitted_at,
                    attachment_paths
                )
                VALUES (
                    :taskId,
                    :submitterName,
                    :contact,
                    :department,
                    :originalFilename,
                    :storedFilename,
                    :clientIp,
                    :submittedAt,
                    :attachmentPaths
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for submission of task " + taskId);
        }
        return key.longValue();
    }

    /**
     * Conditional increment of the task counter. Returns 0 when the task is already at its
     * limit (or does not exist); a limit of 0 means unlimited.
     */
    public int incrementCountIfBelowLimit(String taskId) {
        return jdbc.update(
            """
                UPDATE tasks
                SET current_count = current_count + 1
                WHERE id = :taskId
                  AND (max_limit = 0 OR current_count < max_limit)
                """,
            new MapSqlParameterSource("taskId", taskId)
        );
    }

    public int decrementCountIfPositive(String taskId) {
        return jdbc.update(
            """
                UPDATE tasks
                SET current_count = current_count - 1
                WHERE id = :taskId
                  AND current_count > 0
                """,
            new MapSqlParameterSource("taskId", taskId)
        );
    }

    public int resetCount(String taskId) {
        return jdbc.update(
            "UPDATE tasks SET current_count = 0 WHERE id = :taskId",
            new MapSqlParameterSource("taskId", taskId)
        );
    }

    public Optional<Submission> findSubmission(long id) {
        List<Submission> rows = jdbc.query(
            """
                SELECT *
                FROM submissions
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            submissionRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<Submission> listSubmissions(String taskId) {
        return jdbc.query(
            """
                SELECT *
                FROM submissions
                WHERE task_id = :taskId
                ORDER BY submitted_at DESC, id DESC
                """,
            new MapSqlParameterSource("taskId", taskId),
            submissionRowMapper()
        );
    }

    public int countSubmissions(String taskId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM submissions WHERE task_id = :taskId",
            new MapSqlParameterSource("taskId", taskId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public int deleteSubmission(long id) {
        return jdbc.update(
            "DELETE FROM submissions WHERE id = :id",
            new MapSqlParameterSource("id", id)
        );
    }

    public int deleteSubmissions(String taskId) {
        return jdbc.update(
            "DELETE FROM submissions WHERE task_id = :taskId",
            new MapSqlParameterSource("taskId", taskId)
        );
    }

    private RowMapper<CollectionTask> taskRowMapper() {
        return (rs, rowNum) -> new CollectionTask(
            rs.getString("id"),
            rs.getString("slug"),
            rs.getString("title"),
            parseEnum(TaskType.class, rs.getString("task_type"), TaskType.FILE_COLLECTION),
            rs.getString("template_path"),
            rs.getString("collection_path"),
            parseEnum(VersioningMode.class, rs.getString("versioning_mode"), VersioningMode.AUTO_VERSION),
            rs.getInt("max_limit"),
            rs.getInt("current_count"),
            rs.getString("password_hash"),
            toInstant(rs.getTimestamp("expires_at")),
            rs.getBoolean("active"),
            rs.getBoolean("allow_attachments"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private RowMapper<Submission> submissionRowMapper() {
        return (rs, rowNum) -> new Submission(
            rs.getLong("id"),
            rs.getString("task_id"),
            rs.getString("submitter_name"),
            rs.getString("contact"),
            rs.getString("department"),
            rs.getString("original_filename"),
            rs.getString("stored_filename"),
            rs.getString("client_ip"),
            toInstant(rs.getTimestamp("submitted_at")),
            readAttachmentPaths(rs.getString("attachment_paths"))
        );
    }

    private String writeAttachmentPaths(List<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(paths);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize attachment paths", e);
        }
    }

    private List<String> readAttachmentPaths(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(raw, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable attachment_paths value: {}", e.getMessage());
            return List.of();
        }
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, String raw, E fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown {} value {}, using {}", type.getSimpleName(), raw, fallback);
            return fallback;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
