package com.lanhub.collector.intake.service;

import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.NewSubmission;
import com.lanhub.collector.intake.model.NewTaskRequest;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.model.VersioningMode;
import com.lanhub.collector.intake.persistence.TaskJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class IngestionGateTest {

    @Autowired
    private IngestionGate gate;

    @Autowired
    private TaskService taskService;

    @Autowired
    private TaskJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void recordingIncrementsAndDeletingReleasesTheSlot() {
        CollectionTask task = newTask(5);
        Submission first = gate.recordSubmission(task.id(), submission("Alice"));
        gate.recordSubmission(task.id(), submission("Bob"));
        assertEquals(2, currentCount(task));

        Optional<Submission> deleted = gate.deleteSubmission(first.id());

        assertTrue(deleted.isPresent());
        assertEquals("Alice", deleted.get().submitterName());
        assertEquals(1, currentCount(task));
        assertEquals(1, repository.countSubmissions(task.id()));
        assertTrue(gate.deleteSubmission(first.id()).isEmpty());
        assertEquals(1, currentCount(task));
    }

    @Test
    void counterNeverDropsBelowZero() {
        CollectionTask task = newTask(0);
        Submission recorded = gate.recordSubmission(task.id(), submission("Alice"));
        jdbc.update(
            "UPDATE tasks SET current_count = 0 WHERE id = :id",
            new MapSqlParameterSource("id", task.id())
        );

        gate.deleteSubmission(recorded.id());

        assertEquals(0, currentCount(task));
    }

    @Test
    void clearingRemovesRowsAndResetsCounter() {
        CollectionTask task = newTask(0);
        gate.recordSubmission(task.id(), submission("Alice"));
        gate.recordSubmission(task.id(), submission("Bob"));
        gate.recordSubmission(task.id(), submission("Carol"));

        int cleared = gate.clearSubmissions(task.id());

        assertEquals(3, cleared);
        assertEquals(0, currentCount(task));
        assertTrue(repository.listSubmissions(task.id()).isEmpty());
    }

    @Test
    void attachmentPathsSurviveTheRoundTrip() {
        CollectionTask task = newTask(0);
        NewSubmission withAttachments = new NewSubmission(
            "Alice",
            "13800000000",
            "Sales",
            "budget.csv",
            "Budget-Alice-Sales_v1-20260103-164530.csv",
            "10.0.0.8",
            Instant.parse("2026-01-03T16:45:30Z"),
            List.of("Alice-Sales/photo_v1.png", "Alice-Sales/scan_v1.pdf")
        );

        Submission recorded = gate.recordSubmission(task.id(), withAttachments);

        Submission loaded = repository.findSubmission(recorded.id()).orElseThrow();
        assertEquals(List.of("Alice-Sales/photo_v1.png", "Alice-Sales/scan_v1.pdf"), loaded.attachmentPaths());
        assertEquals("10.0.0.8", loaded.clientIp());
    }

    private CollectionTask newTask(int maxLimit) {
        return taskService.createTask(new NewTaskRequest(
            "Gate " + maxLimit,
            TaskType.FILE_COLLECTION,
            "Budget.csv",
            VersioningMode.AUTO_VERSION,
            maxLimit,
            null,
            null,
            false
        ));
    }

    private int currentCount(CollectionTask task) {
        return repository.findTaskById(task.id()).orElseThrow().currentCount();
    }

    static NewSubmission submission(String name) {
        return new NewSubmission(
            name,
            "13800000000",
            "Sales",
            "budget.csv",
            "Budget-" + name + "-Sales_v1-20260103-164530.csv",
            "127.0.0.1",
            Instant.parse("2026-01-03T16:45:30Z"),
            List.of()
        );
    }
}
