package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.NewTaskRequest;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.model.VersioningMode;
import com.lanhub.collector.intake.persistence.TaskJdbcRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {
    private static final Instant NOW = Instant.parse("2026-01-03T16:45:30Z");

    @Mock
    private TaskJdbcRepository repository;
    @Mock
    private SlugGenerator slugGenerator;

    private final PasswordVerifier passwordVerifier = new PasswordVerifier();
    private final CollectorProperties properties = new CollectorProperties();

    @Test
    void slugCollisionIsRetriedWithAFreshSlug() {
        when(slugGenerator.next()).thenReturn("AAAAAAAAAAAAAA", "BBBBBBBBBBBBBB");
        doThrow(new DuplicateKeyException("slug taken")).doNothing().when(repository).insertTask(any());

        CollectionTask created = service().createTask(request("Budget 2026", 0, null));

        assertEquals("BBBBBBBBBBBBBB", created.slug());
        verify(repository, times(2)).insertTask(any());
    }

    @Test
    void exhaustedSlugRetriesFailWithConflict() {
        when(slugGenerator.next()).thenReturn("AAAAAAAAAAAAAA");
        DuplicateKeyException conflict = new DuplicateKeyException("slug taken");
        doThrow(conflict).when(repository).insertTask(any());

        SlugConflictException error = assertThrows(
            SlugConflictException.class,
            () -> service().createTask(request("Budget", 0, null))
        );

        assertSame(conflict, error.getCause());
        verify(repository, times(properties.getTasks().getSlugMaxRetries())).insertTask(any());
    }

    @Test
    void createTaskAppliesDefaultsAndHashesPassword() {
        properties.getStorage().setRoot("/srv/collect");
        when(slugGenerator.next()).thenReturn("CCCCCCCCCCCCCC");
        doNothing().when(repository).insertTask(any());

        CollectionTask created = service().createTask(new NewTaskRequest("  预算/汇总  ", null, null, null, null, "secret", null, null));

        ArgumentCaptor<CollectionTask> inserted = ArgumentCaptor.forClass(CollectionTask.class);
        verify(repository).insertTask(inserted.capture());
        assertSame(created, inserted.getValue());
        assertEquals("预算/汇总", created.title());
        assertEquals(TaskType.FILE_COLLECTION, created.taskType());
        assertEquals(VersioningMode.AUTO_VERSION, created.versioningMode());
        assertEquals(0, created.currentCount());
        assertEquals(NOW, created.createdAt());
        assertThat(created.passwordHash()).isNotEqualTo("secret").hasSize(64);
        assertEquals(Paths.get("/srv/collect"), Paths.get(created.collectionPath()).getParent());
        assertThat(Paths.get(created.collectionPath()).getFileName().toString()).startsWith("预算汇总-");
    }

    @Test
    void createTaskRejectsBadInput() {
        TaskService service = service();

        assertThrows(IllegalArgumentException.class, () -> service.createTask(request(" ", 0, null)));
        assertThrows(IllegalArgumentException.class, () -> service.createTask(request("Budget", -1, null)));
    }

    @Test
    void copyKeepsFolderAndStartsFromZero() {
        CollectionTask source = task("SRC", true, 10, 7, null, null);
        when(repository.findTaskBySlug("SRC")).thenReturn(Optional.of(source));
        when(slugGenerator.next()).thenReturn("DDDDDDDDDDDDDD");
        doNothing().when(repository).insertTask(any());

        CollectionTask copy = service().copyTask("SRC", "Budget again");

        assertEquals("Budget again", copy.title());
        assertEquals(source.collectionPath(), copy.collectionPath());
        assertEquals(0, copy.currentCount());
        assertEquals(10, copy.maxLimit());
        assertThat(copy.id()).isNotEqualTo(source.id());
    }

    @Test
    void requireOpenTaskChecksStateInOrder() {
        TaskService service = service();
        when(repository.findTaskBySlug("OFF")).thenReturn(Optional.of(task("OFF", false, 0, 0, null, null)));
        when(repository.findTaskBySlug("OLD")).thenReturn(Optional.of(task("OLD", true, 0, 0, null, NOW.minusSeconds(1))));
        when(repository.findTaskBySlug("FULL")).thenReturn(Optional.of(task("FULL", true, 2, 2, null, null)));
        when(repository.findTaskBySlug("PWD")).thenReturn(Optional.of(task("PWD", true, 0, 0, passwordVerifier.hash("secret"), null)));
        when(repository.findTaskBySlug("NOPE")).thenReturn(Optional.empty());

        assertThrows(TaskClosedException.class, () -> service.requireOpenTask("OFF", null));
        assertThrows(TaskClosedException.class, () -> service.requireOpenTask("OLD", null));
        assertThrows(CapacityExceededException.class, () -> service.requireOpenTask("FULL", null));
        assertThrows(PasswordRejectedException.class, () -> service.requireOpenTask("PWD", "wrong"));
        assertThrows(PasswordRejectedException.class, () -> service.requireOpenTask("PWD", null));
        assertEquals("PWD", service.requireOpenTask("PWD", "secret").slug());
        assertThrows(TaskNotFoundException.class, () -> service.requireOpenTask("NOPE", null));
    }

    private TaskService service() {
        return new TaskService(repository, slugGenerator, passwordVerifier, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static NewTaskRequest request(String title, int maxLimit, String password) {
        return new NewTaskRequest(title, TaskType.FILE_COLLECTION, "Budget.csv", VersioningMode.AUTO_VERSION, maxLimit, password, null, false);
    }

    private static CollectionTask task(String slug, boolean active, int maxLimit, int count, String passwordHash, Instant expiresAt) {
        return new CollectionTask(
            "id-" + slug,
            slug,
            "Budget",
            TaskType.FILE_COLLECTION,
            "Budget.csv",
            "/srv/collect/Budget-12345678",
            VersioningMode.AUTO_VERSION,
            maxLimit,
            count,
            passwordHash,
            expiresAt,
            active,
            false,
            NOW.minusSeconds(3600)
        );
    }
}
