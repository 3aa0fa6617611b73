package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.NewSubmission;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.SubmissionReceipt;
import com.lanhub.collector.intake.model.SubmitterInfo;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.model.VersioningMode;
import com.lanhub.collector.intake.storage.IncomingFile;
import com.lanhub.collector.intake.storage.StoredArtifact;
import com.lanhub.collector.intake.storage.SubmissionStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubmissionServiceTest {
    private static final Instant NOW = Instant.parse("2026-01-03T16:45:30Z");
    private static final Path STORED = Path.of("/srv/collect/Budget/Budget-Alice-Sales_v1-20260103-164530.csv");

    @Mock
    private TaskService taskService;
    @Mock
    private IngestionGate ingestionGate;
    @Mock
    private SubmissionStorage storage;

    private final CollectorProperties properties = new CollectorProperties();

    @Test
    void acceptedSubmissionIsRecordedWithStoredName() {
        CollectionTask task = task(true);
        when(taskService.requireOpenTask("SLUG", "pw")).thenReturn(task);
        when(storage.storeSubmission(eq(task), eq("Alice"), eq("Sales"), eq("budget.csv"), any()))
            .thenReturn(new StoredArtifact(STORED, 1));
        when(storage.storeAttachments(task, "Alice", "Sales", List.of())).thenReturn(List.of());
        when(ingestionGate.recordSubmission(eq(task.id()), any())).thenAnswer(invocation -> {
            NewSubmission row = invocation.getArgument(1);
            return new Submission(
                42L,
                task.id(),
                row.submitterName(),
                row.contact(),
                row.department(),
                row.originalFilename(),
                row.storedFilename(),
                row.clientIp(),
                row.submittedAt(),
                row.attachmentPaths()
            );
        });

        SubmissionReceipt receipt = service().submitFile("SLUG", "pw", submitter(" 13800000000 "), file("budget.csv"), null);

        assertEquals(42L, receipt.submissionId());
        assertEquals("Budget-Alice-Sales_v1-20260103-164530.csv", receipt.filename());
        assertEquals("13800000000", receipt.contact());
        ArgumentCaptor<NewSubmission> row = ArgumentCaptor.forClass(NewSubmission.class);
        verify(ingestionGate).recordSubmission(eq(task.id()), row.capture());
        assertEquals(NOW, row.getValue().submittedAt());
        assertEquals("10.0.0.8", row.getValue().clientIp());
    }

    @Test
    void refusedSubmissionRemovesItsFiles() {
        CollectionTask task = task(true);
        List<IncomingFile> attachments = List.of(file("photo.png"));
        when(taskService.requireOpenTask("SLUG", null)).thenReturn(task);
        when(storage.storeSubmission(eq(task), anyString(), anyString(), anyString(), any()))
            .thenReturn(new StoredArtifact(STORED, 1));
        when(storage.storeAttachments(task, "Alice", "Sales", attachments)).thenReturn(List.of("Alice-Sales/photo_v1.png"));
        when(ingestionGate.recordSubmission(eq(task.id()), any())).thenThrow(new CapacityExceededException(task.id()));

        assertThrows(
            CapacityExceededException.class,
            () -> service().submitFile("SLUG", null, submitter("13800000000"), file("budget.csv"), attachments)
        );

        verify(storage).discard(STORED);
        verify(storage).discardAttachments(task, List.of("Alice-Sales/photo_v1.png"));
    }

    @Test
    void failedAttachmentRemovesTheMainFile() {
        CollectionTask task = task(true);
        List<IncomingFile> attachments = List.of(file("photo.png"));
        when(taskService.requireOpenTask("SLUG", null)).thenReturn(task);
        when(storage.storeSubmission(eq(task), anyString(), anyString(), anyString(), any()))
            .thenReturn(new StoredArtifact(STORED, 1));
        when(storage.storeAttachments(eq(task), anyString(), anyString(), anyList()))
            .thenThrow(new IllegalStateException("disk full"));

        assertThrows(
            IllegalStateException.class,
            () -> service().submitFile("SLUG", null, submitter("13800000000"), file("budget.csv"), attachments)
        );

        verify(storage).discard(STORED);
        verifyNoInteractions(ingestionGate);
    }

    @Test
    void attachmentsAreRefusedWhenTaskDoesNotAllowThem() {
        when(taskService.requireOpenTask("SLUG", null)).thenReturn(task(false));

        assertThrows(
            InvalidSubmissionException.class,
            () -> service().submitFile("SLUG", null, submitter("13800000000"), file("budget.csv"), List.of(file("photo.png")))
        );

        verify(storage, never()).storeSubmission(any(), any(), any(), any(), any());
    }

    @Test
    void oversizedFileIsRejectedBeforeTouchingTheTask() {
        properties.getStorage().setMaxFileSizeBytes(4);

        assertThrows(
            InvalidSubmissionException.class,
            () -> service().submitFile("SLUG", null, submitter("13800000000"), file("budget.csv"), null)
        );

        verifyNoInteractions(taskService, storage, ingestionGate);
    }

    @Test
    void disallowedExtensionIsRejectedBeforeTouchingTheTask() {
        assertThrows(
            InvalidSubmissionException.class,
            () -> service().submitFile("SLUG", null, submitter("13800000000"), file("setup.exe"), null)
        );

        verifyNoInteractions(taskService, storage, ingestionGate);
    }

    @Test
    void binaryContentBehindCsvNameIsRejected() {
        byte[] png = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A, 0x00, 0x00};
        IncomingFile disguised = new IncomingFile("budget.csv", png.length, new ByteArrayResource(png));

        assertThrows(
            InvalidSubmissionException.class,
            () -> service().submitFile("SLUG", null, submitter("13800000000"), disguised, null)
        );

        verifyNoInteractions(taskService, storage, ingestionGate);
    }

    @Test
    void configuredExtensionsAreCaseInsensitive() {
        properties.getStorage().setAllowedExtensions(List.of(".csv", ".txt"));
        when(taskService.requireOpenTask("SLUG", null)).thenThrow(new TaskClosedException("SLUG"));

        assertThrows(
            TaskClosedException.class,
            () -> service().submitFile("SLUG", null, submitter("13800000000"), file("BUDGET.TXT"), null)
        );
    }

    @Test
    void submitterDetailsAreValidated() {
        assertThrows(InvalidSubmissionException.class, () -> SubmissionService.validateSubmitter(null));
        assertThrows(
            InvalidSubmissionException.class,
            () -> SubmissionService.validateSubmitter(new SubmitterInfo(" ", "13800000000", "Sales", null))
        );
        assertThrows(
            InvalidSubmissionException.class,
            () -> SubmissionService.validateSubmitter(new SubmitterInfo("Alice", "123", "Sales", null))
        );
        assertThrows(
            InvalidSubmissionException.class,
            () -> SubmissionService.validateSubmitter(new SubmitterInfo("Alice", "138000000001", "Sales", null))
        );
        assertThrows(
            InvalidSubmissionException.class,
            () -> SubmissionService.validateSubmitter(new SubmitterInfo("Alice", "13800000000", "", null))
        );
        SubmissionService.validateSubmitter(new SubmitterInfo("Alice", "1234", "Sales", null));
    }

    private SubmissionService service() {
        return new SubmissionService(taskService, ingestionGate, storage, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SubmitterInfo submitter(String contact) {
        return new SubmitterInfo("Alice", contact, "Sales", "10.0.0.8");
    }

    private static IncomingFile file(String name) {
        byte[] bytes = "name,amount\nAlice,10\n".getBytes(StandardCharsets.UTF_8);
        return new IncomingFile(name, bytes.length, new ByteArrayResource(bytes));
    }

    private static CollectionTask task(boolean allowAttachments) {
        return new CollectionTask(
            "task-1",
            "SLUG",
            "Budget",
            TaskType.FILE_COLLECTION,
            "Budget.csv",
            "/srv/collect/Budget",
            VersioningMode.AUTO_VERSION,
            0,
            0,
            null,
            null,
            true,
            allowAttachments,
            NOW
        );
    }
}
