package com.lanhub.collector.intake.api;

import com.lanhub.collector.intake.merge.CsvTabularRowStore;
import com.lanhub.collector.intake.model.FieldMergeOverride;
import com.lanhub.collector.intake.model.MergeMode;
import com.lanhub.collector.intake.model.MergeResult;
import com.lanhub.collector.intake.model.NewTaskRequest;
import com.lanhub.collector.intake.model.SubmissionReceipt;
import com.lanhub.collector.intake.model.TableSchema;
import com.lanhub.collector.intake.model.TaskMergeRequest;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.model.TaskView;
import com.lanhub.collector.intake.service.InvalidSubmissionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DataCollectionEndpointTest {

    @Autowired
    private TaskController taskController;

    @Autowired
    private SubmissionController submissionController;

    @TempDir
    Path workspace;

    @Test
    void recordsAreStoredAndMergedIntoStatistics() throws IOException {
        TaskView task = dataTask();

        submitData(task.slug(), "Alice", "Sales", Map.of("人数", 2, "参加", true));
        submitData(task.slug(), "Bob", "Sales", Map.of("人数", 3, "参加", false));
        SubmissionReceipt receipt = submitData(task.slug(), "Carol", "Ops", Map.of("人数", 4, "参加", "是"));

        assertThat(receipt.filename()).startsWith("Carol_Ops_").endsWith(".json");
        assertEquals(0, receipt.attachmentCount());
        assertEquals(3, taskController.getTask(task.slug()).currentCount());

        MergeResult result = taskController.merge(
            task.slug(),
            new TaskMergeRequest(null, null, null, null, null, Map.of("人数", new FieldMergeOverride(MergeMode.GROUP_BY, null)))
        );

        assertTrue(result.success(), result.errorMessage());
        assertEquals(3, result.totalRecords());
        List<List<String>> rows = new CsvTabularRowStore().readSheet(Paths.get(result.outputPath()), 0).rows();
        assertThat(rows).contains(
            List.of("人数", "数字", "3", "5", "Sales：5"),
            List.of("人数", "数字", "3", "4", "Ops：4"),
            List.of("参加", "双选框(是/否)", "3", "是(1) 否(1)", "Sales：是(1) 否(1)"),
            List.of("参加", "双选框(是/否)", "3", "是(1) 否(0)", "Ops：是(1) 否(0)"),
            List.of("所属部门", "文本", "3", "共 2 个不同值", "Sales、Ops")
        );
    }

    @Test
    void schemaIsServedAndRequiredFieldsEnforced() throws IOException {
        TaskView task = dataTask();

        TableSchema schema = submissionController.getSchema(task.slug());

        assertEquals("活动报名", schema.title());
        assertEquals(List.of("人数", "参加"), schema.columns().stream().map(column -> column.name()).toList());
        assertThrows(
            InvalidSubmissionException.class,
            () -> submitData(task.slug(), "Alice", "Sales", Map.of("参加", true))
        );
        assertEquals(0, taskController.getTask(task.slug()).currentCount());
    }

    @Test
    void formSubmissionStoresAttachmentsNextToTheRecord() throws IOException {
        TaskView task = dataTask(true);
        MockMultipartFile photo = new MockMultipartFile("attachment", "photo.png", "image/png", new byte[]{1, 2, 3});

        SubmissionReceipt receipt = submissionController.submitDataWithAttachments(
            task.slug(),
            "Dave",
            "13800000000",
            "Ops",
            null,
            "{\"人数\": 5, \"参加\": true}",
            List.of(photo),
            new MockHttpServletRequest()
        );

        assertEquals(1, receipt.attachmentCount());
        assertTrue(Files.isRegularFile(Paths.get(task.collectionPath()).resolve("Dave-Ops").resolve("photo_v1.png")));
        assertEquals(
            List.of("Dave-Ops/photo_v1.png"),
            taskController.listSubmissions(task.slug()).get(0).attachmentPaths()
        );
    }

    @Test
    void formSubmissionNeedsJsonDataAndAnAttachmentEnabledTask() throws IOException {
        TaskView task = dataTask();
        MockMultipartFile photo = new MockMultipartFile("attachment", "photo.png", "image/png", new byte[]{1, 2, 3});

        assertThrows(
            InvalidSubmissionException.class,
            () -> submissionController.submitDataWithAttachments(
                task.slug(), "Dave", "13800000000", "Ops", null, "人数=5", List.of(), new MockHttpServletRequest()
            )
        );
        assertThrows(
            InvalidSubmissionException.class,
            () -> submissionController.submitDataWithAttachments(
                task.slug(), "Dave", "13800000000", "Ops", null, "{\"人数\": 5}", List.of(photo), new MockHttpServletRequest()
            )
        );
        assertEquals(0, taskController.getTask(task.slug()).currentCount());
    }

    private TaskView dataTask() throws IOException {
        return dataTask(false);
    }

    private TaskView dataTask(boolean allowAttachments) throws IOException {
        Path schema = workspace.resolve("signup.json");
        Files.writeString(schema, """
            {"title": "活动报名", "columns": [
              {"name": "人数", "type": "Number", "required": true},
              {"name": "参加", "type": "Boolean", "mergeMode": 1, "groupByField": "所属部门"}
            ]}
            """, StandardCharsets.UTF_8);
        return taskController.createTask(new NewTaskRequest(
            "Signup", TaskType.DATA_COLLECTION, schema.toString(), null, 0, null, null, allowAttachments
        ));
    }

    private SubmissionReceipt submitData(String slug, String name, String department, Map<String, Object> data) {
        return submissionController.submitData(
            slug,
            new DataSubmitRequest(name, "13800000000", department, null, data),
            new MockHttpServletRequest()
        );
    }
}
