package com.lanhub.collector.intake.api;

import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.MergeResult;
import com.lanhub.collector.intake.model.NewTaskRequest;
import com.lanhub.collector.intake.model.Submission;
import com.lanhub.collector.intake.model.TaskMergeRequest;
import com.lanhub.collector.intake.model.TaskView;
import com.lanhub.collector.intake.service.ConsolidationService;
import com.lanhub.collector.intake.service.IngestionGate;
import com.lanhub.collector.intake.service.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {
    private final TaskService taskService;
    private final IngestionGate ingestionGate;
    private final ConsolidationService consolidationService;

    public TaskController(
        TaskService taskService,
        IngestionGate ingestionGate,
        ConsolidationService consolidationService
    ) {
        this.taskService = taskService;
        this.ingestionGate = ingestionGate;
        this.consolidationService = consolidationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TaskView createTask(@RequestBody NewTaskRequest request) {
        return TaskView.from(taskService.createTask(request));
    }

    @GetMapping
    public List<TaskView> listTasks() {
        return taskService.listTasks().stream().map(TaskView::from).toList();
    }

    @GetMapping("/{slug}")
    public TaskView getTask(@PathVariable("slug") String slug) {
        return TaskView.from(taskService.getBySlug(slug));
    }

    @PostMapping("/{slug}/copy")
    @ResponseStatus(HttpStatus.CREATED)
    public TaskView copyTask(
        @PathVariable("slug") String slug,
        @RequestBody(required = false) CopyTaskRequest request
    ) {
        return TaskView.from(taskService.copyTask(slug, request == null ? null : request.title()));
    }

    @PostMapping("/{slug}/active")
    public TaskView setActive(
        @PathVariable("slug") String slug,
        @RequestParam(name = "value", defaultValue = "true") boolean active
    ) {
        return TaskView.from(taskService.setActive(slug, active));
    }

    @GetMapping("/{slug}/submissions")
    public List<Submission> listSubmissions(@PathVariable("slug") String slug) {
        return taskService.listSubmissions(slug);
    }

    @DeleteMapping("/{slug}/submissions")
    public Map<String, Object> clearSubmissions(@PathVariable("slug") String slug) {
        CollectionTask task = taskService.getBySlug(slug);
        int deleted = ingestionGate.clearSubmissions(task.id());
        return Map.of("slug", slug, "deleted", deleted);
    }

    @PostMapping("/{slug}/merge")
    public MergeResult merge(
        @PathVariable("slug") String slug,
        @RequestBody(required = false) TaskMergeRequest request
    ) {
        return consolidationService.mergeTask(slug, request);
    }
}
