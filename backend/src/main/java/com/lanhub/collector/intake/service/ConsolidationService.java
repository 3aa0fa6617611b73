package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.merge.StatisticsMergeService;
import com.lanhub.collector.intake.merge.TabularMergeRequest;
import com.lanhub.collector.intake.merge.TabularMergeService;
import com.lanhub.collector.intake.model.CollectionTask;
import com.lanhub.collector.intake.model.MergeResult;
import com.lanhub.collector.intake.model.TaskMergeRequest;
import com.lanhub.collector.intake.model.TaskType;
import com.lanhub.collector.intake.storage.SubmissionStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Merges a task's collection folder into one output file, tabular for file-collection tasks and
 * statistics for data-collection tasks.
 */
@Service
public class ConsolidationService {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationService.class);

    private final TaskService taskService;
    private final SubmissionStorage storage;
    private final TabularMergeService tabularMergeService;
    private final StatisticsMergeService statisticsMergeService;
    private final CollectorProperties properties;

    public ConsolidationService(
        TaskService taskService,
        SubmissionStorage storage,
        TabularMergeService tabularMergeService,
        StatisticsMergeService statisticsMergeService,
        CollectorProperties properties
    ) {
        this.taskService = taskService;
        this.storage = storage;
        this.tabularMergeService = tabularMergeService;
        this.statisticsMergeService = statisticsMergeService;
        this.properties = properties;
    }

    public MergeResult mergeTask(String slug, TaskMergeRequest request) {
        CollectionTask task = taskService.getBySlug(slug);
        TaskMergeRequest options = request == null
            ? new TaskMergeRequest(null, null, null, null, null, null)
            : request;
        Path source = storage.collectionFolder(task);
        Path output = resolveOutput(source, options.outputPath());
        log.info("Merging task {} ({}) from {} into {}", slug, task.taskType(), source, output);

        MergeResult result;
        if (task.taskType() == TaskType.DATA_COLLECTION) {
            if (task.templatePath() == null || task.templatePath().isBlank()) {
                return MergeResult.failed("Task " + slug + " has no schema file");
            }
            result = statisticsMergeService.mergeStatistics(
                Paths.get(task.templatePath()),
                source,
                output,
                options.fieldOverrides()
            );
        } else {
            result = tabularMergeService.mergeLatest(new TabularMergeRequest(
                source,
                output,
                Boolean.TRUE.equals(options.removeDuplicates()),
                options.dedupColumns(),
                options.separator() == null ? properties.getMerge().getSeparator() : options.separator(),
                task.templatePath() == null || task.templatePath().isBlank() ? null : Paths.get(task.templatePath()),
                options.headerRowIndex() == null ? properties.getMerge().getHeaderRowIndex() : options.headerRowIndex()
            ));
        }
        if (!result.success()) {
            log.warn("Merge of task {} failed: {}", slug, result.errorMessage());
        }
        return result;
    }

    /**
     * Requested outputs resolve against the storage root and must stay inside it. Without a
     * request the output sits next to the collection folder.
     */
    private Path resolveOutput(Path source, String requested) {
        if (requested == null || requested.isBlank()) {
            String extension = properties.getMerge().getTabularExtension();
            return source.resolveSibling(source.getFileName() + "_merged" + extension);
        }
        Path root = Paths.get(properties.getStorage().getRoot()).toAbsolutePath().normalize();
        Path output;
        try {
            output = root.resolve(requested.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new InvalidSubmissionException("Invalid output path " + requested + ": " + e.getReason());
        }
        if (!output.startsWith(root) || output.equals(root)) {
            log.warn("Rejected merge output {} outside {}", output, root);
            throw new InvalidSubmissionException("Output path must stay inside the storage root");
        }
        return output;
    }
}
