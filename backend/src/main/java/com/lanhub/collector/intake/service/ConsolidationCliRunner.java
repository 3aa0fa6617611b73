package com.lanhub.collector.intake.service;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.MergeResult;
import com.lanhub.collector.intake.model.TaskMergeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class ConsolidationCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationCliRunner.class);

    private final CollectorProperties properties;
    private final ConsolidationService consolidationService;
    private final ConfigurableApplicationContext applicationContext;

    public ConsolidationCliRunner(
        CollectorProperties properties,
        ConsolidationService consolidationService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.consolidationService = consolidationService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        String slug = properties.getCli().getTaskSlug();
        if (slug == null || slug.isBlank()) {
            log.error("collector.cli.task-slug is required when collector.cli.run=true");
            exit(2);
            return;
        }

        List<String> dedupColumns = Arrays.stream(properties.getCli().getDedupColumns().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        String output = properties.getCli().getOutput();
        TaskMergeRequest request = new TaskMergeRequest(
            output == null || output.isBlank() ? null : output,
            !dedupColumns.isEmpty(),
            dedupColumns,
            null,
            null,
            null
        );
        MergeResult result = consolidationService.mergeTask(slug.trim(), request);
        log.info("Consolidation of {}: {}", slug, result.summary());
        exit(result.success() ? 0 : 1);
    }

    private void exit(int code) {
        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }
}
