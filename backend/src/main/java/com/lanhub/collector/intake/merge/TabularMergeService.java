package com.lanhub.collector.intake.merge;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class TabularMergeService {
    private static final Logger log = LoggerFactory.getLogger(TabularMergeService.class);

    private final LatestVersionSelector selector;
    private final TabularRowStore rowStore;
    private final OutputReplacer outputReplacer;
    private final CollectorProperties properties;

    public TabularMergeService(
        LatestVersionSelector selector,
        TabularRowStore rowStore,
        OutputReplacer outputReplacer,
        CollectorProperties properties
    ) {
        this.selector = selector;
        this.rowStore = rowStore;
        this.outputReplacer = outputReplacer;
        this.properties = properties;
    }

    public MergeResult mergeLatest(TabularMergeRequest request) {
        Path source = request.sourceFolder();
        if (source == null || !Files.isDirectory(source)) {
            log.warn("Merge source folder {} does not exist", source);
            return MergeResult.failed("Source folder does not exist: " + source);
        }

        LatestVersionSelection selection;
        try {
            selection = selector.selectLatest(source, properties.getMerge().getTabularExtension(), request.outputPath());
        } catch (IOException e) {
            log.error("Failed to list {}", source, e);
            return MergeResult.failed("Failed to list " + source + ": " + e.getMessage());
        }

        List<String> canonical = new ArrayList<>(templateHeaders(request));
        boolean dedup = request.removeDuplicates() && !request.dedupColumns().isEmpty();
        Set<List<String>> seenKeys = new HashSet<>();
        List<List<String>> output = new ArrayList<>();
        int totalRecords = 0;

        for (Path file : selection.selected()) {
            TabularSheet sheet;
            try {
                sheet = rowStore.readSheet(file, request.headerRowIndex());
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable file {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            if (sheet.headers().isEmpty()) {
                log.warn("Skipping {}: no header at row {}", file.getFileName(), request.headerRowIndex());
                continue;
            }
            if (canonical.isEmpty()) {
                canonical.addAll(sheet.headers());
                log.info("Using headers of {} as output columns: {}", file.getFileName(), canonical);
            }

            int[] mapping = mapColumns(canonical, sheet.headers());
            totalRecords += sheet.rows().size();

            if (!dedup) {
                for (List<String> row : sheet.rows()) {
                    output.add(project(row, mapping));
                }
                continue;
            }

            List<Integer> keyColumns = dedupColumnIndexes(canonical, request.dedupColumns());
            boolean resolvable = keyColumns.stream().anyMatch(index -> mapping[index] >= 0);
            if (!resolvable) {
                log.warn("File {} has no matching dedup columns, adding all rows without deduplication", file.getFileName());
                for (List<String> row : sheet.rows()) {
                    output.add(project(row, mapping));
                }
                continue;
            }

            int kept = 0;
            int skipped = 0;
            for (List<String> row : sheet.rows()) {
                List<String> key = dedupKey(row, mapping, keyColumns);
                if (key == null || !seenKeys.add(key)) {
                    if (key != null) {
                        log.debug("Duplicate key {} in {}", String.join(request.separator(), key), file.getFileName());
                    }
                    skipped++;
                    continue;
                }
                output.add(project(row, mapping));
                kept++;
            }
            log.debug("File {}: kept {} rows, skipped {} rows", file.getFileName(), kept, skipped);
        }

        int kept = output.size();
        int duplicated = dedup ? totalRecords - kept : 0;
        List<String> headers = List.copyOf(canonical);
        try {
            outputReplacer.replace(request.outputPath(), temp -> rowStore.writeRows(temp, headers, output));
        } catch (IOException | RuntimeException e) {
            return MergeResult.failed(selection.totalFiles(), "Failed to write " + request.outputPath() + ": " + e.getMessage());
        }

        MergeResult result = new MergeResult(
            selection.totalFiles(),
            selection.excludedCount(),
            selection.selected().size(),
            totalRecords,
            dedup ? kept : totalRecords,
            duplicated,
            request.outputPath().toString(),
            true,
            null
        );
        log.info("Merge of {} complete: {}", source, result.summary());
        return result;
    }

    private List<String> templateHeaders(TabularMergeRequest request) {
        Path template = request.templatePath();
        if (template == null) {
            return List.of();
        }
        if (!Files.isRegularFile(template)) {
            log.warn("Template {} not found, using the first file's headers", template);
            return List.of();
        }
        if (template.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            log.warn("Template {} is a JSON schema, not a table; ignoring it for tabular merge", template);
            return List.of();
        }
        try {
            List<String> headers = rowStore.readHeaders(template, request.headerRowIndex());
            if (headers.isEmpty()) {
                log.warn("Template {} has no header at row {}", template, request.headerRowIndex());
            }
            return headers;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read template {}: {}", template, e.getMessage());
            return List.of();
        }
    }

    /**
     * For each canonical column, the index of the source column with the same name ignoring
     * case, or -1.
     */
    static int[] mapColumns(List<String> canonical, List<String> sourceHeaders) {
        int[] mapping = new int[canonical.size()];
        for (int i = 0; i < canonical.size(); i++) {
            mapping[i] = -1;
            for (int j = 0; j < sourceHeaders.size(); j++) {
                if (sourceHeaders.get(j).equalsIgnoreCase(canonical.get(i))) {
                    mapping[i] = j;
                    break;
                }
            }
        }
        return mapping;
    }

    private List<Integer> dedupColumnIndexes(List<String> canonical, List<String> requested) {
        List<Integer> indexes = new ArrayList<>();
        for (String column : requested) {
            for (int i = 0; i < canonical.size(); i++) {
                if (canonical.get(i).equalsIgnoreCase(column.trim())) {
                    indexes.add(i);
                    break;
                }
            }
        }
        return indexes;
    }

    // compared cell by cell; null when every key part is blank
    private List<String> dedupKey(List<String> row, int[] mapping, List<Integer> keyColumns) {
        List<String> parts = new ArrayList<>(keyColumns.size());
        boolean anyValue = false;
        for (int index : keyColumns) {
            int source = mapping[index];
            String value = source >= 0 && source < row.size() && row.get(source) != null ? row.get(source) : "";
            anyValue |= !value.isBlank();
            parts.add(value);
        }
        return anyValue ? List.copyOf(parts) : null;
    }

    private List<String> project(List<String> row, int[] mapping) {
        List<String> projected = new ArrayList<>(mapping.length);
        for (int source : mapping) {
            projected.add(source >= 0 && source < row.size() ? row.get(source) : null);
        }
        return projected;
    }
}
