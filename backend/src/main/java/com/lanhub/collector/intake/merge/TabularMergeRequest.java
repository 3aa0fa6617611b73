package com.lanhub.collector.intake.merge;

import java.nio.file.Path;
import java.util.List;

public record TabularMergeRequest(
    Path sourceFolder,
    Path outputPath,
    boolean removeDuplicates,
    List<String> dedupColumns,
    String separator,
    Path templatePath,
    int headerRowIndex
) {
    public TabularMergeRequest {
        dedupColumns = dedupColumns == null ? List.of() : List.copyOf(dedupColumns);
        separator = separator == null || separator.isEmpty() ? "|" : separator;
        headerRowIndex = Math.max(0, headerRowIndex);
    }
}
